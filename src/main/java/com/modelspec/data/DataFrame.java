package com.modelspec.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelspec.exception.InterfaceMismatchException;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;

/**
 * Column-oriented table with ordered, named columns of equal length.
 *
 * Columns are plain lists; a {@link Factor} column keeps its levels. Instances are
 * immutable, every transformation returns a new frame.
 */
@EqualsAndHashCode
public final class DataFrame {

    private final Map<String, List<?>> columns;
    private final int rowCount;

    @Builder
    private DataFrame(@Singular("column") Map<String, List<?>> columns) {
        Map<String, List<?>> copy = new LinkedHashMap<>();
        int rows = -1;
        for (Map.Entry<String, List<?>> e : columns.entrySet()) {
            List<?> values = e.getValue();
            if (rows >= 0 && values.size() != rows) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' has " + values.size()
                        + " rows, expected " + rows);
            }
            rows = values.size();
            copy.put(e.getKey(), values instanceof Factor ? values : Collections.unmodifiableList(new ArrayList<>(values)));
        }
        this.columns = Collections.unmodifiableMap(copy);
        this.rowCount = Math.max(rows, 0);
    }

    public static DataFrame of(Map<String, ? extends List<?>> columns) {
        DataFrameBuilder builder = builder();
        columns.forEach(builder::column);
        return builder.build();
    }

    public int nrow() {
        return rowCount;
    }

    public int ncol() {
        return columns.size();
    }

    public List<String> names() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<?> column(String name) {
        List<?> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No column named '" + name + "'; columns are " + names());
        }
        return values;
    }

    public Map<String, List<?>> columns() {
        return columns;
    }

    /**
     * Values of one row keyed by column name.
     */
    public Map<String, Object> row(int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        columns.forEach((name, values) -> row.put(name, values.get(index)));
        return row;
    }

    public DataFrame select(List<String> names) {
        DataFrameBuilder builder = builder();
        for (String name : names) {
            builder.column(name, column(name));
        }
        return builder.build();
    }

    public DataFrame slice(List<Integer> rows) {
        DataFrameBuilder builder = builder();
        columns.forEach((name, values) -> {
            if (values instanceof Factor factor) {
                builder.column(name, factor.slice(rows));
            } else {
                List<Object> picked = new ArrayList<>(rows.size());
                for (int row : rows) {
                    picked.add(values.get(row));
                }
                builder.column(name, picked);
            }
        });
        return builder.build();
    }

    public DataFrame withColumn(String name, List<?> values) {
        Map<String, List<?>> copy = new LinkedHashMap<>(columns);
        copy.put(name, values);
        return of(copy);
    }

    public DataFrame without(String name) {
        Map<String, List<?>> copy = new LinkedHashMap<>(columns);
        copy.remove(name);
        return of(copy);
    }

    public boolean isNumeric(String name) {
        List<?> values = column(name);
        if (values instanceof Factor) {
            return false;
        }
        for (Object v : values) {
            if (v != null && !(v instanceof Number)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Row-major numeric matrix of all columns. Missing values become NaN.
     *
     * @throws InterfaceMismatchException if a column is not numeric
     */
    public double[][] toMatrix() {
        for (String name : columns.keySet()) {
            if (!isNumeric(name)) {
                throw new InterfaceMismatchException("Column '" + name + "' is not numeric and cannot be converted to a matrix");
            }
        }
        double[][] matrix = new double[rowCount][columns.size()];
        int j = 0;
        for (List<?> values : columns.values()) {
            for (int i = 0; i < rowCount; i++) {
                Object v = values.get(i);
                matrix[i][j] = v == null ? Double.NaN : ((Number) v).doubleValue();
            }
            j++;
        }
        return matrix;
    }

    /**
     * Stacks frames with identical column names.
     */
    public static DataFrame bindRows(List<DataFrame> frames) {
        if (frames.isEmpty()) {
            return builder().build();
        }
        List<String> names = frames.get(0).names();
        Map<String, List<Object>> merged = new LinkedHashMap<>();
        names.forEach(n -> merged.put(n, new ArrayList<>()));
        for (DataFrame frame : frames) {
            if (!frame.names().equals(names)) {
                throw new IllegalArgumentException("Cannot bind frames with columns " + frame.names() + " and " + names);
            }
            names.forEach(n -> merged.get(n).addAll(frame.column(n)));
        }
        DataFrameBuilder builder = builder();
        for (String name : names) {
            List<?> first = frames.get(0).column(name);
            if (first instanceof Factor factor) {
                @SuppressWarnings("unchecked")
                List<String> values = (List<String>) (List<?>) merged.get(name);
                builder.column(name, Factor.of(values, factor.getLevels()));
            } else {
                builder.column(name, merged.get(name));
            }
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "DataFrame[" + rowCount + " x " + columns.size() + "]" + columns;
    }
}
