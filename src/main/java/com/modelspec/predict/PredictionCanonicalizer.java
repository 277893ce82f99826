package com.modelspec.predict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelspec.data.DataFrame;
import com.modelspec.data.Factor;
import com.modelspec.exception.PredictionShapeException;
import com.modelspec.registry.model.PredictionType;

import lombok.experimental.UtilityClass;

/**
 * Brings engine output into the canonical shape of its prediction type and checks that
 * there is one prediction per input row.
 */
@UtilityClass
class PredictionCanonicalizer {

    Object canonicalize(Object output, PredictionType type, List<String> levels, int expectedRows) {
        Object canonical = switch (type) {
            case CLASS -> toFactor(output, levels);
            case PROB -> toProbabilities(output, levels);
            case NUMERIC -> toNumeric(output);
            default -> output;
        };
        int rows = rowCount(canonical);
        if (rows >= 0 && rows != expectedRows) {
            throw new PredictionShapeException("Prediction of type '" + type.getCode() + "' returned " + rows
                    + " rows for " + expectedRows + " rows of new data");
        }
        return canonical;
    }

    private Factor toFactor(Object output, List<String> levels) {
        if (output instanceof Factor factor) {
            return factor;
        }
        if (output instanceof List<?> values) {
            List<String> labels = values.stream().map(v -> v == null ? null : v.toString()).toList();
            return levels == null ? Factor.of(labels) : Factor.of(labels, levels);
        }
        throw new PredictionShapeException("Class predictions must be a list of labels, got " + typeName(output));
    }

    private DataFrame toProbabilities(Object output, List<String> levels) {
        if (output instanceof DataFrame frame) {
            return frame;
        }
        if (output instanceof double[][] matrix) {
            if (levels == null) {
                throw new PredictionShapeException("Probability matrix cannot be labelled without outcome levels");
            }
            Map<String, List<Double>> columns = new LinkedHashMap<>();
            levels.forEach(level -> columns.put(level, new ArrayList<>(matrix.length)));
            for (double[] row : matrix) {
                if (row.length != levels.size()) {
                    throw new PredictionShapeException("Probability row has " + row.length + " values for "
                            + levels.size() + " outcome levels");
                }
                for (int j = 0; j < row.length; j++) {
                    columns.get(levels.get(j)).add(row[j]);
                }
            }
            return DataFrame.of(columns);
        }
        throw new PredictionShapeException("Probability predictions must be a frame or a matrix, got " + typeName(output));
    }

    private List<Double> toNumeric(Object output) {
        if (output instanceof double[] values) {
            return Arrays.stream(values).boxed().toList();
        }
        if (output instanceof List<?> values) {
            List<Double> numbers = new ArrayList<>(values.size());
            for (Object v : values) {
                if (v != null && !(v instanceof Number)) {
                    throw new PredictionShapeException("Numeric prediction contains a " + typeName(v));
                }
                numbers.add(v == null ? null : ((Number) v).doubleValue());
            }
            return numbers;
        }
        throw new PredictionShapeException("Numeric predictions must be a list of numbers, got " + typeName(output));
    }

    private int rowCount(Object value) {
        if (value instanceof DataFrame frame) {
            return frame.nrow();
        }
        if (value instanceof List<?> list) {
            return list.size();
        }
        if (value instanceof double[][] matrix) {
            return matrix.length;
        }
        if (value instanceof double[] vector) {
            return vector.length;
        }
        return -1;
    }

    private String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
