package com.modelspec.data;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Categorical sequence: every non-null value is one of an ordered set of levels.
 *
 * A factor is a read-only {@link List} of its values so it can be used directly as a
 * {@link DataFrame} column.
 */
public final class Factor extends AbstractList<String> {

    private final List<String> values;
    private final List<String> levels;

    private Factor(List<String> values, List<String> levels) {
        this.values = values;
        this.levels = levels;
    }

    /**
     * Builds a factor with explicit levels. Values outside the levels are rejected; nulls
     * are missing values.
     */
    public static Factor of(Collection<String> values, List<String> levels) {
        List<String> lvls = List.copyOf(levels);
        if (new TreeSet<>(lvls).size() != lvls.size()) {
            throw new IllegalArgumentException("Factor levels must be unique: " + lvls);
        }
        List<String> copy = new ArrayList<>(values.size());
        for (String v : values) {
            if (v != null && !lvls.contains(v)) {
                throw new IllegalArgumentException("Value '" + v + "' is not one of the levels " + lvls);
            }
            copy.add(v);
        }
        return new Factor(Collections.unmodifiableList(copy), lvls);
    }

    /**
     * Builds a factor whose levels are the sorted distinct non-null values.
     */
    public static Factor of(Collection<String> values) {
        TreeSet<String> distinct = new TreeSet<>();
        for (String v : values) {
            if (v != null) {
                distinct.add(v);
            }
        }
        return of(values, new ArrayList<>(distinct));
    }

    public List<String> getLevels() {
        return levels;
    }

    /**
     * Zero-based level index of the value at {@code index}, or -1 for a missing value.
     */
    public int code(int index) {
        String v = values.get(index);
        return v == null ? -1 : levels.indexOf(v);
    }

    public Factor slice(List<Integer> rows) {
        List<String> picked = new ArrayList<>(rows.size());
        for (int row : rows) {
            picked.add(values.get(row));
        }
        return new Factor(Collections.unmodifiableList(picked), levels);
    }

    @Override
    public String get(int index) {
        return values.get(index);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Factor other)) return false;
        return levels.equals(other.levels) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, levels);
    }

    @Override
    public String toString() {
        return "Factor" + values + " Levels: " + String.join(" ", levels);
    }
}
