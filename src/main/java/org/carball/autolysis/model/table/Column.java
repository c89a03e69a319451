package org.carball.autolysis.model.table;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column of cells. A {@code null} cell is a missing value.
 * Numeric columns hold {@link Double} cells, categorical columns hold {@link String} cells.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "cells")
public final class Column {

    private final String name;
    private final ColumnKind kind;
    private final List<Object> cells;

    private Column(String name, ColumnKind kind, List<?> cells) {
        this.name = Objects.requireNonNull(name, "Column name is required");
        this.kind = Objects.requireNonNull(kind, "Column kind is required");
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public static Column numeric(String name, List<Double> values) {
        for (Double value : values) {
            if (value != null && value.isNaN()) {
                throw new IllegalArgumentException(
                        "Column " + name + " contains NaN; use null for missing values");
            }
        }
        return new Column(name, ColumnKind.NUMERIC, values);
    }

    public static Column numeric(String name, Double... values) {
        return numeric(name, nullableList(values));
    }

    public static Column categorical(String name, List<String> values) {
        return new Column(name, ColumnKind.CATEGORICAL, values);
    }

    public static Column categorical(String name, String... values) {
        return categorical(name, nullableList(values));
    }

    public int size() {
        return cells.size();
    }

    public boolean isNumeric() {
        return kind == ColumnKind.NUMERIC;
    }

    public boolean isMissing(int row) {
        return cells.get(row) == null;
    }

    public Double numericValue(int row) {
        if (!isNumeric()) {
            throw new IllegalStateException("Column " + name + " is not numeric");
        }
        return (Double) cells.get(row);
    }

    public String textValue(int row) {
        Object cell = cells.get(row);
        return cell == null ? null : cell.toString();
    }

    public int missingCount() {
        int missing = 0;
        for (Object cell : cells) {
            if (cell == null) {
                missing++;
            }
        }
        return missing;
    }

    /**
     * Non-missing numeric values in row order.
     */
    public double[] presentValues() {
        if (!isNumeric()) {
            throw new IllegalStateException("Column " + name + " is not numeric");
        }
        return cells.stream()
                .filter(Objects::nonNull)
                .mapToDouble(cell -> (Double) cell)
                .toArray();
    }

    @SafeVarargs
    private static <T> List<T> nullableList(T... values) {
        List<T> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return list;
    }
}
