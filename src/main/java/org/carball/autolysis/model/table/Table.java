package org.carball.autolysis.model.table;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a parsed dataset. Row order is the identity axis:
 * row {@code i} of every column belongs to the same record.
 */
@Getter
@ToString
public final class Table {

    private final String name;
    private final List<Column> columns;
    private final int rowCount;

    public Table(String name, List<Column> columns) {
        this.name = name != null ? name : "dataset";
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));

        Set<String> seen = new HashSet<>();
        int rows = -1;
        for (Column column : this.columns) {
            if (!seen.add(column.getName())) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
            if (rows >= 0 && column.size() != rows) {
                throw new IllegalArgumentException(String.format(
                        "Column %s has %d rows, expected %d", column.getName(), column.size(), rows));
            }
            rows = column.size();
        }
        this.rowCount = Math.max(rows, 0);
    }

    public static Table of(String name, Column... columns) {
        return new Table(name, List.of(columns));
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty() || rowCount == 0;
    }

    public Optional<Column> column(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equals(columnName))
                .findFirst();
    }

    public List<Column> numericColumns() {
        return columns.stream()
                .filter(Column::isNumeric)
                .collect(Collectors.toList());
    }
}
