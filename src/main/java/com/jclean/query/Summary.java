package com.jclean.query;

import java.util.Collections;
import java.util.List;

/**
 * Shape, per-column types, missing counts and numeric statistics of a table.
 */
public class Summary {
    private final int rowCount;
    private final List<ColumnSummary> columns;

    public Summary(int rowCount, List<ColumnSummary> columns) {
        this.rowCount = rowCount;
        this.columns = Collections.unmodifiableList(columns);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<ColumnSummary> getColumns() {
        return columns;
    }

    public ColumnSummary getColumn(String name) {
        for (ColumnSummary column : columns) {
            if (column.getName().equals(name)) {
                return column;
            }
        }
        throw new IllegalArgumentException("Column '" + name + "' is not in the summary");
    }

    public int getTotalMissing() {
        return columns.stream().mapToInt(ColumnSummary::getMissing).sum();
    }
}
