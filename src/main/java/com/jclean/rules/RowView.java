package com.jclean.rules;

import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;

/**
 * Read access to one row by column name.
 */
public class RowView {
    private final Table table;
    private final Row row;

    RowView(Table table, Row row) {
        this.table = table;
        this.row = row;
    }

    public Value get(String column) {
        return row.get(table.requireColumn(column));
    }
}
