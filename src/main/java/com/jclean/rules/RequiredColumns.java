package com.jclean.rules;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a table carries a fixed set of columns before a domain tool runs.
 */
public class RequiredColumns {
    private final List<String> columns;

    public RequiredColumns(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    public static RequiredColumns of(String... columns) {
        return new RequiredColumns(List.of(columns));
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> missingFrom(Table table) {
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!table.hasColumn(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    /**
     * @throws CleaningException PRECONDITION naming the expected and actual columns
     */
    public void check(Table table) {
        List<String> missing = missingFrom(table);
        if (!missing.isEmpty()) {
            throw new CleaningException(ErrorKind.PRECONDITION, String.format(
                "Missing required columns %s. Expected: %s, file columns: %s",
                missing, columns, table.getColumnNames()));
        }
    }
}
