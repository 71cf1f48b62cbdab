package com.jclean.rules;

import com.jclean.common.CleaningException;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base for rules whose output depends only on the row itself.
 */
public abstract class RowRule implements DerivedColumnRule {
    private final String outputColumn;
    private final List<String> inputColumns;

    protected RowRule(String outputColumn, List<String> inputColumns) {
        this.outputColumn = Objects.requireNonNull(outputColumn, "outputColumn cannot be null");
        this.inputColumns = List.copyOf(inputColumns);
    }

    @Override
    public String getOutputColumn() {
        return outputColumn;
    }

    @Override
    public List<String> getInputColumns() {
        return inputColumns;
    }

    @Override
    public List<Value> compute(Table table) {
        ColumnType outputType = getOutputType(table.getSchema());
        List<Value> values = new ArrayList<>(table.rowCount());
        for (Row row : table.getRows()) {
            values.add(apply(new RowView(table, row), outputType));
        }
        return values;
    }

    /**
     * Type of an input column.
     *
     * @throws CleaningException COLUMN_NOT_FOUND when the schema has no such column
     */
    protected static ColumnType inputType(Schema schema, String input) {
        int index = schema.indexOf(input);
        if (index < 0) {
            throw CleaningException.columnNotFound(input);
        }
        return schema.getColumn(index).getType();
    }

    /**
     * Computes the output value for one row.
     *
     * @param row The row to read inputs from
     * @param outputType The declared output type for this table
     */
    protected abstract Value apply(RowView row, ColumnType outputType);
}
