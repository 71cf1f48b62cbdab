package com.jclean.rules;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.Column;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Appends derived columns to a table. Rules run in order, so a rule may read the
 * output of an earlier one.
 */
public final class RuleApplier {
    private RuleApplier() {
    }

    public static Table apply(Table table, DerivedColumnRule... rules) {
        return apply(table, Arrays.asList(rules));
    }

    /**
     * Returns a new table with one appended column per rule. The input table is
     * not modified; the result keeps its source name.
     *
     * @throws CleaningException COLUMN_NOT_FOUND for a missing input column,
     *         INVALID_ARGUMENT when an output column already exists,
     *         AGGREGATION when an input has the wrong type or a total overflows
     */
    public static Table apply(Table table, List<DerivedColumnRule> rules) {
        Table current = table;
        for (DerivedColumnRule rule : rules) {
            for (String input : rule.getInputColumns()) {
                current.requireColumn(input);
            }
            if (current.hasColumn(rule.getOutputColumn())) {
                throw new CleaningException(ErrorKind.INVALID_ARGUMENT,
                    "Column '" + rule.getOutputColumn() + "' already exists");
            }
            ColumnType outputType = rule.getOutputType(current.getSchema());
            List<Value> values = rule.compute(current);
            Schema schema = current.getSchema().withColumn(new Column(rule.getOutputColumn(), outputType));
            List<Row> rows = new ArrayList<>(current.rowCount());
            for (int r = 0; r < current.rowCount(); r++) {
                rows.add(current.getRow(r).append(values.get(r)));
            }
            current = new Table(schema, rows, table.getSourceName().orElse(null));
        }
        return current;
    }
}
