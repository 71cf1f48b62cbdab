package com.jclean.query;

import com.jclean.common.schema.Column;
import com.jclean.common.value.Numbers;
import com.jclean.common.value.Value;
import com.jclean.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes a read-only {@link Summary} of a table.
 */
public class SummaryReporter {

    public Summary summarize(Table table) {
        List<ColumnSummary> columns = new ArrayList<>();
        for (Column column : table.getSchema().getColumns()) {
            List<Value> values = table.getColumnValues(column.getName());
            int missing = (int) values.stream().filter(Value::isNull).count();
            NumericStats stats = column.getType().isNumeric() ? describe(Numbers.nonNull(values)) : null;
            columns.add(new ColumnSummary(column.getName(), column.getType(), missing, stats));
        }
        return new Summary(table.rowCount(), columns);
    }

    static NumericStats describe(double[] values) {
        if (values.length == 0) {
            return new NumericStats(0, Double.NaN, Double.NaN, Double.NaN,
                Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        return new NumericStats(
            values.length,
            Numbers.mean(values),
            Numbers.standardDeviation(values),
            Numbers.percentile(values, 0.0),
            Numbers.percentile(values, 0.25),
            Numbers.percentile(values, 0.5),
            Numbers.percentile(values, 0.75),
            Numbers.percentile(values, 1.0));
    }
}
