package com.jclean.rules;

import com.jclean.common.schema.ColumnType;
import com.jclean.common.value.Value;

import java.util.List;

/**
 * Row total of numeric columns. NULL inputs are skipped; a row with no values totals NULL.
 * An INTEGER total that does not fit a long fails with AGGREGATION.
 */
public class SumRule extends NumericRowRule {

    public SumRule(String outputColumn, List<String> inputColumns) {
        super(outputColumn, inputColumns);
    }

    @Override
    protected Value apply(RowView row, ColumnType outputType) {
        long longTotal = 0;
        double total = 0;
        boolean any = false;
        for (String input : getInputColumns()) {
            Value value = row.get(input);
            if (value.isNull()) {
                continue;
            }
            any = true;
            if (outputType == ColumnType.INTEGER) {
                try {
                    longTotal = Math.addExact(longTotal, value.asLong());
                } catch (ArithmeticException e) {
                    throw overflow(e);
                }
            } else {
                total += value.asDouble();
            }
        }
        if (!any) {
            return Value.NULL;
        }
        return outputType == ColumnType.INTEGER ? Value.ofInteger(longTotal) : Value.ofFloat(total);
    }
}
