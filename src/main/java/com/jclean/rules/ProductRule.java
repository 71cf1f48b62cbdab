package com.jclean.rules;

import com.jclean.common.schema.ColumnType;
import com.jclean.common.value.Value;

import java.util.List;

/**
 * Row product of numeric columns, e.g. quantity times price. Any NULL input gives NULL.
 */
public class ProductRule extends NumericRowRule {

    public ProductRule(String outputColumn, List<String> inputColumns) {
        super(outputColumn, inputColumns);
    }

    @Override
    protected Value apply(RowView row, ColumnType outputType) {
        long longProduct = 1;
        double product = 1;
        for (String input : getInputColumns()) {
            Value value = row.get(input);
            if (value.isNull()) {
                return Value.NULL;
            }
            if (outputType == ColumnType.INTEGER) {
                try {
                    longProduct = Math.multiplyExact(longProduct, value.asLong());
                } catch (ArithmeticException e) {
                    throw overflow(e);
                }
            } else {
                product *= value.asDouble();
            }
        }
        return outputType == ColumnType.INTEGER ? Value.ofInteger(longProduct) : Value.ofFloat(product);
    }
}
