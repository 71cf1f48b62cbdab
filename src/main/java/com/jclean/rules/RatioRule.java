package com.jclean.rules;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;

import java.util.List;

/**
 * Divides a numeric column by a constant, e.g. a total over the number of subjects.
 */
public class RatioRule extends RowRule {
    private final double divisor;

    public RatioRule(String outputColumn, String numeratorColumn, double divisor) {
        super(outputColumn, List.of(numeratorColumn));
        if (divisor == 0) {
            throw new IllegalArgumentException("divisor cannot be zero");
        }
        this.divisor = divisor;
    }

    @Override
    public ColumnType getOutputType(Schema schema) {
        String numerator = getInputColumns().get(0);
        if (!inputType(schema, numerator).isNumeric()) {
            throw new CleaningException(ErrorKind.AGGREGATION, "Column '" + numerator + "' must be numeric");
        }
        return ColumnType.FLOAT;
    }

    @Override
    protected Value apply(RowView row, ColumnType outputType) {
        Value value = row.get(getInputColumns().get(0));
        return value.isNull() ? Value.NULL : Value.ofFloat(value.asDouble() / divisor);
    }
}
