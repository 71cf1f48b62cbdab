package com.jclean.rules;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;

import java.util.List;

/**
 * Row rule over numeric inputs. The output is INTEGER when every input column is
 * INTEGER, FLOAT otherwise.
 */
abstract class NumericRowRule extends RowRule {

    NumericRowRule(String outputColumn, List<String> inputColumns) {
        super(outputColumn, inputColumns);
    }

    @Override
    public ColumnType getOutputType(Schema schema) {
        boolean allIntegers = true;
        for (String input : getInputColumns()) {
            ColumnType type = inputType(schema, input);
            if (!type.isNumeric()) {
                throw new CleaningException(ErrorKind.AGGREGATION, String.format(
                    "Column '%s' must be numeric to compute '%s' but is %s", input, getOutputColumn(), type));
            }
            allIntegers &= type == ColumnType.INTEGER;
        }
        return allIntegers ? ColumnType.INTEGER : ColumnType.FLOAT;
    }

    protected CleaningException overflow(ArithmeticException cause) {
        return new CleaningException(ErrorKind.AGGREGATION,
            "Integer overflow while computing '" + getOutputColumn() + "'", cause);
    }
}
