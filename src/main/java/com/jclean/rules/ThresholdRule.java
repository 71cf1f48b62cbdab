package com.jclean.rules;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;

import java.util.List;

/**
 * Labels a row as passing when every input is at least the threshold, and as
 * failing otherwise. A NULL input fails.
 */
public class ThresholdRule extends RowRule {
    public static final String PASS = "Pass";
    public static final String FAIL = "Fail";

    private final double threshold;
    private final String passLabel;
    private final String failLabel;

    public ThresholdRule(String outputColumn, List<String> inputColumns, double threshold) {
        this(outputColumn, inputColumns, threshold, PASS, FAIL);
    }

    public ThresholdRule(String outputColumn, List<String> inputColumns, double threshold,
                         String passLabel, String failLabel) {
        super(outputColumn, inputColumns);
        this.threshold = threshold;
        this.passLabel = passLabel;
        this.failLabel = failLabel;
    }

    @Override
    public ColumnType getOutputType(Schema schema) {
        for (String input : getInputColumns()) {
            if (!inputType(schema, input).isNumeric()) {
                throw new CleaningException(ErrorKind.AGGREGATION, "Column '" + input + "' must be numeric");
            }
        }
        return ColumnType.TEXT;
    }

    @Override
    protected Value apply(RowView row, ColumnType outputType) {
        for (String input : getInputColumns()) {
            Value value = row.get(input);
            if (value.isNull() || value.asDouble() < threshold) {
                return Value.ofText(failLabel);
            }
        }
        return Value.ofText(passLabel);
    }
}
