package com.jclean.rules;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Calendar month of a DATETIME column as {@code yyyy-MM} text, e.g. for a monthly
 * spending trend. NULL dates give a NULL month.
 */
public class MonthRule extends RowRule {
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    public MonthRule(String outputColumn, String dateColumn) {
        super(outputColumn, List.of(dateColumn));
    }

    @Override
    public ColumnType getOutputType(Schema schema) {
        String input = getInputColumns().get(0);
        ColumnType type = inputType(schema, input);
        if (type != ColumnType.DATETIME) {
            throw new CleaningException(ErrorKind.AGGREGATION,
                "Column '" + input + "' must be DATETIME to compute '" + getOutputColumn() + "' but is " + type);
        }
        return ColumnType.TEXT;
    }

    @Override
    protected Value apply(RowView row, ColumnType outputType) {
        Value date = row.get(getInputColumns().get(0));
        return date.isNull() ? Value.NULL : Value.ofText(date.asDateTime().format(MONTH));
    }
}
