package com.jclean.cleaning;

import com.jclean.common.schema.ColumnType;
import com.jclean.common.value.Value;
import com.jclean.common.value.ValueParser;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a column's values to a new declared type. Values that cannot be
 * represented in the target type become NULL; no single value aborts the change.
 */
public class TypeCoercer {
    private static final Logger logger = LoggerFactory.getLogger(TypeCoercer.class);

    /**
     * Retypes a column in place.
     *
     * @param table The table to modify
     * @param column Column to convert
     * @param target New declared type
     * @return How many values were lost to NULL during the conversion
     * @throws com.jclean.common.CleaningException COLUMN_NOT_FOUND for an unknown column
     */
    public RetypeReport retype(Table table, String column, ColumnType target) {
        ColumnType previous = table.getType(column);
        List<Value> current = table.getColumnValues(column);
        List<Value> converted = new ArrayList<>(current.size());
        int lost = 0;
        for (Value value : current) {
            Value coerced = coerce(value, target);
            if (!value.isNull() && coerced.isNull()) {
                lost++;
            }
            converted.add(coerced);
        }
        table.replaceColumn(column, target, converted);
        logger.debug("Retyped column '{}' from {} to {}, {} values became NULL", column, previous, target, lost);
        return new RetypeReport(column, previous, target, lost);
    }

    /**
     * Converts a single value to the target type.
     *
     * @param value The value to convert
     * @param target The type to convert to
     * @return A value tagged with {@code target}, or NULL if it does not convert
     */
    public static Value coerce(Value value, ColumnType target) {
        if (value.isNull() || value.getType() == target) {
            return value;
        }
        switch (target) {
            case INTEGER:
                return toInteger(value);
            case FLOAT:
                return toFloat(value);
            case DATETIME:
                return value.getType() == ColumnType.TEXT
                    ? ValueParser.parseDateTime(value.asText())
                    : Value.NULL;
            default:
                return Value.ofText(value.toText());
        }
    }

    private static Value toInteger(Value value) {
        switch (value.getType()) {
            case FLOAT:
                return integral(value.asDouble());
            case TEXT:
                Value whole = ValueParser.parseWholeNumber(value.asText());
                if (!whole.isNull()) {
                    return whole;
                }
                Value decimal = ValueParser.parseDecimal(value.asText());
                return decimal.isNull() ? Value.NULL : integral(decimal.asDouble());
            default:
                return Value.NULL;
        }
    }

    private static Value toFloat(Value value) {
        switch (value.getType()) {
            case INTEGER:
                return Value.ofFloat(value.asDouble());
            case TEXT:
                return ValueParser.parseDecimal(value.asText());
            default:
                return Value.NULL;
        }
    }

    private static Value integral(double number) {
        if (Double.isFinite(number) && number == Math.rint(number) && Math.abs(number) < 0x1p63) {
            return Value.ofInteger((long) number);
        }
        return Value.NULL;
    }
}
