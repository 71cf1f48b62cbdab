package com.jclean.common.value;

import com.jclean.common.schema.ColumnType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses raw cell text into typed values. Every method returns {@link Value#NULL}
 * instead of failing when the text does not parse.
 */
public final class ValueParser {
    private static final Pattern WHOLE_NUMBER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        strict("uuuu-MM-dd HH:mm:ss"),
        strict("uuuu-MM-dd HH:mm"),
        strict("uuuu-MM-dd'T'HH:mm:ss"),
        strict("uuuu-MM-dd'T'HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        strict("uuuu-MM-dd"),
        strict("uuuu/MM/dd"),
        strict("dd-MM-uuuu"),
        strict("MM/dd/uuuu")
    );

    private ValueParser() {
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Parses a literal whole number such as {@code "42"} or {@code "-7"}.
     */
    public static Value parseWholeNumber(String text) {
        String trimmed = text.trim();
        if (!WHOLE_NUMBER.matcher(trimmed).matches()) {
            return Value.NULL;
        }
        try {
            return Value.ofInteger(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            // out of long range
            return Value.NULL;
        }
    }

    public static Value parseDecimal(String text) {
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return Value.NULL;
        }
        return Value.ofFloat(Double.parseDouble(trimmed));
    }

    public static Value parseDateTime(String text) {
        String trimmed = text.trim();
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return Value.ofDateTime(LocalDateTime.parse(trimmed, format));
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Value.ofDateTime(LocalDate.parse(trimmed, format).atStartOfDay());
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        return Value.NULL;
    }

    /**
     * Infers the narrowest type for a column of raw cells. Empty cells are
     * ignored; dates are never inferred.
     *
     * @param cells Raw cell text, with {@code null} or empty strings for missing cells
     * @return INTEGER, FLOAT or TEXT
     */
    public static ColumnType inferType(List<String> cells) {
        boolean sawValue = false;
        boolean allWhole = true;
        for (String cell : cells) {
            if (cell == null || cell.isEmpty()) {
                continue;
            }
            sawValue = true;
            if (allWhole && parseWholeNumber(cell).isNull()) {
                allWhole = false;
            }
            if (!allWhole && parseDecimal(cell).isNull()) {
                return ColumnType.TEXT;
            }
        }
        if (!sawValue) {
            return ColumnType.TEXT;
        }
        return allWhole ? ColumnType.INTEGER : ColumnType.FLOAT;
    }

    /**
     * Parses a raw cell as the given type. Empty or missing cells are NULL.
     */
    public static Value parse(String cell, ColumnType type) {
        if (cell == null || cell.isEmpty()) {
            return Value.NULL;
        }
        switch (type) {
            case INTEGER:
                return parseWholeNumber(cell);
            case FLOAT:
                return parseDecimal(cell);
            case DATETIME:
                return parseDateTime(cell);
            default:
                return Value.ofText(cell);
        }
    }
}
