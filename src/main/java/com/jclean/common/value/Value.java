package com.jclean.common.value;

import com.jclean.common.schema.ColumnType;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * A single table cell: either a typed scalar or the {@link #NULL} marker.
 * <p>
 * Payloads are {@code Long} for INTEGER, {@code Double} for FLOAT, {@code String}
 * for TEXT and {@code LocalDateTime} for DATETIME. Values are immutable.
 */
public final class Value implements Comparable<Value> {
    public static final Value NULL = new Value(null, null);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ColumnType type;
    private final Object payload;

    private Value(ColumnType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static Value ofInteger(long value) {
        return new Value(ColumnType.INTEGER, value);
    }

    /**
     * Creates a FLOAT value. {@code -0.0} is stored as {@code 0.0} so both compare and hash alike.
     */
    public static Value ofFloat(double value) {
        return new Value(ColumnType.FLOAT, value == 0.0 ? 0.0 : value);
    }

    public static Value ofText(String value) {
        return new Value(ColumnType.TEXT, Objects.requireNonNull(value, "text value cannot be null"));
    }

    public static Value ofDateTime(LocalDateTime value) {
        return new Value(ColumnType.DATETIME, Objects.requireNonNull(value, "datetime value cannot be null"));
    }

    public boolean isNull() {
        return type == null;
    }

    /**
     * Returns the tag of this value, or {@code null} for {@link #NULL}.
     */
    public ColumnType getType() {
        return type;
    }

    public boolean isNumeric() {
        return type != null && type.isNumeric();
    }

    public long asLong() {
        checkType(ColumnType.INTEGER);
        return (Long) payload;
    }

    /**
     * Numeric view of an INTEGER or FLOAT value.
     */
    public double asDouble() {
        if (!isNumeric()) {
            throw new IllegalStateException("Not a numeric value: " + describe());
        }
        return ((Number) payload).doubleValue();
    }

    public String asText() {
        checkType(ColumnType.TEXT);
        return (String) payload;
    }

    public LocalDateTime asDateTime() {
        checkType(ColumnType.DATETIME);
        return (LocalDateTime) payload;
    }

    /**
     * Canonical textual form. NULL renders as the empty string.
     */
    public String toText() {
        if (type == null) {
            return "";
        }
        switch (type) {
            case INTEGER:
                return Long.toString((Long) payload);
            case FLOAT:
                return Double.toString((Double) payload);
            case DATETIME:
                LocalDateTime dateTime = (LocalDateTime) payload;
                return dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)
                    ? dateTime.format(DATE_FORMAT)
                    : dateTime.format(DATE_TIME_FORMAT);
            default:
                return (String) payload;
        }
    }

    /**
     * Orders two values of the same tag by their natural order: numeric for
     * INTEGER and FLOAT (which compare with each other), lexical for TEXT and
     * chronological for DATETIME. NULL sorts after every non-null value.
     */
    @Override
    public int compareTo(Value other) {
        if (isNull() || other.isNull()) {
            return Boolean.compare(isNull(), other.isNull());
        }
        if (isNumeric() && other.isNumeric()) {
            if (type == ColumnType.INTEGER && other.type == ColumnType.INTEGER) {
                return Long.compare((Long) payload, (Long) other.payload);
            }
            return Double.compare(asDouble(), other.asDouble());
        }
        if (type != other.type) {
            throw new IllegalArgumentException("Cannot compare " + describe() + " with " + other.describe());
        }
        if (type == ColumnType.DATETIME) {
            return asDateTime().compareTo(other.asDateTime());
        }
        return asText().compareTo(other.asText());
    }

    private void checkType(ColumnType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " value but was " + describe());
        }
    }

    private String describe() {
        return type == null ? "NULL" : type + "(" + payload + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value value = (Value) o;
        return type == value.type && Objects.equals(payload, value.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return type == null ? "NULL" : toText();
    }
}
