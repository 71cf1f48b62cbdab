package com.jclean.session;

import com.jclean.cleaning.ImputePolicy;
import com.jclean.common.schema.ColumnType;
import com.jclean.query.AggregateFunction;
import com.jclean.query.SortDirection;

import java.util.Objects;

/**
 * A user-chosen command and its arguments. Only the arguments a command type
 * uses are set; the rest are null.
 */
public final class Command {
    private final CommandType type;
    private final String source;
    private final ImputePolicy policy;
    private final String column;
    private final ColumnType columnType;
    private final String query;
    private final SortDirection direction;
    private final String valueColumn;
    private final AggregateFunction function;

    private Command(CommandType type, String source, ImputePolicy policy, String column, ColumnType columnType,
                    String query, SortDirection direction, String valueColumn, AggregateFunction function) {
        this.type = type;
        this.source = source;
        this.policy = policy;
        this.column = column;
        this.columnType = columnType;
        this.query = query;
        this.direction = direction;
        this.valueColumn = valueColumn;
        this.function = function;
    }

    private static Command of(CommandType type) {
        return new Command(type, null, null, null, null, null, null, null, null);
    }

    public static Command load(String source) {
        return new Command(CommandType.LOAD, Objects.requireNonNull(source, "source cannot be null"),
            null, null, null, null, null, null, null);
    }

    public static Command impute(ImputePolicy policy) {
        return new Command(CommandType.IMPUTE, null, Objects.requireNonNull(policy, "policy cannot be null"),
            null, null, null, null, null, null);
    }

    public static Command dedup() {
        return of(CommandType.DEDUP);
    }

    public static Command retype(String column, ColumnType type) {
        return new Command(CommandType.RETYPE, null, null, Objects.requireNonNull(column, "column cannot be null"),
            Objects.requireNonNull(type, "type cannot be null"), null, null, null, null);
    }

    public static Command search(String column, String query) {
        return new Command(CommandType.SEARCH, null, null, Objects.requireNonNull(column, "column cannot be null"),
            null, Objects.requireNonNull(query, "query cannot be null"), null, null, null);
    }

    public static Command sort(String column, SortDirection direction) {
        return new Command(CommandType.SORT, null, null, Objects.requireNonNull(column, "column cannot be null"),
            null, null, Objects.requireNonNull(direction, "direction cannot be null"), null, null);
    }

    /**
     * Pivot; {@code keyColumn} is stored as the command's column.
     */
    public static Command pivot(String keyColumn, String valueColumn, AggregateFunction function) {
        return new Command(CommandType.PIVOT, null, null, Objects.requireNonNull(keyColumn, "keyColumn cannot be null"),
            null, null, null, Objects.requireNonNull(valueColumn, "valueColumn cannot be null"),
            Objects.requireNonNull(function, "function cannot be null"));
    }

    public static Command summarize() {
        return of(CommandType.SUMMARIZE);
    }

    public static Command persist() {
        return of(CommandType.PERSIST);
    }

    public static Command missingReport() {
        return of(CommandType.MISSING_REPORT);
    }

    public static Command exit() {
        return of(CommandType.EXIT);
    }

    public CommandType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public ImputePolicy getPolicy() {
        return policy;
    }

    public String getColumn() {
        return column;
    }

    public ColumnType getColumnType() {
        return columnType;
    }

    public String getQuery() {
        return query;
    }

    public SortDirection getDirection() {
        return direction;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public AggregateFunction getFunction() {
        return function;
    }

    @Override
    public String toString() {
        return "Command{" + type + "}";
    }
}
