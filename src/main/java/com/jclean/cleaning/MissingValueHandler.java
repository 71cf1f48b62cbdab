package com.jclean.cleaning;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.Column;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Numbers;
import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects and resolves NULL cells under an {@link ImputePolicy}.
 * <p>
 * Mean and median fills only touch INTEGER and FLOAT columns. An INTEGER column
 * whose fill value is fractional is widened to FLOAT so every value still matches
 * the declared type. A literal that does not parse as a column's type turns that
 * column into TEXT for the same reason.
 */
public class MissingValueHandler {
    private static final Logger logger = LoggerFactory.getLogger(MissingValueHandler.class);

    public MissingValueReport report(Table table) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<String> names = table.getColumnNames();
        int[] missing = new int[names.size()];
        for (Row row : table.getRows()) {
            for (int c = 0; c < missing.length; c++) {
                if (row.get(c).isNull()) {
                    missing[c]++;
                }
            }
        }
        for (int c = 0; c < missing.length; c++) {
            counts.put(names.get(c), missing[c]);
        }
        return new MissingValueReport(counts);
    }

    /**
     * Applies a policy to the table.
     *
     * @param table The table to modify
     * @param policy How to resolve NULL cells
     * @return The missing-value counts taken before the change, with what was done
     */
    public ImputeResult impute(Table table, ImputePolicy policy) {
        List<Integer> targets = new ArrayList<>();
        for (int c = 0; c < table.columnCount(); c++) {
            targets.add(c);
        }
        return apply(table, policy, targets);
    }

    /**
     * Applies a policy to one column only. Dropping removes the rows where that
     * column is NULL; fills leave every other column untouched.
     *
     * @param table The table to modify
     * @param column The column to resolve
     * @param policy How to resolve its NULL cells
     * @return The missing-value counts taken before the change, with what was done
     * @throws CleaningException COLUMN_NOT_FOUND for an unknown column, AGGREGATION
     *         for a mean or median fill of a column that is not numeric
     */
    public ImputeResult imputeColumn(Table table, String column, ImputePolicy policy) {
        int index = table.requireColumn(column);
        ColumnType type = table.getType(column);
        boolean statistic = policy.getKind() == ImputePolicy.Kind.FILL_MEAN
            || policy.getKind() == ImputePolicy.Kind.FILL_MEDIAN;
        if (statistic && !type.isNumeric()) {
            throw new CleaningException(ErrorKind.AGGREGATION, String.format(
                "Column '%s' must be numeric to fill with %s but is %s", column, policy, type));
        }
        return apply(table, policy, List.of(index));
    }

    private ImputeResult apply(Table table, ImputePolicy policy, List<Integer> targets) {
        MissingValueReport before = report(table);
        boolean missing = false;
        for (int c : targets) {
            missing |= before.getMissing(table.getSchema().getColumn(c).getName()) > 0;
        }
        if (!missing) {
            return new ImputeResult(policy, before, 0, 0);
        }
        switch (policy.getKind()) {
            case DROP_ROWS:
                return dropRows(table, policy, before, targets);
            case FILL_MEAN:
            case FILL_MEDIAN:
                return fillStatistic(table, policy, before, targets);
            default:
                return fillLiteral(table, policy, before, targets);
        }
    }

    private ImputeResult dropRows(Table table, ImputePolicy policy, MissingValueReport before, List<Integer> targets) {
        List<Row> kept = new ArrayList<>();
        for (Row row : table.getRows()) {
            if (!hasNullIn(row, targets)) {
                kept.add(row);
            }
        }
        int dropped = table.rowCount() - kept.size();
        table.replaceRows(kept);
        logger.debug("Dropped {} rows containing missing values", dropped);
        return new ImputeResult(policy, before, dropped, 0);
    }

    private static boolean hasNullIn(Row row, List<Integer> targets) {
        for (int c : targets) {
            if (row.get(c).isNull()) {
                return true;
            }
        }
        return false;
    }

    private ImputeResult fillStatistic(Table table, ImputePolicy policy, MissingValueReport before,
                                       List<Integer> targets) {
        Schema schema = table.getSchema();
        List<List<Value>> columns = columnsOf(table);
        List<Column> newColumns = new ArrayList<>(schema.getColumns());
        int filled = 0;

        for (int c : targets) {
            Column column = schema.getColumn(c);
            if (!column.getType().isNumeric() || before.getMissing(column.getName()) == 0) {
                continue;
            }
            double[] present = Numbers.nonNull(columns.get(c));
            if (present.length == 0) {
                continue;
            }
            double fill = policy.getKind() == ImputePolicy.Kind.FILL_MEAN
                ? Numbers.mean(present)
                : Numbers.median(present);

            ColumnType targetType = column.getType();
            if (targetType == ColumnType.INTEGER && fill != Math.rint(fill)) {
                targetType = ColumnType.FLOAT;
            }
            Value fillValue = targetType == ColumnType.INTEGER ? Value.ofInteger((long) fill) : Value.ofFloat(fill);

            List<Value> values = columns.get(c);
            for (int r = 0; r < values.size(); r++) {
                Value value = values.get(r);
                if (value.isNull()) {
                    values.set(r, fillValue);
                    filled++;
                } else if (targetType != column.getType()) {
                    values.set(r, TypeCoercer.coerce(value, targetType));
                }
            }
            newColumns.set(c, column.withType(targetType));
            logger.debug("Filled column '{}' with {} {}", column.getName(), policy.getKind(), fillValue);
        }

        table.replaceContents(new Schema(newColumns), rowsOf(columns, table.rowCount()));
        return new ImputeResult(policy, before, 0, filled);
    }

    private ImputeResult fillLiteral(Table table, ImputePolicy policy, MissingValueReport before,
                                     List<Integer> targets) {
        String literal = policy.getLiteral();
        if (literal.isEmpty()) {
            throw new CleaningException(ErrorKind.INVALID_ARGUMENT, "Fill value cannot be empty");
        }
        Schema schema = table.getSchema();
        List<List<Value>> columns = columnsOf(table);
        List<Column> newColumns = new ArrayList<>(schema.getColumns());
        int filled = 0;

        for (int c : targets) {
            Column column = schema.getColumn(c);
            if (before.getMissing(column.getName()) == 0) {
                continue;
            }
            ColumnType targetType = column.getType();
            Value fillValue = TypeCoercer.coerce(Value.ofText(literal), targetType);
            if (fillValue.isNull()) {
                targetType = ColumnType.TEXT;
                fillValue = Value.ofText(literal);
            }

            List<Value> values = columns.get(c);
            for (int r = 0; r < values.size(); r++) {
                Value value = values.get(r);
                if (value.isNull()) {
                    values.set(r, fillValue);
                    filled++;
                } else if (targetType != column.getType()) {
                    values.set(r, TypeCoercer.coerce(value, targetType));
                }
            }
            if (targetType != column.getType()) {
                logger.debug("Column '{}' converted to TEXT to hold fill value '{}'", column.getName(), literal);
            }
            newColumns.set(c, column.withType(targetType));
        }

        table.replaceContents(new Schema(newColumns), rowsOf(columns, table.rowCount()));
        return new ImputeResult(policy, before, 0, filled);
    }

    private static List<List<Value>> columnsOf(Table table) {
        List<List<Value>> columns = new ArrayList<>();
        for (String name : table.getColumnNames()) {
            columns.add(table.getColumnValues(name));
        }
        return columns;
    }

    private static List<Row> rowsOf(List<List<Value>> columns, int rowCount) {
        List<Row> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            List<Value> values = new ArrayList<>(columns.size());
            for (List<Value> column : columns) {
                values.add(column.get(r));
            }
            rows.add(new Row(values));
        }
        return rows;
    }
}
