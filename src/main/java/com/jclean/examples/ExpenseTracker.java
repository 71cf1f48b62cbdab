package com.jclean.examples;

import com.jclean.cleaning.TypeCoercer;
import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Numbers;
import com.jclean.common.value.Value;
import com.jclean.console.TableRenderer;
import com.jclean.io.DelimitedTableReader;
import com.jclean.query.AggregateFunction;
import com.jclean.query.Aggregator;
import com.jclean.query.PivotTable;
import com.jclean.query.SortDirection;
import com.jclean.query.Sorter;
import com.jclean.rules.MonthRule;
import com.jclean.rules.RequiredColumns;
import com.jclean.rules.RuleApplier;
import com.jclean.table.Row;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Keeps a ledger of expenses and reports spending totals, spending per category,
 * the most recent entries and a monthly trend.
 */
public class ExpenseTracker {
    private static final Logger logger = LoggerFactory.getLogger(ExpenseTracker.class);

    public static final String DATE = "Date";
    public static final String CATEGORY = "Category";
    public static final String AMOUNT = "Amount";
    public static final String NOTE = "Note";
    public static final String MONTH = "Month";
    public static final List<String> CATEGORIES =
        List.of("Food", "Transport", "Shopping", "Bills", "Entertainment", "Other");
    public static final int RECENT_LIMIT = 10;

    private static final RequiredColumns REQUIRED = RequiredColumns.of(DATE, CATEGORY, AMOUNT);

    private final Aggregator aggregator = new Aggregator();
    private final Sorter sorter = new Sorter();
    private final TypeCoercer coercer = new TypeCoercer();

    public static class ExpenseReport {
        private final Table expenses;
        private final Table spendingByCategory;
        private final Table recentExpenses;
        private final Table monthlyTrend;

        ExpenseReport(Table expenses, Table spendingByCategory, Table recentExpenses, Table monthlyTrend) {
            this.expenses = expenses;
            this.spendingByCategory = spendingByCategory;
            this.recentExpenses = recentExpenses;
            this.monthlyTrend = monthlyTrend;
        }

        /**
         * The ledger with dates as DATETIME and a Month column appended.
         */
        public Table getExpenses() {
            return expenses;
        }

        /**
         * Sum of Amount per category, highest first.
         */
        public Table getSpendingByCategory() {
            return spendingByCategory;
        }

        /**
         * Up to {@link ExpenseTracker#RECENT_LIMIT} entries, newest first, with the ledger's Date,
         * Category, Amount and Note columns.
         */
        public Table getRecentExpenses() {
            return recentExpenses;
        }

        /**
         * Sum of Amount per {@code yyyy-MM} month, oldest first. Entries without a
         * usable date are left out.
         */
        public Table getMonthlyTrend() {
            return monthlyTrend;
        }

        public double getTotalSpent() {
            return Numbers.sum(Numbers.nonNull(expenses.getColumnValues(AMOUNT)));
        }

        public int getExpenseCount() {
            return expenses.rowCount();
        }

        public OptionalDouble getAverageExpense() {
            double[] amounts = Numbers.nonNull(expenses.getColumnValues(AMOUNT));
            return amounts.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(Numbers.mean(amounts));
        }
    }

    /**
     * A ledger with no entries, for starting without a file.
     */
    public static Table emptyLedger() {
        Schema schema = new Schema.Builder()
            .addColumn(DATE, ColumnType.DATETIME)
            .addColumn(CATEGORY, ColumnType.TEXT)
            .addColumn(AMOUNT, ColumnType.FLOAT)
            .addColumn(NOTE, ColumnType.TEXT)
            .build();
        return new Table(schema, List.of());
    }

    /**
     * Returns a copy of the ledger with one more entry at the end. Columns the
     * entry does not cover are NULL in the new row.
     *
     * @param note Free text, or null or empty for none
     * @throws CleaningException INVALID_ARGUMENT for a missing date or category or
     *         an amount that is not positive, PRECONDITION when the ledger lacks a
     *         required column
     */
    public Table addExpense(Table ledger, LocalDate date, String category, double amount, String note) {
        REQUIRED.check(ledger);
        if (date == null || category == null || category.isEmpty()) {
            throw new CleaningException(ErrorKind.INVALID_ARGUMENT, "An expense needs a date and a category");
        }
        if (!(amount > 0)) {
            throw new CleaningException(ErrorKind.INVALID_ARGUMENT, "Amount must be greater than zero: " + amount);
        }
        Table updated = normalized(ledger);
        coercer.retype(updated, AMOUNT, ColumnType.FLOAT);
        coercer.retype(updated, CATEGORY, ColumnType.TEXT);
        if (updated.hasColumn(NOTE)) {
            coercer.retype(updated, NOTE, ColumnType.TEXT);
        }

        List<Value> values = new ArrayList<>(updated.columnCount());
        for (String column : updated.getColumnNames()) {
            switch (column) {
                case DATE:
                    values.add(Value.ofDateTime(date.atStartOfDay()));
                    break;
                case CATEGORY:
                    values.add(Value.ofText(category));
                    break;
                case AMOUNT:
                    values.add(Value.ofFloat(amount));
                    break;
                case NOTE:
                    values.add(note == null || note.isEmpty() ? Value.NULL : Value.ofText(note));
                    break;
                default:
                    values.add(Value.NULL);
            }
        }
        List<Row> rows = new ArrayList<>(updated.getRows());
        rows.add(new Row(values));
        updated.replaceRows(rows);
        logger.debug("Added {} expense of {} on {}", category, amount, date);
        return updated;
    }

    /**
     * Builds the spending report from a copy of the ledger.
     *
     * @throws CleaningException PRECONDITION when a required column is missing,
     *         AGGREGATION when Amount is not numeric
     */
    public ExpenseReport track(Table ledger) {
        REQUIRED.check(ledger);
        Table expenses = RuleApplier.apply(normalized(ledger), new MonthRule(MONTH, DATE));

        Table byCategory = pivot(expenses, CATEGORY);
        sorter.sort(byCategory, byCategory.getColumnNames().get(1), SortDirection.DESCENDING);

        Table recent = expenses.snapshot(expenses.getRows());
        sorter.sort(recent, DATE, SortDirection.DESCENDING);
        recent = project(recent, recent.getRows().subList(0, Math.min(RECENT_LIMIT, recent.rowCount())));

        Table monthly = pivot(expenses, MONTH);
        List<Row> dated = new ArrayList<>();
        for (Row row : monthly.getRows()) {
            if (!row.get(0).isNull()) {
                dated.add(row);
            }
        }
        monthly.replaceRows(dated);
        sorter.sort(monthly, MONTH, SortDirection.ASCENDING);

        return new ExpenseReport(expenses, byCategory, recent, monthly);
    }

    private Table normalized(Table ledger) {
        Table copy = new Table(ledger.getSchema(), ledger.getRows(), ledger.getSourceName().orElse(null));
        ColumnType amountType = copy.getType(AMOUNT);
        if (!amountType.isNumeric()) {
            throw new CleaningException(ErrorKind.AGGREGATION,
                "Column '" + AMOUNT + "' must be numeric but is " + amountType);
        }
        if (copy.getType(DATE) != ColumnType.DATETIME) {
            int lost = coercer.retype(copy, DATE, ColumnType.DATETIME).getValuesNulled();
            if (lost > 0) {
                logger.warn("{} expenses have a date that could not be read", lost);
            }
        }
        return copy;
    }

    private Table pivot(Table expenses, String keyColumn) {
        PivotTable pivot = aggregator.pivot(expenses, keyColumn, AMOUNT, AggregateFunction.SUM);
        return pivot.asTable();
    }

    private static Table project(Table expenses, List<Row> rows) {
        List<String> columns = new ArrayList<>(List.of(DATE, CATEGORY, AMOUNT));
        if (expenses.hasColumn(NOTE)) {
            columns.add(NOTE);
        }
        Schema.Builder schema = new Schema.Builder();
        int[] indexes = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            indexes[c] = expenses.requireColumn(columns.get(c));
            schema.addColumn(columns.get(c), expenses.getType(columns.get(c)));
        }
        List<Row> projected = new ArrayList<>(rows.size());
        for (Row row : rows) {
            List<Value> values = new ArrayList<>(indexes.length);
            for (int index : indexes) {
                values.add(row.get(index));
            }
            projected.add(new Row(values));
        }
        return new Table(schema.build(), projected);
    }

    public static void main(String[] args) throws IOException {
        if (args.length > 1) {
            System.err.println("Usage: ExpenseTracker [expenses.csv]");
            return;
        }
        Table ledger = args.length == 1 ? new DelimitedTableReader().read(Paths.get(args[0])) : emptyLedger();
        if (ledger.rowCount() == 0) {
            System.out.println("No expenses recorded yet.");
            return;
        }
        ExpenseReport report = new ExpenseTracker().track(ledger);
        TableRenderer renderer = new TableRenderer();
        System.out.printf("Total spent: %,.2f%n", report.getTotalSpent());
        System.out.println("Total expenses: " + report.getExpenseCount());
        report.getAverageExpense().ifPresent(mean -> System.out.printf("Average expense: %.2f%n", mean));
        System.out.println("\nCategory-wise spending:\n" + renderer.render(report.getSpendingByCategory()));
        System.out.println("Recent expenses:\n" + renderer.render(report.getRecentExpenses()));
        System.out.println("Monthly spending trend:\n" + renderer.render(report.getMonthlyTrend()));
    }
}
