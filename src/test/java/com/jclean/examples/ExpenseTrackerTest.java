package com.jclean.examples;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.io.DelimitedTableReader;
import com.jclean.table.Table;
import com.jclean.table.TestTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.jclean.table.TestTables.cells;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ExpenseTrackerTest {
    private final ExpenseTracker tracker = new ExpenseTracker();
    private Table ledger;

    @BeforeEach
    void setUp() throws Exception {
        ledger = new DelimitedTableReader().read(
            Paths.get(ExpenseTrackerTest.class.getResource("/tables/expenses.csv").toURI()));
    }

    @Test
    void shouldComputeSpendingTotals() {
        ExpenseTracker.ExpenseReport report = tracker.track(ledger);

        assertThat(report.getTotalSpent()).isEqualTo(208.0);
        assertThat(report.getExpenseCount()).isEqualTo(5);
        assertThat(report.getAverageExpense().getAsDouble()).isCloseTo(41.6, within(1e-9));
        assertThat(report.getExpenses().getType("Date")).isEqualTo(ColumnType.DATETIME);
        assertThat(ledger.getType("Date")).isEqualTo(ColumnType.TEXT);
    }

    @Test
    void shouldRankCategoriesBySpending() {
        Table byCategory = tracker.track(ledger).getSpendingByCategory();

        assertThat(byCategory.getColumnNames()).containsExactly("Category", "sum_Amount");
        assertThat(byCategory.getColumnValues("Category")).containsExactly(
            Value.ofText("Bills"), Value.ofText("Shopping"), Value.ofText("Food"), Value.ofText("Transport"));
        assertThat(byCategory.getValue(2, "sum_Amount")).isEqualTo(Value.ofFloat(32.5));
    }

    @Test
    void shouldListRecentExpensesNewestFirst() {
        Table recent = tracker.track(ledger).getRecentExpenses();

        assertThat(recent.getColumnNames()).containsExactly("Date", "Category", "Amount", "Note");
        assertThat(recent.getValue(0, "Date")).isEqualTo(Value.ofDateTime(LocalDateTime.of(2024, 2, 10, 0, 0)));
        assertThat(recent.getValue(4, "Category")).isEqualTo(Value.ofText("Shopping"));
        assertThat(recent.getValue(2, "Note")).isEqualTo(Value.NULL);
    }

    @Test
    void shouldSumSpendingPerMonthOldestFirst() {
        Table monthly = tracker.track(ledger).getMonthlyTrend();

        assertThat(monthly.getColumnValues("Month"))
            .containsExactly(Value.ofText("2023-12"), Value.ofText("2024-01"), Value.ofText("2024-02"));
        assertThat(monthly.getColumnValues("sum_Amount"))
            .containsExactly(Value.ofFloat(45.5), Value.ofFloat(42.5), Value.ofFloat(120.0));
    }

    @Test
    void shouldKeepOnlyTheTenMostRecentEntries() {
        // Arrange
        Table entries = ExpenseTracker.emptyLedger();
        for (int day = 1; day <= 12; day++) {
            entries = tracker.addExpense(entries, LocalDate.of(2024, 3, day), "Food", day, null);
        }

        // Act
        ExpenseTracker.ExpenseReport report = tracker.track(entries);

        // Assert
        assertThat(report.getExpenseCount()).isEqualTo(12);
        assertThat(report.getRecentExpenses().rowCount()).isEqualTo(ExpenseTracker.RECENT_LIMIT);
        assertThat(report.getRecentExpenses().getValue(0, "Amount")).isEqualTo(Value.ofFloat(12.0));
        assertThat(report.getRecentExpenses().getValue(9, "Amount")).isEqualTo(Value.ofFloat(3.0));
        assertThat(report.getMonthlyTrend().getColumnValues("sum_Amount")).containsExactly(Value.ofFloat(78.0));
    }

    @Test
    void shouldAppendExpenseToLoadedLedger() {
        Table updated = tracker.addExpense(ledger, LocalDate.of(2024, 2, 11), "Other", 5, "stamps");

        assertThat(updated.rowCount()).isEqualTo(6);
        assertThat(updated.getValue(5, "Note")).isEqualTo(Value.ofText("stamps"));
        assertThat(updated.getValue(5, "Date")).isEqualTo(Value.ofDateTime(LocalDateTime.of(2024, 2, 11, 0, 0)));
        assertThat(ledger.rowCount()).isEqualTo(5);
        assertThat(tracker.track(updated).getRecentExpenses().getValue(0, "Category")).isEqualTo(Value.ofText("Other"));
    }

    @Test
    void shouldRejectExpensesWithoutPositiveAmount() {
        assertThatThrownBy(() -> tracker.addExpense(ledger, LocalDate.of(2024, 1, 1), "Food", 0, null))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_ARGUMENT);
        assertThatThrownBy(() -> tracker.addExpense(ledger, null, "Food", 3, null))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void shouldLeaveUnreadableDatesOutOfMonthlyTrend() {
        // Arrange
        Schema schema = new Schema.Builder()
            .addColumn("Date", ColumnType.TEXT)
            .addColumn("Category", ColumnType.TEXT)
            .addColumn("Amount", ColumnType.INTEGER)
            .build();
        Table entries = TestTables.table(schema,
            cells("someday", "Food", 7),
            cells("2024-04-02", "Food", 3));

        // Act
        ExpenseTracker.ExpenseReport report = tracker.track(entries);

        // Assert
        assertThat(report.getExpenses().getValue(0, "Month")).isEqualTo(Value.NULL);
        assertThat(report.getMonthlyTrend().getColumnValues("Month")).containsExactly(Value.ofText("2024-04"));
        assertThat(report.getMonthlyTrend().getColumnValues("sum_Amount")).containsExactly(Value.ofInteger(3));
        assertThat(report.getRecentExpenses().getColumnNames()).containsExactly("Date", "Category", "Amount");
        assertThat(report.getRecentExpenses().getValue(1, "Date")).isEqualTo(Value.NULL);
        assertThat(report.getTotalSpent()).isEqualTo(10.0);
    }

    @Test
    void shouldReportEmptyLedger() {
        ExpenseTracker.ExpenseReport report = tracker.track(ExpenseTracker.emptyLedger());

        assertThat(report.getExpenseCount()).isZero();
        assertThat(report.getAverageExpense()).isEmpty();
        assertThat(report.getMonthlyTrend().rowCount()).isZero();
        assertThat(report.getSpendingByCategory().rowCount()).isZero();
    }

    @Test
    void shouldRequireDateCategoryAndAmount() {
        Schema schema = new Schema.Builder()
            .addColumn("Date", ColumnType.TEXT)
            .addColumn("Category", ColumnType.TEXT)
            .build();
        Table noAmount = TestTables.table(schema, cells("2024-01-01", "Food"));

        assertThatThrownBy(() -> tracker.track(noAmount))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.PRECONDITION)
            .hasMessageContaining("Amount");
    }

    @Test
    void shouldRejectTextAmounts() {
        Table textAmounts = new Table(ledger.getSchema().withType("Amount", ColumnType.TEXT), List.of());

        assertThatThrownBy(() -> tracker.track(textAmounts))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.AGGREGATION);
    }
}
