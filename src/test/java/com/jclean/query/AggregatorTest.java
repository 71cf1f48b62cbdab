package com.jclean.query;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.table.Table;
import com.jclean.table.TestTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.jclean.table.TestTables.cells;
import static com.jclean.table.TestTables.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregatorTest {
    private final Aggregator aggregator = new Aggregator();
    private Table sales;

    @BeforeEach
    void setUp() {
        Schema schema = new Schema.Builder()
            .addColumn("Item", ColumnType.TEXT)
            .addColumn("Quantity", ColumnType.INTEGER)
            .addColumn("Price", ColumnType.FLOAT)
            .build();
        sales = TestTables.table(schema,
            cells("apple", 3, 1.5),
            cells("pear", 5, 2.0),
            cells("apple", 2, 2.5),
            cells(null, 4, null));
    }

    @Test
    void shouldSumPerKeyInFirstSeenOrder() {
        PivotTable pivot = aggregator.pivot(sales, "Item", "Quantity", AggregateFunction.SUM);

        assertThat(pivot.getGroups().keySet())
            .containsExactly(Value.ofText("apple"), Value.ofText("pear"), Value.NULL);
        assertThat(pivot.get(Value.ofText("apple"))).isEqualTo(Value.ofInteger(5));
        assertThat(pivot.get(Value.ofText("pear"))).isEqualTo(Value.ofInteger(5));
        assertThat(pivot.getAggregateType()).isEqualTo(ColumnType.INTEGER);
    }

    @Test
    void shouldFailWhenIntegerSumOverflows() {
        Schema schema = new Schema.Builder()
            .addColumn("Item", ColumnType.TEXT)
            .addColumn("Quantity", ColumnType.INTEGER)
            .build();
        Table huge = TestTables.table(schema, cells("apple", Long.MAX_VALUE), cells("apple", 1L));

        assertThatThrownBy(() -> aggregator.pivot(huge, "Item", "Quantity", AggregateFunction.SUM))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.AGGREGATION)
            .hasMessageContaining("overflow");
        assertThat(aggregator.pivot(huge, "Item", "Quantity", AggregateFunction.MAX).get(Value.ofText("apple")))
            .isEqualTo(Value.ofInteger(Long.MAX_VALUE));
    }

    @Test
    void shouldComputeMeanMaxAndMin() {
        assertThat(aggregator.pivot(sales, "Item", "Price", AggregateFunction.MEAN).get(Value.ofText("apple")))
            .isEqualTo(Value.ofFloat(2.0));
        assertThat(aggregator.pivot(sales, "Item", "Price", AggregateFunction.MAX).get(Value.ofText("apple")))
            .isEqualTo(Value.ofFloat(2.5));
        assertThat(aggregator.pivot(sales, "Item", "Quantity", AggregateFunction.MIN).get(Value.ofText("apple")))
            .isEqualTo(Value.ofInteger(2));
    }

    @Test
    void shouldCountRowsIncludingNullValues() {
        PivotTable pivot = aggregator.pivot(sales, "Item", "Price", AggregateFunction.COUNT);

        assertThat(pivot.get(Value.ofText("apple"))).isEqualTo(Value.ofInteger(2));
        assertThat(pivot.get(Value.NULL)).isEqualTo(Value.ofInteger(1));
    }

    @Test
    void shouldYieldNullForGroupWithoutValues() {
        PivotTable pivot = aggregator.pivot(sales, "Item", "Price", AggregateFunction.SUM);

        assertThat(pivot.get(Value.NULL)).isEqualTo(Value.NULL);
    }

    @Test
    void shouldAllowCountAndMaxOverText() {
        PivotTable pivot = aggregator.pivot(sales, "Quantity", "Item", AggregateFunction.MAX);

        assertThat(pivot.get(Value.ofInteger(3))).isEqualTo(Value.ofText("apple"));
        assertThat(pivot.getAggregateType()).isEqualTo(ColumnType.TEXT);
    }

    @Test
    void shouldRejectNumericAggregateOfTextColumn() {
        assertThatThrownBy(() -> aggregator.pivot(sales, "Quantity", "Item", AggregateFunction.SUM))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.AGGREGATION)
            .hasMessageContaining("non-numeric");
    }

    @Test
    void shouldRejectUnknownColumns() {
        assertThatThrownBy(() -> aggregator.pivot(sales, "Store", "Quantity", AggregateFunction.SUM))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.COLUMN_NOT_FOUND);
    }

    @Test
    void shouldExposePivotAsTable() {
        Table table = aggregator.pivot(sales, "Item", "Quantity", AggregateFunction.SUM).asTable();

        assertThat(table.getColumnNames()).containsExactly("Item", "sum_Quantity");
        assertThat(table.getRows()).containsExactly(row("apple", 5), row("pear", 5), row(null, 4));
        assertThat(sales.rowCount()).isEqualTo(4);
    }
}
