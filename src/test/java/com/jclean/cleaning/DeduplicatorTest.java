package com.jclean.cleaning;

import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.table.Row;
import com.jclean.table.Table;
import com.jclean.table.TestTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.jclean.table.TestTables.cells;
import static com.jclean.table.TestTables.row;
import static org.assertj.core.api.Assertions.assertThat;

class DeduplicatorTest {
    private final Deduplicator deduplicator = new Deduplicator();
    private Schema schema;

    @BeforeEach
    void setUp() {
        schema = new Schema.Builder()
            .addColumn("key", ColumnType.TEXT)
            .addColumn("n", ColumnType.INTEGER)
            .build();
    }

    @Test
    void shouldKeepFirstOccurrenceOfDuplicates() {
        Table table = TestTables.table(schema, cells("x", 1), cells("x", 1), cells("y", 2));

        DedupReport report = deduplicator.deduplicate(table);

        assertThat(table.getRows()).containsExactly(row("x", 1), row("y", 2));
        assertThat(report.getRowsRemoved()).isEqualTo(1);
        assertThat(report.getRowsRemaining()).isEqualTo(2);
    }

    @Test
    void shouldTreatNullsAsEqual() {
        Table table = TestTables.table(schema, cells("x", null), cells("y", 1), cells("x", null));

        deduplicator.deduplicate(table);

        assertThat(table.getRows()).containsExactly(row("x", null), row("y", 1));
    }

    @Test
    void shouldPreserveOrderAndBeIdempotent() {
        Table table = TestTables.table(schema,
            cells("c", 3), cells("a", 1), cells("c", 3), cells("b", 2), cells("a", 1));

        deduplicator.deduplicate(table);
        List<Row> once = new ArrayList<>(table.getRows());
        DedupReport second = deduplicator.deduplicate(table);

        assertThat(once).containsExactly(row("c", 3), row("a", 1), row("b", 2));
        assertThat(table.getRows()).isEqualTo(once);
        assertThat(second.getRowsRemoved()).isZero();
    }

    @Test
    void shouldTreatSignedZerosAsDuplicates() {
        Schema floats = new Schema.Builder()
            .addColumn("key", ColumnType.TEXT)
            .addColumn("x", ColumnType.FLOAT)
            .build();
        Table table = TestTables.table(floats, cells("x", 0.0), cells("x", -0.0));

        DedupReport report = deduplicator.deduplicate(table);

        assertThat(report.getRowsRemoved()).isEqualTo(1);
        assertThat(table.getRows()).containsExactly(row("x", 0.0));
    }
}
