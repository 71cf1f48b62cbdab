package com.jclean.console;

import com.jclean.cleaning.MissingValueReport;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.query.SummaryReporter;
import com.jclean.table.Table;
import com.jclean.table.TestTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.jclean.table.TestTables.cells;
import static org.assertj.core.api.Assertions.assertThat;

class TableRendererTest {
    private Table table;

    @BeforeEach
    void setUp() {
        Schema schema = new Schema.Builder()
            .addColumn("Name", ColumnType.TEXT)
            .addColumn("Age", ColumnType.INTEGER)
            .build();
        table = TestTables.table(schema, cells("Anna", 30), cells("Bo", null), cells("Christopher", 7));
    }

    @Test
    void shouldAlignColumnsAndShowNulls() {
        String text = new TableRenderer().render(table);

        assertThat(text).isEqualTo(
            "Name" + " ".repeat(9) + "Age\n"
                + "Anna" + " ".repeat(9) + "30\n"
                + "Bo" + " ".repeat(11) + "<NA>\n"
                + "Christopher  7\n");
    }

    @Test
    void shouldCutLongTablesShort() {
        String text = new TableRenderer(1).render(table);

        assertThat(text).isEqualTo("Name  Age\nAnna  30\n... 2 more rows\n");
    }

    @Test
    void shouldRenderSummaryWithStatisticsForNumericColumns() {
        String text = new TableRenderer().render(new SummaryReporter().summarize(table));

        assertThat(text)
            .contains("Shape: 3 rows, 2 columns")
            .contains("Age     int   1")
            .contains("Statistical Summary:")
            .contains("18.5000");
    }

    @Test
    void shouldListOnlyColumnsWithMissingValues() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("Name", 0);
        counts.put("Age", 2);

        assertThat(new TableRenderer().render(new MissingValueReport(counts))).isEqualTo("Age: 2\n");
        assertThat(new TableRenderer().render(new MissingValueReport(Map.of("Name", 0))))
            .isEqualTo("No missing values\n");
    }
}
