package com.jclean.console;

import com.jclean.cleaning.MissingValueReport;
import com.jclean.common.value.Value;
import com.jclean.query.ColumnSummary;
import com.jclean.query.NumericStats;
import com.jclean.query.Summary;
import com.jclean.table.Row;
import com.jclean.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders tables and reports as fixed-width text for the console.
 */
public class TableRenderer {
    static final String NULL_TEXT = "<NA>";

    private final int maxRows;

    public TableRenderer() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param maxRows Rows shown before the output is cut short
     */
    public TableRenderer(int maxRows) {
        this.maxRows = maxRows;
    }

    public String render(Table table) {
        List<String> header = table.getColumnNames();
        int shown = Math.min(maxRows, table.rowCount());
        List<List<String>> cells = new ArrayList<>(shown);
        for (int r = 0; r < shown; r++) {
            Row row = table.getRow(r);
            List<String> line = new ArrayList<>(row.size());
            for (Value value : row.getValues()) {
                line.add(value.isNull() ? NULL_TEXT : value.toText());
            }
            cells.add(line);
        }
        StringBuilder out = new StringBuilder(grid(header, cells));
        if (shown < table.rowCount()) {
            out.append("... ").append(table.rowCount() - shown).append(" more rows\n");
        }
        return out.toString();
    }

    public String render(Summary summary) {
        StringBuilder out = new StringBuilder();
        out.append(String.format("Shape: %d rows, %d columns%n", summary.getRowCount(), summary.getColumnCount()));
        out.append(String.format("%nColumn Information:%n"));

        List<List<String>> info = new ArrayList<>();
        List<String> numericHeader = List.of("column", "count", "mean", "std", "min", "25%", "50%", "75%", "max");
        List<List<String>> stats = new ArrayList<>();
        for (ColumnSummary column : summary.getColumns()) {
            info.add(List.of(column.getName(), column.getType().getAlias(), Integer.toString(column.getMissing())));
            column.getStats().ifPresent(s -> stats.add(statsLine(column.getName(), s)));
        }
        out.append(grid(List.of("column", "type", "missing"), info));
        if (!stats.isEmpty()) {
            out.append(String.format("%nStatistical Summary:%n"));
            out.append(grid(numericHeader, stats));
        }
        return out.toString();
    }

    public String render(MissingValueReport report) {
        if (!report.hasMissing()) {
            return "No missing values\n";
        }
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, Integer> entry : report.getColumnsWithMissing().entrySet()) {
            out.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return out.toString();
    }

    private static List<String> statsLine(String name, NumericStats stats) {
        return List.of(name, Long.toString(stats.getCount()), number(stats.getMean()), number(stats.getStd()),
            number(stats.getMin()), number(stats.getP25()), number(stats.getP50()), number(stats.getP75()),
            number(stats.getMax()));
    }

    private static String number(double value) {
        return Double.isNaN(value) ? "NaN" : String.format(Locale.ROOT, "%.4f", value);
    }

    private static String grid(List<String> header, List<List<String>> rows) {
        int[] widths = new int[header.size()];
        for (int c = 0; c < widths.length; c++) {
            widths[c] = header.get(c).length();
            for (List<String> row : rows) {
                widths[c] = Math.max(widths[c], row.get(c).length());
            }
        }
        StringBuilder out = new StringBuilder();
        appendLine(out, header, widths);
        for (List<String> row : rows) {
            appendLine(out, row, widths);
        }
        return out.toString();
    }

    private static void appendLine(StringBuilder out, List<String> cells, int[] widths) {
        for (int c = 0; c < cells.size(); c++) {
            if (c > 0) {
                out.append("  ");
            }
            String cell = cells.get(c);
            out.append(cell);
            if (c < cells.size() - 1) {
                out.append(" ".repeat(widths[c] - cell.length()));
            }
        }
        out.append('\n');
    }
}
