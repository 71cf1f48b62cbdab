package com.jclean.table;

import com.jclean.common.CleaningException;
import com.jclean.common.schema.Column;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Table is the in-memory dataset the engine works on: an ordered list of
 * typed columns and an ordered list of rows.
 * <p>
 * Every row has exactly one value per column, and every non-null value carries
 * its column's declared type. Mutators check the whole replacement before
 * swapping it in, so a failed mutation leaves the table as it was.
 */
public class Table {
    private Schema schema;
    private List<Row> rows;
    private final String sourceName;

    /**
     * Creates a table that was not loaded from any source.
     *
     * @param schema Column names and declared types
     * @param rows Rows in display order
     */
    public Table(Schema schema, List<Row> rows) {
        this(schema, rows, null);
    }

    /**
     * Creates a table loaded from the given source.
     *
     * @param schema Column names and declared types
     * @param rows Rows in display order
     * @param sourceName Path or name the table was loaded from, or null
     */
    public Table(Schema schema, List<Row> rows, String sourceName) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.rows = validated(schema, rows);
        this.sourceName = sourceName;
    }

    public Schema getSchema() {
        return schema;
    }

    public List<String> getColumnNames() {
        return schema.getColumnNames();
    }

    public List<Row> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public Row getRow(int index) {
        return rows.get(index);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return schema.size();
    }

    public Optional<String> getSourceName() {
        return Optional.ofNullable(sourceName);
    }

    public boolean hasColumn(String name) {
        return schema.hasColumn(name);
    }

    /**
     * Resolves a column position, failing with COLUMN_NOT_FOUND for unknown names.
     */
    public int requireColumn(String name) {
        int index = schema.indexOf(name);
        if (index < 0) {
            throw CleaningException.columnNotFound(name);
        }
        return index;
    }

    public ColumnType getType(String name) {
        return schema.getColumn(requireColumn(name)).getType();
    }

    public Value getValue(int rowIndex, String column) {
        return rows.get(rowIndex).get(requireColumn(column));
    }

    /**
     * Returns the values of one column, in row order.
     */
    public List<Value> getColumnValues(String name) {
        int index = requireColumn(name);
        List<Value> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    /**
     * Replaces all rows, keeping the schema.
     */
    public void replaceRows(List<Row> newRows) {
        this.rows = validated(schema, newRows);
    }

    /**
     * Replaces one column's declared type and values together.
     *
     * @param name Column to rewrite
     * @param type New declared type
     * @param values New values, one per row in row order
     */
    public void replaceColumn(String name, ColumnType type, List<Value> values) {
        int index = requireColumn(name);
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException(
                "Expected " + rows.size() + " values for column '" + name + "' but got " + values.size());
        }
        Schema newSchema = schema.withType(name, type);
        List<Row> newRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            newRows.add(rows.get(i).with(index, values.get(i)));
        }
        replaceContents(newSchema, newRows);
    }

    /**
     * Swaps in a new schema and row list at once. The column names must stay the same;
     * only declared types and values may change.
     */
    public void replaceContents(Schema newSchema, List<Row> newRows) {
        if (!newSchema.getColumnNames().equals(schema.getColumnNames())) {
            throw new IllegalArgumentException("Column names cannot change: " + newSchema.getColumnNames());
        }
        List<Row> checked = validated(newSchema, newRows);
        this.schema = newSchema;
        this.rows = checked;
    }

    /**
     * Returns a detached copy with the same schema and rows but no source name.
     */
    public Table snapshot(List<Row> subset) {
        return new Table(schema, subset);
    }

    private static List<Row> validated(Schema schema, List<Row> rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        List<Row> copy = new ArrayList<>(rows);
        for (int r = 0; r < copy.size(); r++) {
            Row row = copy.get(r);
            if (row.size() != schema.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has %d values but the table has %d columns", r, row.size(), schema.size()));
            }
            for (int c = 0; c < row.size(); c++) {
                Value value = row.get(c);
                Column column = schema.getColumn(c);
                if (!value.isNull() && value.getType() != column.getType()) {
                    throw new IllegalArgumentException(String.format(
                        "Row %d: value %s does not match type %s of column '%s'",
                        r, value, column.getType(), column.getName()));
                }
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        return "Table" + schema + " with " + rows.size() + " rows";
    }
}
