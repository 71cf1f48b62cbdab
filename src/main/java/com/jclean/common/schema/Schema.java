package com.jclean.common.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of uniquely named columns with their declared types.
 * Schemas are immutable; changing a column's type yields a new schema.
 */
public class Schema {
    private final List<Column> columns;
    private final Map<String, Integer> positions;

    public Schema(List<Column> columns) {
        this.columns = new ArrayList<>(Objects.requireNonNull(columns, "columns cannot be null"));
        this.positions = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            String name = this.columns.get(i).getName();
            if (positions.put(name, i) != null) {
                throw new IllegalArgumentException("Column '" + name + "' already exists in the schema");
            }
        }
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    public int size() {
        return columns.size();
    }

    public boolean hasColumn(String name) {
        return positions.containsKey(name);
    }

    /**
     * Returns the position of a column, or -1 if the schema has no such column.
     */
    public int indexOf(String name) {
        Integer index = positions.get(name);
        return index != null ? index : -1;
    }

    public Column getColumn(int index) {
        return columns.get(index);
    }

    public Schema withType(String name, ColumnType type) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column '" + name + "' does not exist in the schema");
        }
        List<Column> copy = new ArrayList<>(columns);
        copy.set(index, columns.get(index).withType(type));
        return new Schema(copy);
    }

    public Schema withColumn(Column column) {
        List<Column> copy = new ArrayList<>(columns);
        copy.add(column);
        return new Schema(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return columns.equals(((Schema) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.toString();
    }

    /**
     * Builder class for creating Schema instances.
     */
    public static class Builder {
        private final List<Column> columns = new ArrayList<>();

        public Builder addColumn(String name, ColumnType type) {
            columns.add(new Column(name, type));
            return this;
        }

        public Schema build() {
            return new Schema(columns);
        }
    }
}
