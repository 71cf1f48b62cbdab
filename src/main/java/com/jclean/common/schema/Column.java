package com.jclean.common.schema;

import java.util.Objects;

/**
 * A named, typed column of a table schema.
 */
public class Column {
    private final String name;
    private final ColumnType type;

    public Column(String name, ColumnType type) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public Column withType(ColumnType newType) {
        return new Column(name, newType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Column column = (Column) o;
        return name.equals(column.name) && type == column.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + " (" + type.getAlias() + ")";
    }
}
