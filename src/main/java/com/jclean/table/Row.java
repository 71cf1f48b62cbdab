package com.jclean.table;

import com.jclean.common.value.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable record holding one value per table column, in column order.
 * Two rows are equal when every value is equal; NULL equals NULL.
 */
public final class Row {
    private final List<Value> values;

    public Row(List<Value> values) {
        List<Value> copy = new ArrayList<>(Objects.requireNonNull(values, "values cannot be null"));
        for (Value value : copy) {
            Objects.requireNonNull(value, "use Value.NULL for missing cells");
        }
        this.values = Collections.unmodifiableList(copy);
    }

    public static Row of(Value... values) {
        return new Row(Arrays.asList(values));
    }

    public Value get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<Value> getValues() {
        return values;
    }

    public Row with(int index, Value value) {
        List<Value> copy = new ArrayList<>(values);
        copy.set(index, value);
        return new Row(copy);
    }

    public Row append(Value value) {
        List<Value> copy = new ArrayList<>(values);
        copy.add(value);
        return new Row(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
