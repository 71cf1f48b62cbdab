package com.jclean.table;

import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds tables for tests from plain Java literals.
 */
public final class TestTables {
    private TestTables() {
    }

    public static Table table(Schema schema, Object[]... rows) {
        List<Row> built = new ArrayList<>();
        for (Object[] cells : rows) {
            built.add(row(cells));
        }
        return new Table(schema, built);
    }

    public static Row row(Object... cells) {
        List<Value> values = new ArrayList<>(cells.length);
        for (Object cell : cells) {
            values.add(value(cell));
        }
        return new Row(values);
    }

    public static Value value(Object cell) {
        if (cell == null) {
            return Value.NULL;
        }
        if (cell instanceof Value) {
            return (Value) cell;
        }
        if (cell instanceof Integer || cell instanceof Long) {
            return Value.ofInteger(((Number) cell).longValue());
        }
        if (cell instanceof Double) {
            return Value.ofFloat((Double) cell);
        }
        if (cell instanceof LocalDate) {
            return Value.ofDateTime(((LocalDate) cell).atStartOfDay());
        }
        if (cell instanceof LocalDateTime) {
            return Value.ofDateTime((LocalDateTime) cell);
        }
        return Value.ofText(cell.toString());
    }

    public static Object[] cells(Object... cells) {
        return cells;
    }
}
