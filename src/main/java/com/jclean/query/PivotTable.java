package com.jclean.query;

import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a pivot: one aggregate per distinct key value, in first-seen key order.
 */
public class PivotTable {
    private final String keyColumn;
    private final ColumnType keyType;
    private final String valueColumn;
    private final AggregateFunction function;
    private final ColumnType aggregateType;
    private final Map<Value, Value> groups;

    public PivotTable(String keyColumn, ColumnType keyType, String valueColumn, AggregateFunction function,
                      ColumnType aggregateType, Map<Value, Value> groups) {
        this.keyColumn = keyColumn;
        this.keyType = keyType;
        this.valueColumn = valueColumn;
        this.function = function;
        this.aggregateType = aggregateType;
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public AggregateFunction getFunction() {
        return function;
    }

    /**
     * Name of the aggregate column, e.g. {@code sum_Quantity}.
     */
    public String getAggregateColumn() {
        return function.label() + "_" + valueColumn;
    }

    public ColumnType getAggregateType() {
        return aggregateType;
    }

    /**
     * Aggregate per key; a NULL key is its own group.
     */
    public Map<Value, Value> getGroups() {
        return groups;
    }

    public Value get(Value key) {
        return groups.get(key);
    }

    public int size() {
        return groups.size();
    }

    /**
     * Two-column table view of this pivot.
     */
    public Table asTable() {
        Schema schema = new Schema.Builder()
            .addColumn(keyColumn, keyType)
            .addColumn(getAggregateColumn(), aggregateType)
            .build();
        List<Row> rows = new ArrayList<>(groups.size());
        groups.forEach((key, aggregate) -> rows.add(Row.of(key, aggregate)));
        return new Table(schema, rows);
    }

    @Override
    public String toString() {
        return "Pivot (" + function.label() + " of " + valueColumn + " by " + keyColumn + "): " + groups;
    }
}
