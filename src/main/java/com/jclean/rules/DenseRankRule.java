package com.jclean.rules;

import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.table.Table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Dense rank of a column: equal values share a rank and the next distinct value
 * takes the next rank, with no gaps. NULL values get a NULL rank.
 */
public class DenseRankRule implements DerivedColumnRule {
    private final String outputColumn;
    private final String sourceColumn;
    private final boolean descending;

    /**
     * Ranks highest first.
     */
    public DenseRankRule(String outputColumn, String sourceColumn) {
        this(outputColumn, sourceColumn, true);
    }

    public DenseRankRule(String outputColumn, String sourceColumn, boolean descending) {
        this.outputColumn = outputColumn;
        this.sourceColumn = sourceColumn;
        this.descending = descending;
    }

    @Override
    public String getOutputColumn() {
        return outputColumn;
    }

    @Override
    public ColumnType getOutputType(Schema schema) {
        return ColumnType.INTEGER;
    }

    @Override
    public List<String> getInputColumns() {
        return List.of(sourceColumn);
    }

    @Override
    public List<Value> compute(Table table) {
        List<Value> source = table.getColumnValues(sourceColumn);
        Comparator<Value> order = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        TreeSet<Value> distinct = new TreeSet<>(order);
        for (Value value : source) {
            if (!value.isNull()) {
                distinct.add(value);
            }
        }
        Map<Value, Long> ranks = new HashMap<>();
        long rank = 1;
        for (Value value : distinct) {
            ranks.put(value, rank++);
        }
        List<Value> result = new ArrayList<>(source.size());
        for (Value value : source) {
            result.add(value.isNull() ? Value.NULL : Value.ofInteger(ranks.get(value)));
        }
        return result;
    }
}
