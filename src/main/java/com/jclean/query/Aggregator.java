package com.jclean.query;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.value.Numbers;
import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds group-by reports. Read-only with respect to the source table.
 */
public class Aggregator {
    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

    /**
     * Groups rows by the key column and aggregates the value column per group.
     *
     * @param table Source table
     * @param keyColumn Grouping column; NULL is a group of its own
     * @param valueColumn Column to aggregate
     * @param function Aggregation to compute
     * @return One entry per distinct key, in first-seen order
     * @throws CleaningException COLUMN_NOT_FOUND for unknown columns, AGGREGATION when a
     *         numeric function is asked of a non-numeric column
     */
    public PivotTable pivot(Table table, String keyColumn, String valueColumn, AggregateFunction function) {
        int keyIndex = table.requireColumn(keyColumn);
        int valueIndex = table.requireColumn(valueColumn);
        ColumnType valueType = table.getType(valueColumn);
        if (function.requiresNumeric() && !valueType.isNumeric()) {
            throw new CleaningException(ErrorKind.AGGREGATION, String.format(
                "Cannot compute %s of non-numeric column '%s' (%s)", function.label(), valueColumn, valueType));
        }

        Map<Value, List<Value>> groups = new LinkedHashMap<>();
        for (Row row : table.getRows()) {
            groups.computeIfAbsent(row.get(keyIndex), key -> new ArrayList<>()).add(row.get(valueIndex));
        }

        Map<Value, Value> aggregates = new LinkedHashMap<>();
        groups.forEach((key, values) -> aggregates.put(key, aggregate(function, valueType, values)));

        logger.debug("Pivot {} of '{}' by '{}' produced {} groups",
            function.label(), valueColumn, keyColumn, aggregates.size());
        return new PivotTable(keyColumn, table.getType(keyColumn), valueColumn, function,
            resultType(function, valueType), aggregates);
    }

    static ColumnType resultType(AggregateFunction function, ColumnType valueType) {
        switch (function) {
            case COUNT:
                return ColumnType.INTEGER;
            case MEAN:
                return ColumnType.FLOAT;
            default:
                return valueType;
        }
    }

    private static Value aggregate(AggregateFunction function, ColumnType valueType, List<Value> values) {
        if (function == AggregateFunction.COUNT) {
            return Value.ofInteger(values.size());
        }
        List<Value> present = new ArrayList<>();
        for (Value value : values) {
            if (!value.isNull()) {
                present.add(value);
            }
        }
        if (present.isEmpty()) {
            return Value.NULL;
        }
        switch (function) {
            case SUM:
                if (valueType == ColumnType.INTEGER) {
                    long total = 0;
                    try {
                        for (Value value : present) {
                            total = Math.addExact(total, value.asLong());
                        }
                    } catch (ArithmeticException e) {
                        throw new CleaningException(ErrorKind.AGGREGATION, "Integer sum overflows a 64-bit total", e);
                    }
                    return Value.ofInteger(total);
                }
                return Value.ofFloat(Numbers.sum(Numbers.nonNull(present)));
            case MEAN:
                return Value.ofFloat(Numbers.mean(Numbers.nonNull(present)));
            case MAX:
                Value max = present.get(0);
                for (Value value : present) {
                    if (value.compareTo(max) > 0) {
                        max = value;
                    }
                }
                return max;
            default:
                Value min = present.get(0);
                for (Value value : present) {
                    if (value.compareTo(min) < 0) {
                        min = value;
                    }
                }
                return min;
        }
    }
}
