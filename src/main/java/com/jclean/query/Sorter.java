package com.jclean.query;

import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reorders table rows by one column. The sort is stable and NULL values always
 * come last, whichever the direction.
 */
public class Sorter {
    private static final Logger logger = LoggerFactory.getLogger(Sorter.class);

    public void sort(Table table, String column, SortDirection direction) {
        int index = table.requireColumn(column);
        List<Row> rows = new ArrayList<>(table.getRows());
        // List.sort is a stable merge sort
        rows.sort(Comparator.comparing((Row row) -> row.get(index), comparator(direction)));
        table.replaceRows(rows);
        logger.debug("Sorted {} rows by '{}' {}", rows.size(), column, direction);
    }

    static Comparator<Value> comparator(SortDirection direction) {
        Comparator<Value> present = Comparator.naturalOrder();
        if (direction == SortDirection.DESCENDING) {
            present = present.reversed();
        }
        Comparator<Value> ordering = present;
        return (a, b) -> {
            if (a.isNull() || b.isNull()) {
                return Boolean.compare(a.isNull(), b.isNull());
            }
            return ordering.compare(a, b);
        };
    }
}
