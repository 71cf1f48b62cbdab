package com.jclean.query;

import com.jclean.table.Row;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds rows whose value in a column contains a query, ignoring case.
 */
public class Searcher {
    private static final Logger logger = LoggerFactory.getLogger(Searcher.class);

    /**
     * Searches one column. The table is not modified.
     *
     * @param table Table to search
     * @param column Column whose canonical text is matched
     * @param query Substring to look for; an empty query matches every row
     * @return A detached table with the matching rows in their current order
     */
    public Table search(Table table, String column, String query) {
        int index = table.requireColumn(column);
        String needle = query.toLowerCase(Locale.ROOT);
        List<Row> matches = new ArrayList<>();
        for (Row row : table.getRows()) {
            // NULL renders as "" so it only matches the empty query
            String text = row.get(index).toText().toLowerCase(Locale.ROOT);
            if (text.contains(needle)) {
                matches.add(row);
            }
        }
        logger.debug("Search for '{}' in column '{}' matched {} rows", query, column, matches.size());
        return table.snapshot(matches);
    }
}
