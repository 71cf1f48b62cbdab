package com.jclean.cleaning;

import com.jclean.table.Row;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes rows that exactly repeat an earlier row, keeping first occurrences in order.
 */
public class Deduplicator {
    private static final Logger logger = LoggerFactory.getLogger(Deduplicator.class);

    public DedupReport deduplicate(Table table) {
        Set<Row> seen = new HashSet<>();
        List<Row> kept = new ArrayList<>();
        for (Row row : table.getRows()) {
            if (seen.add(row)) {
                kept.add(row);
            }
        }
        int removed = table.rowCount() - kept.size();
        if (removed > 0) {
            table.replaceRows(kept);
        }
        logger.debug("Removed {} duplicate rows, {} remain", removed, kept.size());
        return new DedupReport(removed, kept.size());
    }
}
