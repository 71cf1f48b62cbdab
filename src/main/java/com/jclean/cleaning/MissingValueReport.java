package com.jclean.cleaning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-column count of NULL cells, in column order.
 */
public class MissingValueReport {
    private final Map<String, Integer> missingByColumn;

    public MissingValueReport(Map<String, Integer> missingByColumn) {
        this.missingByColumn = Collections.unmodifiableMap(new LinkedHashMap<>(missingByColumn));
    }

    public Map<String, Integer> getMissingByColumn() {
        return missingByColumn;
    }

    public int getMissing(String column) {
        return missingByColumn.getOrDefault(column, 0);
    }

    public int getTotalMissing() {
        int total = 0;
        for (int count : missingByColumn.values()) {
            total += count;
        }
        return total;
    }

    public boolean hasMissing() {
        return getTotalMissing() > 0;
    }

    /**
     * Only the columns that have at least one NULL.
     */
    public Map<String, Integer> getColumnsWithMissing() {
        Map<String, Integer> result = new LinkedHashMap<>();
        missingByColumn.forEach((column, count) -> {
            if (count > 0) {
                result.put(column, count);
            }
        });
        return result;
    }

    @Override
    public String toString() {
        return hasMissing() ? "Missing values: " + getColumnsWithMissing() : "No missing values";
    }
}
