package com.jclean.query;

import java.util.Locale;

/**
 * Aggregations a pivot can compute per group.
 */
public enum AggregateFunction {
    SUM,
    MEAN,
    COUNT,
    MAX,
    MIN;

    /**
     * Whether the function needs a numeric value column. Only COUNT does not.
     */
    public boolean requiresNumeric() {
        return this != COUNT;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
