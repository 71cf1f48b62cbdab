package com.jclean.query;

import com.jclean.common.schema.ColumnType;

import java.util.Optional;

public class ColumnSummary {
    private final String name;
    private final ColumnType type;
    private final int missing;
    private final NumericStats stats;

    public ColumnSummary(String name, ColumnType type, int missing, NumericStats stats) {
        this.name = name;
        this.type = type;
        this.missing = missing;
        this.stats = stats;
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public int getMissing() {
        return missing;
    }

    /**
     * Statistics for INTEGER and FLOAT columns; empty for other types.
     */
    public Optional<NumericStats> getStats() {
        return Optional.ofNullable(stats);
    }
}
