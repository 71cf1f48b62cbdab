package com.jclean.cleaning;

import com.jclean.common.schema.ColumnType;

/**
 * Outcome of a column retype.
 */
public class RetypeReport {
    private final String column;
    private final ColumnType previousType;
    private final ColumnType newType;
    private final int valuesNulled;

    public RetypeReport(String column, ColumnType previousType, ColumnType newType, int valuesNulled) {
        this.column = column;
        this.previousType = previousType;
        this.newType = newType;
        this.valuesNulled = valuesNulled;
    }

    public String getColumn() {
        return column;
    }

    public ColumnType getPreviousType() {
        return previousType;
    }

    public ColumnType getNewType() {
        return newType;
    }

    /**
     * Number of previously non-null values that could not be converted.
     */
    public int getValuesNulled() {
        return valuesNulled;
    }

    @Override
    public String toString() {
        return String.format("Column '%s' converted from %s to %s (%d values could not be converted)",
            column, previousType.getAlias(), newType.getAlias(), valuesNulled);
    }
}
