package com.jclean.cleaning;

public class DedupReport {
    private final int rowsRemoved;
    private final int rowsRemaining;

    public DedupReport(int rowsRemoved, int rowsRemaining) {
        this.rowsRemoved = rowsRemoved;
        this.rowsRemaining = rowsRemaining;
    }

    public int getRowsRemoved() {
        return rowsRemoved;
    }

    public int getRowsRemaining() {
        return rowsRemaining;
    }

    @Override
    public String toString() {
        return "Removed " + rowsRemoved + " duplicate rows, " + rowsRemaining + " remaining";
    }
}
