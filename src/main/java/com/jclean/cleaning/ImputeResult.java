package com.jclean.cleaning;

/**
 * Outcome of resolving missing values: the counts seen before the change and
 * what the change did.
 */
public class ImputeResult {
    private final ImputePolicy policy;
    private final MissingValueReport before;
    private final int rowsDropped;
    private final int cellsFilled;

    public ImputeResult(ImputePolicy policy, MissingValueReport before, int rowsDropped, int cellsFilled) {
        this.policy = policy;
        this.before = before;
        this.rowsDropped = rowsDropped;
        this.cellsFilled = cellsFilled;
    }

    public ImputePolicy getPolicy() {
        return policy;
    }

    public MissingValueReport getBefore() {
        return before;
    }

    public int getRowsDropped() {
        return rowsDropped;
    }

    public int getCellsFilled() {
        return cellsFilled;
    }

    @Override
    public String toString() {
        if (!before.hasMissing()) {
            return "No missing values found";
        }
        return policy.getKind() == ImputePolicy.Kind.DROP_ROWS
            ? "Removed " + rowsDropped + " rows with missing values"
            : "Filled " + cellsFilled + " missing values (" + policy + ")";
    }
}
