package com.jclean.session;

/**
 * Commands a session accepts. Only LOAD and EXIT are valid without a table.
 */
public enum CommandType {
    LOAD(false),
    IMPUTE(true),
    DEDUP(true),
    RETYPE(true),
    SEARCH(true),
    SORT(true),
    PIVOT(true),
    SUMMARIZE(true),
    PERSIST(true),
    MISSING_REPORT(true),
    EXIT(false);

    private final boolean requiresTable;

    CommandType(boolean requiresTable) {
        this.requiresTable = requiresTable;
    }

    public boolean isAllowedIn(SessionState state) {
        return !requiresTable || state == SessionState.TABLE_LOADED;
    }
}
