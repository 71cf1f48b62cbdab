package com.jclean.session;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.table.Table;

import java.util.Objects;
import java.util.Optional;

/**
 * The single active table of an interactive session. Not thread-safe; a session
 * belongs to one command loop.
 */
public class Session {
    private Table table;
    private boolean finished;

    public SessionState getState() {
        return table == null ? SessionState.NO_TABLE_LOADED : SessionState.TABLE_LOADED;
    }

    public Optional<Table> getTable() {
        return Optional.ofNullable(table);
    }

    /**
     * Returns the active table.
     *
     * @throws CleaningException PRECONDITION when no table is loaded
     */
    public Table requireTable() {
        if (table == null) {
            throw new CleaningException(ErrorKind.PRECONDITION, "No table loaded. Please load a file first.");
        }
        return table;
    }

    /**
     * Makes a fully built table the active one, replacing any previous table.
     */
    public void replaceTable(Table newTable) {
        this.table = Objects.requireNonNull(newTable, "table cannot be null");
    }

    public boolean isFinished() {
        return finished;
    }

    void finish() {
        this.finished = true;
    }
}
