package com.jclean.common;

import java.util.Objects;

/**
 * Raised by table operations when a command cannot complete. The table an
 * operation was working on is left untouched whenever this is thrown.
 */
public class CleaningException extends RuntimeException {
    private final ErrorKind kind;

    public CleaningException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public CleaningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static CleaningException columnNotFound(String column) {
        return new CleaningException(ErrorKind.COLUMN_NOT_FOUND, "Column not found: " + column);
    }
}
