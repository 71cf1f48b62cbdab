package com.jclean.io;

import java.io.IOException;

/**
 * Thrown when a table file is not well-formed delimited text.
 */
public class TableParseException extends IOException {
    public TableParseException(String message) {
        super(message);
    }

    public TableParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
