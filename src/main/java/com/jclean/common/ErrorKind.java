package com.jclean.common;

/**
 * Categories of failure an engine command can report.
 */
public enum ErrorKind {
    SOURCE_NOT_FOUND,
    PARSE_ERROR,
    COLUMN_NOT_FOUND,
    PRECONDITION,
    AGGREGATION,
    PERSISTENCE,
    INVALID_ARGUMENT
}
