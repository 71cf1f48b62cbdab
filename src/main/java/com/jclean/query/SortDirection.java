package com.jclean.query;

public enum SortDirection {
    ASCENDING,
    DESCENDING
}
