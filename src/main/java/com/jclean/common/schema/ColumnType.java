package com.jclean.common.schema;

/**
 * Declared types a table column can carry.
 */
public enum ColumnType {
    INTEGER("int"),
    FLOAT("float"),
    TEXT("str"),
    DATETIME("datetime");

    private final String alias;

    ColumnType(String alias) {
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
