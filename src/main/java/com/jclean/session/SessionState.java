package com.jclean.session;

public enum SessionState {
    NO_TABLE_LOADED,
    TABLE_LOADED
}
