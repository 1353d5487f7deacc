package com.graphoid.script.config;

public enum ErrorMode {
    /** Every failure raises. */
    STRICT,
    /** Soft failures (missing index or key) evaluate to none. */
    LENIENT,
    /** Soft failures and raised errors are collected and evaluate to none. */
    COLLECT
}
