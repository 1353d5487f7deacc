package com.graphoid.debug;

public enum DebugLevel {
    TRACE, DEBUG, INFO, WARN, ERROR;

    public boolean atLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }
}
