package com.graphoid.script.config;

public enum BoundsCheckingMode {
    STRICT,
    LENIENT
}
