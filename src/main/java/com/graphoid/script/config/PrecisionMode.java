package com.graphoid.script.config;

/** Selects the representation of numeric literals. */
public enum PrecisionMode {
    /** 64-bit floating point. */
    STANDARD,
    /** 128-bit decimal float, or 64-bit integers in integer mode. */
    HIGH,
    /** Arbitrary-precision integers. */
    EXTENDED
}
