package com.graphoid.script.graph;

public enum GraphType {
    DIRECTED,
    /** Every edge is stored in both directions. */
    UNDIRECTED
}
