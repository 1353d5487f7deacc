package com.graphoid.script.graph;

/** Outgoing edge as stored on its source node. */
public final class EdgeInfo {
    public static final String DEFAULT_TYPE = "edge";

    public final String from;
    public final String to;
    public final String edgeType;
    public final Double weight;

    public EdgeInfo(String from, String to, String edgeType, Double weight) {
        this.from = from;
        this.to = to;
        this.edgeType = (edgeType == null) ? DEFAULT_TYPE : edgeType;
        this.weight = weight;
    }

    @Override
    public String toString() {
        return from + " -[" + edgeType + (weight == null ? "" : " " + weight) + "]-> " + to;
    }
}
