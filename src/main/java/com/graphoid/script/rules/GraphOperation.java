package com.graphoid.script.rules;

import com.graphoid.script.runtime.Value;

/** A graph mutation under validation. */
public final class GraphOperation {
    public enum Kind { ADD_NODE, ADD_EDGE, REMOVE_NODE, REMOVE_EDGE }

    public final Kind kind;
    public final String nodeId;
    public final Value value;
    public final String from;
    public final String to;
    public final String edgeType;
    public final Double weight;

    private GraphOperation(Kind kind, String nodeId, Value value, String from, String to, String edgeType, Double weight) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.value = value;
        this.from = from;
        this.to = to;
        this.edgeType = edgeType;
        this.weight = weight;
    }

    public static GraphOperation addNode(String id, Value value) {
        return new GraphOperation(Kind.ADD_NODE, id, value, null, null, null, null);
    }

    public static GraphOperation addEdge(String from, String to, String edgeType, Double weight) {
        return new GraphOperation(Kind.ADD_EDGE, null, null, from, to, edgeType, weight);
    }

    public static GraphOperation removeNode(String id) {
        return new GraphOperation(Kind.REMOVE_NODE, id, null, null, null, null, null);
    }

    public static GraphOperation removeEdge(String from, String to) {
        return new GraphOperation(Kind.REMOVE_EDGE, null, null, from, to, null, null);
    }

    public boolean isRemoval() {
        return kind == Kind.REMOVE_NODE || kind == Kind.REMOVE_EDGE;
    }
}
