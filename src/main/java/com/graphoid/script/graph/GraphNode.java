package com.graphoid.script.graph;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

import com.graphoid.script.runtime.Value;

public final class GraphNode {
    public final String id;
    private Value value;
    private String nodeType;
    final LinkedHashMap<String, EdgeInfo> neighbors = new LinkedHashMap<>();
    final LinkedHashSet<String> predecessors = new LinkedHashSet<>();

    GraphNode(String id, Value value) {
        this.id = id;
        this.value = value;
    }

    public Value getValue() { return value; }
    void setValue(Value value) { this.value = value; }

    public String getNodeType() { return nodeType; }
    void setNodeType(String nodeType) { this.nodeType = nodeType; }

    GraphNode copy() {
        GraphNode n = new GraphNode(id, value.deepCopy());
        n.nodeType = nodeType;
        for (Map.Entry<String, EdgeInfo> e : neighbors.entrySet()) n.neighbors.put(e.getKey(), e.getValue());
        n.predecessors.addAll(predecessors);
        return n;
    }
}
