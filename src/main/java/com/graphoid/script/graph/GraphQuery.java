package com.graphoid.script.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.graphoid.script.errors.GraphoidException;

/**
 * Declarative pattern queries: {@code g.match(node("a", type: "Person"), edge(type: "FRIEND"), node("b"))}.
 * Patterns alternate node and edge (or variable-length path) elements; each match binds the node
 * variables to node ids.
 */
public final class GraphQuery {
    private GraphQuery() {}

    public static final class NodePattern {
        public final String variable;
        public final String nodeType;

        public NodePattern(String variable, String nodeType) {
            this.variable = variable;
            this.nodeType = nodeType;
        }

        boolean accepts(GraphNode n) {
            return nodeType == null || nodeType.equals(n.getNodeType());
        }

        @Override
        public String toString() {
            return "node(" + (variable == null ? "_" : variable) + (nodeType == null ? "" : ", type: " + nodeType) + ")";
        }
    }

    public static final class EdgePattern {
        public enum Direction { OUTGOING, INCOMING, BOTH }

        public final String edgeType;
        public final Direction direction;

        public EdgePattern(String edgeType, Direction direction) {
            this.edgeType = edgeType;
            this.direction = (direction == null) ? Direction.OUTGOING : direction;
        }

        public static Direction parseDirection(String s) {
            switch (s) {
                case "outgoing": return Direction.OUTGOING;
                case "incoming": return Direction.INCOMING;
                case "both": return Direction.BOTH;
                default: throw GraphoidException.runtime("Unknown edge direction: " + s);
            }
        }

        @Override
        public String toString() {
            return "edge(" + (edgeType == null ? "" : "type: " + edgeType + ", ") + "direction: " + direction.name().toLowerCase() + ")";
        }
    }

    /** Variable-length path between {@code min} and {@code max} edges. */
    public static final class PathPattern {
        public final String edgeType;
        public final int min;
        public final int max;

        public PathPattern(String edgeType, int min, int max) {
            if (min < 0 || max < min) throw GraphoidException.runtime("Invalid path bounds: " + min + ".." + max);
            this.edgeType = edgeType;
            this.min = min;
            this.max = max;
        }

        @Override
        public String toString() {
            return "path(" + (edgeType == null ? "" : "edge_type: " + edgeType + ", ") + "min: " + min + ", max: " + max + ")";
        }
    }

    /** Every binding of node variables satisfying the pattern sequence, in graph order. */
    public static List<Map<String, String>> match(Graph g, List<Object> patterns) {
        if (patterns.isEmpty() || !(patterns.get(0) instanceof NodePattern)) {
            throw GraphoidException.runtime("Graph pattern must start with a node pattern");
        }
        for (int i = 0; i < patterns.size(); i++) {
            boolean expectNode = (i % 2 == 0);
            Object p = patterns.get(i);
            if (expectNode != (p instanceof NodePattern)) {
                throw GraphoidException.runtime("Graph pattern must alternate node and edge patterns");
            }
        }
        if (patterns.size() % 2 == 0) throw GraphoidException.runtime("Graph pattern must end with a node pattern");

        List<Map<String, String>> results = new ArrayList<>();
        NodePattern first = (NodePattern) patterns.get(0);
        for (String id : g.dataNodeIds()) {
            if (!first.accepts(g.getNode(id))) continue;
            Map<String, String> bindings = new LinkedHashMap<>();
            if (bind(bindings, first, id)) extend(g, patterns, 1, id, bindings, results);
        }
        return results;
    }

    private static void extend(Graph g, List<Object> patterns, int index, String at,
                               Map<String, String> bindings, List<Map<String, String>> results) {
        if (index >= patterns.size()) {
            results.add(new LinkedHashMap<>(bindings));
            return;
        }
        Object connector = patterns.get(index);
        NodePattern next = (NodePattern) patterns.get(index + 1);
        for (String candidate : step(g, connector, at)) {
            if (!next.accepts(g.getNode(candidate))) continue;
            Map<String, String> extended = new LinkedHashMap<>(bindings);
            if (bind(extended, next, candidate)) extend(g, patterns, index + 2, candidate, extended, results);
        }
    }

    private static boolean bind(Map<String, String> bindings, NodePattern p, String id) {
        if (p.variable == null) return true;
        String existing = bindings.get(p.variable);
        if (existing != null) return existing.equals(id);
        bindings.put(p.variable, id);
        return true;
    }

    private static Set<String> step(Graph g, Object connector, String from) {
        Set<String> out = new LinkedHashSet<>();
        if (connector instanceof EdgePattern) {
            EdgePattern e = (EdgePattern) connector;
            if (e.direction != EdgePattern.Direction.INCOMING) {
                for (String n : g.neighbors(from)) {
                    if (typeMatches(e.edgeType, g.getEdge(from, n))) out.add(n);
                }
            }
            if (e.direction != EdgePattern.Direction.OUTGOING) {
                for (String p : g.predecessors(from)) {
                    if (typeMatches(e.edgeType, g.getEdge(p, from))) out.add(p);
                }
            }
            return out;
        }
        PathPattern path = (PathPattern) connector;
        walk(g, path, from, 0, new LinkedHashSet<>(List.of(from)), out);
        return out;
    }

    private static void walk(Graph g, PathPattern path, String at, int depth, Set<String> visited, Set<String> out) {
        if (depth >= path.min) out.add(at);
        if (depth == path.max) return;
        for (String n : g.neighbors(at)) {
            if (visited.contains(n) || !typeMatches(path.edgeType, g.getEdge(at, n))) continue;
            visited.add(n);
            walk(g, path, n, depth + 1, visited, out);
            visited.remove(n);
        }
    }

    private static boolean typeMatches(String wanted, EdgeInfo edge) {
        return wanted == null || (edge != null && wanted.equals(edge.edgeType));
    }
}
