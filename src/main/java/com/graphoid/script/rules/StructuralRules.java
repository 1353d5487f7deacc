package com.graphoid.script.rules;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.graphoid.script.graph.EdgeInfo;
import com.graphoid.script.graph.Graph;
import com.graphoid.script.graph.GraphType;
import com.graphoid.script.runtime.Operators;
import com.graphoid.script.runtime.Value;

/**
 * Structural rule checks. {@link #check} returns a violation message or null. Additions are checked
 * against the state before the operation, removals against the state after it.
 */
public final class StructuralRules {
    private StructuralRules() {}

    public static String check(Graph g, RuleSpec spec, GraphOperation op) {
        switch (spec.kind) {
            case NO_CYCLES:
                if (op.kind == GraphOperation.Kind.ADD_EDGE && g.getGraphType() == GraphType.DIRECTED
                        && (op.from.equals(op.to) || g.hasPath(op.to, op.from))) {
                    return "Adding edge " + op.from + " -> " + op.to + " would create a cycle";
                }
                return null;
            case SINGLE_ROOT:
                if (op.isRemoval()) return singleRootViolation(g);
                return null;
            case CONNECTED:
                if (op.isRemoval() && !isConnected(g)) return "Graph must remain connected";
                return null;
            case MAX_DEGREE:
                if (op.kind == GraphOperation.Kind.ADD_EDGE && exceedsDegree(g, op, spec.maxDegree)) {
                    return "Node '" + op.from + "' would exceed maximum degree of " + spec.maxDegree;
                }
                return null;
            case BINARY_TREE:
                if (op.kind == GraphOperation.Kind.ADD_EDGE && exceedsDegree(g, op, 2)) {
                    return "Binary tree node '" + op.from + "' cannot have more than 2 children";
                }
                return null;
            case NO_DUPLICATES:
                if (op.kind == GraphOperation.Kind.ADD_NODE) {
                    for (String id : g.dataNodeIds()) {
                        if (!id.equals(op.nodeId) && g.nodeValue(id).valueEquals(op.value)) {
                            return "Duplicate value " + op.value + " (already stored in node '" + id + "')";
                        }
                    }
                }
                return null;
            case WEIGHTED_EDGES:
                if (op.kind == GraphOperation.Kind.ADD_EDGE && op.weight == null) {
                    return "Edge " + op.from + " -> " + op.to + " requires a weight";
                }
                return null;
            case UNWEIGHTED_EDGES:
                if (op.kind == GraphOperation.Kind.ADD_EDGE && op.weight != null) {
                    return "Edge " + op.from + " -> " + op.to + " must not have a weight";
                }
                return null;
            case BST_ORDERING:
                if (op.kind == GraphOperation.Kind.ADD_EDGE) return bstViolation(g, op.from, op.to, op.edgeType);
                return null;
            default:
                return null;
        }
    }

    /** Validates the whole current state, used when a rule is attached to an existing graph. */
    public static String checkState(Graph g, RuleSpec spec) {
        switch (spec.kind) {
            case NO_CYCLES:
                if (g.getGraphType() == GraphType.DIRECTED && hasCycle(g)) return "Graph already contains a cycle";
                return null;
            case SINGLE_ROOT:
                return singleRootViolation(g);
            case CONNECTED:
                return isConnected(g) ? null : "Graph is not connected";
            case MAX_DEGREE:
            case BINARY_TREE: {
                int max = (spec.kind == RuleSpec.Kind.MAX_DEGREE) ? spec.maxDegree : 2;
                for (String id : g.dataNodeIds()) {
                    if (g.neighbors(id).size() > max) {
                        return "Node '" + id + "' exceeds maximum degree of " + max;
                    }
                }
                return null;
            }
            case NO_DUPLICATES: {
                List<String> ids = g.dataNodeIds();
                for (int i = 0; i < ids.size(); i++) {
                    Value vi = g.nodeValue(ids.get(i));
                    for (int j = i + 1; j < ids.size(); j++) {
                        if (vi.valueEquals(g.nodeValue(ids.get(j)))) return "Duplicate value " + vi;
                    }
                }
                return null;
            }
            case WEIGHTED_EDGES:
                for (EdgeInfo e : g.edges()) {
                    if (e.weight == null) return "Edge " + e.from + " -> " + e.to + " has no weight";
                }
                return null;
            case UNWEIGHTED_EDGES:
                for (EdgeInfo e : g.edges()) {
                    if (e.weight != null) return "Edge " + e.from + " -> " + e.to + " has a weight";
                }
                return null;
            case BST_ORDERING:
                for (EdgeInfo e : g.edges()) {
                    String violation = bstViolation(g, e.from, e.to, e.edgeType);
                    if (violation != null) return violation;
                }
                return null;
            default:
                return null;
        }
    }

    /** Left children hold smaller numbers than their parent, right children larger ones. */
    private static String bstViolation(Graph g, String parent, String child, String side) {
        boolean left = "left".equals(side);
        if (!left && !"right".equals(side)) {
            return "BST edge " + parent + " -> " + child + " must be typed 'left' or 'right'";
        }
        Value pv = g.nodeValue(parent);
        Value cv = g.nodeValue(child);
        if (pv == null || cv == null || !pv.isNumeric() || !cv.isNumeric()) {
            return "BST ordering requires numeric node values";
        }
        int cmp = Operators.compare(cv, pv, "<");
        if (left && cmp >= 0) {
            return "BST ordering violated: left child '" + child + "' (" + cv + ") must be less than '" + parent + "' (" + pv + ")";
        }
        if (!left && cmp <= 0) {
            return "BST ordering violated: right child '" + child + "' (" + cv + ") must be greater than '" + parent + "' (" + pv + ")";
        }
        return null;
    }

    private static boolean exceedsDegree(Graph g, GraphOperation op, int max) {
        List<String> out = g.neighbors(op.from);
        if (out.contains(op.to)) return false;
        return out.size() + 1 > max;
    }

    private static String singleRootViolation(Graph g) {
        List<String> ids = g.dataNodeIds();
        if (ids.isEmpty()) return null;
        int roots = 0;
        for (String id : ids) if (g.predecessors(id).isEmpty()) roots++;
        return (roots == 1) ? null : "Graph must have exactly one root, found " + roots;
    }

    private static boolean isConnected(Graph g) {
        List<String> ids = g.dataNodeIds();
        if (ids.size() <= 1) return true;
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(ids.get(0));
        seen.add(ids.get(0));
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            for (String n : g.neighbors(cur)) if (seen.add(n)) queue.add(n);
            for (String n : g.predecessors(cur)) if (seen.add(n)) queue.add(n);
        }
        return seen.size() == ids.size();
    }

    private static boolean hasCycle(Graph g) {
        Set<String> done = new LinkedHashSet<>();
        Set<String> onPath = new LinkedHashSet<>();
        for (String id : g.dataNodeIds()) {
            if (visitForCycle(g, id, done, onPath)) return true;
        }
        return false;
    }

    private static boolean visitForCycle(Graph g, String id, Set<String> done, Set<String> onPath) {
        if (onPath.contains(id)) return true;
        if (done.contains(id)) return false;
        onPath.add(id);
        for (String n : g.neighbors(id)) {
            if (visitForCycle(g, n, done, onPath)) return true;
        }
        onPath.remove(id);
        done.add(id);
        return false;
    }
}
