package com.graphoid.script.rules;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.graph.Graph;
import com.graphoid.script.runtime.Value;

/** Before/after diffing of a graph around a method call. */
public final class MethodConstraints {
    private MethodConstraints() {}

    /** Constrainable node ids and edge count at one point in time. */
    public static final class Snapshot {
        public final Set<String> nodeIds;
        public final int edgeCount;
        final Graph graph;

        Snapshot(Set<String> nodeIds, int edgeCount, Graph graph) {
            this.nodeIds = nodeIds;
            this.edgeCount = edgeCount;
            this.graph = graph;
        }
    }

    public static boolean hasConstraints(List<RuleInstance> rules) {
        for (RuleInstance r : rules) {
            if (r.spec.category() == RuleSpec.Category.METHOD_CONSTRAINT) return true;
        }
        return false;
    }

    public static Snapshot capture(Graph g) {
        return new Snapshot(new LinkedHashSet<>(g.constrainableNodeIds()), g.constrainableEdgeCount(), g);
    }

    /**
     * Checks every method constraint of {@code rules}. {@code before} must have been captured from
     * the receiver, which stays untouched while the method runs on a copy.
     */
    public static void check(String method, List<RuleInstance> rules, Snapshot before, Graph after, RuleCallback callback) {
        Set<String> afterIds = after.constrainableNodeIds();
        int afterEdges = after.constrainableEdgeCount();
        for (RuleInstance r : rules) {
            switch (r.spec.kind) {
                case READ_ONLY:
                    if (!before.nodeIds.equals(afterIds) || before.edgeCount != afterEdges) {
                        throw violation(method, "violates :read_only constraint: graph was modified");
                    }
                    break;
                case NO_NODE_REMOVALS: {
                    Set<String> removed = new LinkedHashSet<>(before.nodeIds);
                    removed.removeAll(afterIds);
                    if (!removed.isEmpty()) {
                        throw violation(method, "violates :no_node_removals constraint: removed node(s) " + removed);
                    }
                    break;
                }
                case NO_EDGE_REMOVALS:
                    if (afterEdges < before.edgeCount) {
                        throw violation(method, "violates :no_edge_removals constraint: edges removed");
                    }
                    break;
                case CUSTOM_METHOD_CONSTRAINT: {
                    List<Value> args = Arrays.asList(Value.graph(before.graph.copy()), Value.graph(after.copy()));
                    if (!callback.invoke(r.spec.function, args).isTruthy()) {
                        throw violation(method, "violates custom constraint '" + r.spec.name() + "': constraint returned false");
                    }
                    break;
                }
                default:
                    break;
            }
        }
    }

    private static GraphoidException violation(String method, String detail) {
        return GraphoidException.runtime("Method '" + method + "' " + detail);
    }
}
