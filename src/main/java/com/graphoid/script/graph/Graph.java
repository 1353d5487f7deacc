package com.graphoid.script.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.graphoid.debug.Debug;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.rules.GraphOperation;
import com.graphoid.script.rules.RuleInstance;
import com.graphoid.script.rules.RuleSeverity;
import com.graphoid.script.rules.RuleSpec;
import com.graphoid.script.rules.Rulesets;
import com.graphoid.script.rules.StructuralRules;
import com.graphoid.script.runtime.GraphFunction;
import com.graphoid.script.runtime.Value;

/**
 * Node-keyed graph that doubles as an object: properties live in {@code __properties__/<name>} nodes,
 * methods in three tables (instance, static, setter), and inheritance in an owned parent chain.
 *
 * <p>Node ids starting with {@code __} are never data. Of those, property nodes belong to the
 * constrainable view used for method-constraint diffing; {@code __methods__*}, {@code __parent__}
 * and {@code __self__} are bookkeeping.
 */
public class Graph {
    private static final String TAG = "Rules";

    public static final String PROPERTY_PREFIX = "__properties__/";
    public static final String METHODS_NODE = "__methods__";
    public static final String METHOD_PREFIX = "__methods__/";
    public static final String PARENT_NODE = "__parent__";
    public static final String SELF_NODE = "__self__";
    public static final String INHERITS_FROM = "inherits_from";

    private final LinkedHashMap<String, GraphNode> nodes = new LinkedHashMap<>();
    private GraphType graphType = GraphType.DIRECTED;
    private String typeName;
    private Graph parent;
    private final List<RuleInstance> rules = new ArrayList<>();
    private final List<String> rulesets = new ArrayList<>();
    private final LinkedHashMap<String, List<GraphFunction>> methods = new LinkedHashMap<>();
    private final LinkedHashMap<String, GraphFunction> staticMethods = new LinkedHashMap<>();
    private final LinkedHashMap<String, GraphFunction> setters = new LinkedHashMap<>();
    private boolean frozen;

    public Graph() {}

    public Graph(GraphType graphType) {
        this.graphType = graphType;
    }

    /** New graph inheriting everything from {@code parent}, which becomes its owned parent link. */
    public static Graph fromParent(Graph parent) {
        Graph child = parent.copy();
        child.frozen = false;
        child.typeName = null;
        child.parent = parent.copy();
        child.putInternalNode(PARENT_NODE, Value.none());
        child.putInternalNode(SELF_NODE, Value.none());
        child.putInternalEdge(SELF_NODE, PARENT_NODE, INHERITS_FROM);
        return child;
    }

    // -------------------------
    // Identity
    // -------------------------

    public String getTypeName() { return typeName; }
    public void setTypeName(String typeName) { this.typeName = typeName; }
    public GraphType getGraphType() { return graphType; }
    public void setGraphType(GraphType graphType) { this.graphType = graphType; }
    public Graph getParent() { return parent; }

    /** Type names of the parent chain, nearest first. */
    public List<String> ancestors() {
        List<String> out = new ArrayList<>();
        for (Graph g = parent; g != null; g = g.parent) {
            if (g.typeName != null) out.add(g.typeName);
        }
        return out;
    }

    public boolean isA(String name) {
        if (name.equals(typeName)) return true;
        return ancestors().contains(name);
    }

    // -------------------------
    // Node id classification
    // -------------------------

    public static boolean isDataId(String id) {
        return !id.startsWith("__");
    }

    public static boolean isInternalId(String id) {
        return id.startsWith(METHODS_NODE) || id.equals(PARENT_NODE) || id.equals(SELF_NODE);
    }

    public List<String> nodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<String> dataNodeIds() {
        List<String> out = new ArrayList<>();
        for (String id : nodes.keySet()) if (isDataId(id)) out.add(id);
        return out;
    }

    /** User data nodes plus property nodes; bookkeeping nodes excluded. */
    public Set<String> constrainableNodeIds() {
        Set<String> out = new LinkedHashSet<>();
        for (String id : nodes.keySet()) if (!isInternalId(id)) out.add(id);
        return out;
    }

    public int nodeCount() {
        int n = 0;
        for (String id : nodes.keySet()) if (isDataId(id)) n++;
        return n;
    }

    public int edgeCount() {
        return countEdges(true);
    }

    public int constrainableEdgeCount() {
        return countEdges(false);
    }

    private int countEdges(boolean dataOnly) {
        int n = 0;
        for (GraphNode node : nodes.values()) {
            if (dataOnly ? !isDataId(node.id) : isInternalId(node.id)) continue;
            for (EdgeInfo e : node.neighbors.values()) {
                if (dataOnly ? !isDataId(e.to) : isInternalId(e.to)) continue;
                if (graphType == GraphType.UNDIRECTED && e.from.compareTo(e.to) > 0) continue;
                n++;
            }
        }
        return n;
    }

    // -------------------------
    // Nodes and edges
    // -------------------------

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    public Value nodeValue(String id) {
        GraphNode n = nodes.get(id);
        return (n == null) ? null : n.getValue();
    }

    /** Adds or replaces a data node. Returns false when a non-error rule rejected it. */
    public boolean addNode(String id, Value value) {
        checkMutable();
        if (!permits(GraphOperation.addNode(id, value))) return false;
        GraphNode existing = nodes.get(id);
        if (existing != null) existing.setValue(value);
        else nodes.put(id, new GraphNode(id, value));
        return true;
    }

    public void setNodeType(String id, String nodeType) {
        checkMutable();
        requireNode(id).setNodeType(nodeType);
    }

    public boolean addEdge(String from, String to, String edgeType, Double weight) {
        checkMutable();
        requireNode(from);
        requireNode(to);
        if (!permits(GraphOperation.addEdge(from, to, edgeType, weight))) return false;
        putEdge(from, to, edgeType, weight);
        if (graphType == GraphType.UNDIRECTED && !from.equals(to)) putEdge(to, from, edgeType, weight);
        return true;
    }

    private void putEdge(String from, String to, String edgeType, Double weight) {
        nodes.get(from).neighbors.put(to, new EdgeInfo(from, to, edgeType, weight));
        nodes.get(to).predecessors.add(from);
    }

    public boolean hasEdge(String from, String to) {
        GraphNode n = nodes.get(from);
        return n != null && n.neighbors.containsKey(to);
    }

    public EdgeInfo getEdge(String from, String to) {
        GraphNode n = nodes.get(from);
        return (n == null) ? null : n.neighbors.get(to);
    }

    public boolean removeNode(String id) {
        checkMutable();
        if (!nodes.containsKey(id)) return false;
        Graph before = copy();
        detachNode(id);
        return validateRemoval(GraphOperation.removeNode(id), before);
    }

    public boolean removeEdge(String from, String to) {
        checkMutable();
        if (!hasEdge(from, to)) return false;
        Graph before = copy();
        dropEdge(from, to);
        if (graphType == GraphType.UNDIRECTED) dropEdge(to, from);
        return validateRemoval(GraphOperation.removeEdge(from, to), before);
    }

    private void detachNode(String id) {
        GraphNode node = nodes.remove(id);
        for (String succ : node.neighbors.keySet()) {
            GraphNode s = nodes.get(succ);
            if (s != null) s.predecessors.remove(id);
        }
        for (String pred : node.predecessors) {
            GraphNode p = nodes.get(pred);
            if (p != null) p.neighbors.remove(id);
        }
    }

    private void dropEdge(String from, String to) {
        GraphNode f = nodes.get(from);
        GraphNode t = nodes.get(to);
        if (f != null) f.neighbors.remove(to);
        if (t != null) t.predecessors.remove(from);
    }

    private GraphNode requireNode(String id) {
        GraphNode n = nodes.get(id);
        if (n == null) throw GraphoidException.runtime("Node '" + id + "' does not exist");
        return n;
    }

    private void putInternalNode(String id, Value value) {
        GraphNode existing = nodes.get(id);
        if (existing != null) existing.setValue(value);
        else nodes.put(id, new GraphNode(id, value));
    }

    private void putInternalEdge(String from, String to, String type) {
        putEdge(from, to, type, null);
    }

    // -------------------------
    // Traversal
    // -------------------------

    public List<String> neighbors(String id) {
        List<String> out = new ArrayList<>();
        for (String n : requireNode(id).neighbors.keySet()) if (isDataId(n)) out.add(n);
        return out;
    }

    public List<String> predecessors(String id) {
        List<String> out = new ArrayList<>();
        for (String n : requireNode(id).predecessors) if (isDataId(n)) out.add(n);
        return out;
    }

    /** Data edges in insertion order; undirected edges appear once. */
    public List<EdgeInfo> edges() {
        List<EdgeInfo> out = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (!isDataId(node.id)) continue;
            for (EdgeInfo e : node.neighbors.values()) {
                if (!isDataId(e.to)) continue;
                if (graphType == GraphType.UNDIRECTED && e.from.compareTo(e.to) > 0) continue;
                out.add(e);
            }
        }
        return out;
    }

    public boolean hasPath(String from, String to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) return false;
        return bfs(from).contains(to);
    }

    /** Fewest-edges path, empty when unreachable. */
    public List<String> shortestPath(String from, String to) {
        requireNode(from);
        requireNode(to);
        Map<String, String> cameFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new LinkedHashSet<>();
        queue.add(from);
        seen.add(from);
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            if (cur.equals(to)) {
                List<String> path = new ArrayList<>();
                for (String at = to; at != null; at = cameFrom.get(at)) path.add(at);
                Collections.reverse(path);
                return path;
            }
            for (String next : neighbors(cur)) {
                if (seen.add(next)) {
                    cameFrom.put(next, cur);
                    queue.add(next);
                }
            }
        }
        return Collections.emptyList();
    }

    public List<String> bfs(String start) {
        requireNode(start);
        List<String> order = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            order.add(cur);
            for (String next : neighbors(cur)) {
                if (seen.add(next)) queue.add(next);
            }
        }
        return order;
    }

    public List<String> dfs(String start) {
        requireNode(start);
        List<String> order = new ArrayList<>();
        dfsVisit(start, new LinkedHashSet<>(), order);
        return order;
    }

    private void dfsVisit(String id, Set<String> seen, List<String> order) {
        if (!seen.add(id)) return;
        order.add(id);
        for (String next : neighbors(id)) dfsVisit(next, seen, order);
    }

    public List<String> topologicalSort() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : dataNodeIds()) inDegree.put(id, predecessors(id).size());
        Deque<String> ready = new ArrayDeque<>();
        for (Map.Entry<String, Integer> e : inDegree.entrySet()) if (e.getValue() == 0) ready.add(e.getKey());
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : neighbors(id)) {
                int d = inDegree.merge(next, -1, Integer::sum);
                if (d == 0) ready.add(next);
            }
        }
        if (order.size() != inDegree.size()) throw GraphoidException.runtime("Graph contains a cycle");
        return order;
    }

    // -------------------------
    // Properties
    // -------------------------

    public void setProperty(String name, Value value) {
        checkMutable();
        putInternalNode(PROPERTY_PREFIX + name, value);
    }

    public Value getProperty(String name) {
        return nodeValue(PROPERTY_PREFIX + name);
    }

    public boolean hasProperty(String name) {
        return nodes.containsKey(PROPERTY_PREFIX + name);
    }

    public List<String> propertyNames() {
        List<String> out = new ArrayList<>();
        for (String id : nodes.keySet()) {
            if (id.startsWith(PROPERTY_PREFIX)) out.add(id.substring(PROPERTY_PREFIX.length()));
        }
        return out;
    }

    // -------------------------
    // Methods
    // -------------------------

    /**
     * Attaches a method to the table matching its flags. An unguarded instance method replaces the
     * previous unguarded variant of the same name; guarded variants accumulate.
     */
    public void attachMethod(GraphFunction fn) {
        if (fn.isSetter) {
            setters.put(fn.name, fn);
        } else if (fn.isStatic) {
            staticMethods.put(fn.name, fn);
        } else {
            List<GraphFunction> variants = methods.computeIfAbsent(fn.name, k -> new ArrayList<>());
            if (fn.guard == null) variants.removeIf(v -> v.guard == null);
            variants.add(fn);
        }
        if (!nodes.containsKey(METHODS_NODE)) putInternalNode(METHODS_NODE, Value.none());
        String methodNode = METHOD_PREFIX + fn.name;
        putInternalNode(methodNode, Value.function(fn));
        putInternalEdge(METHODS_NODE, methodNode, "has_method");
    }

    /** Instance-method variants, guarded ones first. Null when the graph has no such method. */
    public List<GraphFunction> findMethods(String name) {
        List<GraphFunction> variants = methods.get(name);
        if (variants == null || variants.isEmpty()) return null;
        List<GraphFunction> ordered = new ArrayList<>();
        for (GraphFunction f : variants) if (f.guard != null) ordered.add(f);
        for (GraphFunction f : variants) if (f.guard == null) ordered.add(f);
        return ordered;
    }

    public GraphFunction findStaticMethod(String name) {
        return staticMethods.get(name);
    }

    public GraphFunction findSetter(String name) {
        return setters.get(name);
    }

    public boolean hasMethod(String name) {
        return methods.containsKey(name) || staticMethods.containsKey(name);
    }

    /** True when this graph's own instance table holds exactly {@code fn}. */
    public boolean ownsMethod(GraphFunction fn) {
        List<GraphFunction> variants = methods.get(fn.name);
        if (variants != null) {
            for (GraphFunction f : variants) if (f == fn) return true;
        }
        return staticMethods.get(fn.name) == fn || setters.get(fn.name) == fn;
    }

    public boolean removeMethod(String name) {
        checkMutable();
        boolean removed = methods.remove(name) != null;
        removed |= staticMethods.remove(name) != null;
        if (removed && !setters.containsKey(name) && nodes.containsKey(METHOD_PREFIX + name)) {
            detachNode(METHOD_PREFIX + name);
        }
        return removed;
    }

    public List<String> methodNames() {
        List<String> out = new ArrayList<>(methods.keySet());
        for (String s : staticMethods.keySet()) if (!out.contains(s)) out.add(s);
        return out;
    }

    // -------------------------
    // Rules
    // -------------------------

    public List<RuleInstance> rules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Attaches a rule. Structural rules are checked against the current state first; a graph that
     * already violates the rule keeps its rule list unchanged and the call fails.
     */
    public void addRule(RuleInstance rule) {
        for (RuleInstance r : rules) {
            if (r.spec.sameRule(rule.spec)) return;
        }
        if (rule.spec.category() == RuleSpec.Category.STRUCTURAL) {
            String violation = StructuralRules.checkState(this, rule.spec);
            if (violation != null) throw GraphoidException.ruleViolation(rule.spec.name(), violation);
        }
        rules.add(rule);
    }

    public boolean removeRule(String name) {
        return rules.removeIf(r -> r.spec.name().equals(name));
    }

    public boolean hasRule(String name) {
        for (RuleInstance r : rules) if (r.spec.name().equals(name)) return true;
        return false;
    }

    public void addRuleset(String name) {
        for (RuleSpec spec : Rulesets.forName(name)) addRule(new RuleInstance(spec));
        if (!rulesets.contains(name)) rulesets.add(name);
    }

    public boolean hasRuleset(String name) {
        return rulesets.contains(name);
    }

    public List<String> rulesets() {
        return Collections.unmodifiableList(rulesets);
    }

    private boolean permits(GraphOperation op) {
        for (RuleInstance r : rules) {
            if (r.spec.category() != RuleSpec.Category.STRUCTURAL) continue;
            String violation = StructuralRules.check(this, r.spec, op);
            if (violation != null) return reject(r, violation);
        }
        return true;
    }

    /** Removals are checked against the post-state and rolled back on violation. */
    private boolean validateRemoval(GraphOperation op, Graph before) {
        for (RuleInstance r : rules) {
            if (r.spec.category() != RuleSpec.Category.STRUCTURAL) continue;
            String violation = StructuralRules.check(this, r.spec, op);
            if (violation != null) {
                replaceWith(before);
                return reject(r, violation);
            }
        }
        return true;
    }

    private boolean reject(RuleInstance r, String violation) {
        if (r.severity == RuleSeverity.ERROR) throw GraphoidException.ruleViolation(r.spec.name(), violation);
        if (r.severity == RuleSeverity.WARNING) {
            Debug.get().w(TAG, "rule :" + r.spec.name() + " rejected operation: " + violation);
        }
        return false;
    }

    // -------------------------
    // Freezing and copying
    // -------------------------

    public boolean isFrozen() {
        return frozen;
    }

    public void checkMutable() {
        if (frozen) throw GraphoidException.runtime("Cannot modify frozen graph");
    }

    public void freeze(boolean deep) {
        frozen = true;
        if (deep) {
            for (GraphNode n : nodes.values()) {
                if (isDataId(n.id)) n.setValue(n.getValue().freeze(true));
            }
        }
    }

    public void thaw() {
        frozen = false;
        for (GraphNode n : nodes.values()) {
            if (isDataId(n.id)) n.setValue(n.getValue().thaw());
        }
    }

    /** Deep copy of nodes and tables; functions and the parent link are shared. */
    public Graph copy() {
        Graph g = new Graph(graphType);
        for (Map.Entry<String, GraphNode> e : nodes.entrySet()) g.nodes.put(e.getKey(), e.getValue().copy());
        g.typeName = typeName;
        g.parent = parent;
        g.rules.addAll(rules);
        g.rulesets.addAll(rulesets);
        for (Map.Entry<String, List<GraphFunction>> e : methods.entrySet()) {
            g.methods.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        g.staticMethods.putAll(staticMethods);
        g.setters.putAll(setters);
        g.frozen = frozen;
        return g;
    }

    /** Takes over the complete state of {@code other}, which must not be used afterwards. */
    public void replaceWith(Graph other) {
        if (other == this) return;
        nodes.clear();
        nodes.putAll(other.nodes);
        graphType = other.graphType;
        typeName = other.typeName;
        parent = other.parent;
        rules.clear();
        rules.addAll(other.rules);
        rulesets.clear();
        rulesets.addAll(other.rulesets);
        methods.clear();
        methods.putAll(other.methods);
        staticMethods.clear();
        staticMethods.putAll(other.staticMethods);
        setters.clear();
        setters.putAll(other.setters);
        frozen = other.frozen;
    }

    /** Same data nodes with equal values, same data edges, same type name. */
    public boolean structurallyEquals(Graph other) {
        if (this == other) return true;
        if (typeName == null ? other.typeName != null : !typeName.equals(other.typeName)) return false;
        List<String> ids = dataNodeIds();
        if (!ids.equals(other.dataNodeIds())) return false;
        for (String id : ids) {
            if (!nodeValue(id).valueEquals(other.nodeValue(id))) return false;
            if (!neighbors(id).equals(other.neighbors(id))) return false;
        }
        for (String p : propertyNames()) {
            Value mine = getProperty(p);
            Value theirs = other.getProperty(p);
            if (theirs == null || !mine.valueEquals(theirs)) return false;
        }
        return true;
    }
}
