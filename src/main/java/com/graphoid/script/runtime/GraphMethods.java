package com.graphoid.script.runtime;

import static com.graphoid.script.runtime.BuiltinMethods.expectArgs;
import static com.graphoid.script.runtime.BuiltinMethods.key;
import static com.graphoid.script.runtime.BuiltinMethods.register;
import static com.graphoid.script.runtime.BuiltinMethods.registerMutator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.graph.EdgeInfo;
import com.graphoid.script.graph.Graph;
import com.graphoid.script.graph.GraphQuery;
import com.graphoid.script.rules.RuleInstance;
import com.graphoid.script.rules.RuleSpec;
import com.graphoid.script.rules.Rulesets;

/**
 * Built-in graph methods. Mutators change the receiver copy in place and the interpreter commits it
 * back; queries leave it alone.
 */
final class GraphMethods {
    static final String DEFAULT_EDGE_TYPE = "edge";

    private GraphMethods() {}

    static void registerAll() {
        registerMutations();
        registerQueries();
        registerObjectModel();
        registerRules();
    }

    private static void registerMutations() {
        final Value.Type G = Value.Type.GRAPH;

        registerMutator(G, "add_node", (itp, self, a) -> {
            expectArgs("add_node", a, 2, 2);
            Graph g = self.asGraph();
            g.addNode(nodeId(a.get(0)), itp.applyInsertRules(g.rules(), a.get(1)));
            return Value.none();
        });
        registerMutator(G, "add_edge", (itp, self, a) -> {
            expectArgs("add_edge", a, 2, 4);
            String edgeType = DEFAULT_EDGE_TYPE;
            Double weight = null;
            for (int i = 2; i < a.size(); i++) {
                Value v = a.get(i);
                if (v.type == Value.Type.STRING && i == 2) edgeType = v.asString();
                else if (v.isNumeric()) weight = v.asNumber();
                else if (!v.isNone()) {
                    throw GraphoidException.type("add_edge() expects an edge type string or a numeric weight, got " + v.typeName());
                }
            }
            self.asGraph().addEdge(nodeId(a.get(0)), nodeId(a.get(1)), edgeType, weight);
            return Value.none();
        });
        registerMutator(G, "remove_node", (itp, self, a) -> {
            expectArgs("remove_node", a, 1, 1);
            return Value.bool(self.asGraph().removeNode(nodeId(a.get(0))));
        });
        registerMutator(G, "remove_edge", (itp, self, a) -> {
            expectArgs("remove_edge", a, 2, 2);
            return Value.bool(self.asGraph().removeEdge(nodeId(a.get(0)), nodeId(a.get(1))));
        });
        registerMutator(G, "set_node_type", (itp, self, a) -> {
            expectArgs("set_node_type", a, 2, 2);
            self.asGraph().setNodeType(nodeId(a.get(0)), BuiltinMethods.str(a, 1, "set_node_type"));
            return Value.none();
        });
    }

    private static void registerQueries() {
        final Value.Type G = Value.Type.GRAPH;

        register(G, "has_node", (itp, self, a) -> {
            expectArgs("has_node", a, 1, 1);
            String id = nodeId(a.get(0));
            return Value.bool(Graph.isDataId(id) && self.asGraph().hasNode(id));
        });
        register(G, "has_edge", (itp, self, a) -> {
            expectArgs("has_edge", a, 2, 2);
            return Value.bool(self.asGraph().hasEdge(nodeId(a.get(0)), nodeId(a.get(1))));
        });
        register(G, "get_node", (itp, self, a) -> {
            expectArgs("get_node", a, 1, 1);
            String id = nodeId(a.get(0));
            Value v = Graph.isDataId(id) ? self.asGraph().nodeValue(id) : null;
            return (v == null) ? Value.none() : v;
        });
        register(G, "nodes", (itp, self, a) -> {
            expectArgs("nodes", a, 0, 0);
            return ids(self.asGraph().dataNodeIds());
        });
        register(G, "edges", (itp, self, a) -> {
            expectArgs("edges", a, 0, 0);
            List<Value> out = new ArrayList<>();
            for (EdgeInfo e : self.asGraph().edges()) {
                List<Value> triple = new ArrayList<>();
                triple.add(Value.string(e.from));
                triple.add(Value.string(e.to));
                triple.add(Value.string(e.edgeType == null ? DEFAULT_EDGE_TYPE : e.edgeType));
                out.add(Value.list(triple));
            }
            return Value.list(out);
        });
        register(G, "node_count", (itp, self, a) -> Value.number(self.asGraph().nodeCount()));
        register(G, "edge_count", (itp, self, a) -> Value.number(self.asGraph().edgeCount()));
        register(G, "neighbors", (itp, self, a) -> {
            expectArgs("neighbors", a, 1, 1);
            return ids(self.asGraph().neighbors(nodeId(a.get(0))));
        });
        register(G, "predecessors", (itp, self, a) -> {
            expectArgs("predecessors", a, 1, 1);
            return ids(self.asGraph().predecessors(nodeId(a.get(0))));
        });
        register(G, "has_path", (itp, self, a) -> {
            expectArgs("has_path", a, 2, 2);
            return Value.bool(self.asGraph().hasPath(nodeId(a.get(0)), nodeId(a.get(1))));
        });
        register(G, "shortest_path", (itp, self, a) -> {
            expectArgs("shortest_path", a, 2, 2);
            List<String> path = self.asGraph().shortestPath(nodeId(a.get(0)), nodeId(a.get(1)));
            return path.isEmpty() ? Value.none() : ids(path);
        });
        register(G, "bfs", (itp, self, a) -> {
            expectArgs("bfs", a, 1, 1);
            return ids(self.asGraph().bfs(nodeId(a.get(0))));
        });
        register(G, "dfs", (itp, self, a) -> {
            expectArgs("dfs", a, 1, 1);
            return ids(self.asGraph().dfs(nodeId(a.get(0))));
        });
        register(G, "topological_sort", (itp, self, a) -> ids(self.asGraph().topologicalSort()));
        register(G, "match", (itp, self, a) -> {
            List<Object> patterns = new ArrayList<>();
            for (Value v : a) {
                switch (v.type) {
                    case PATTERN_NODE:
                    case PATTERN_EDGE:
                    case PATTERN_PATH:
                        patterns.add(v.value);
                        break;
                    default:
                        throw GraphoidException.type("match() expects node, edge or path patterns, got " + v.typeName());
                }
            }
            List<Value> out = new ArrayList<>();
            for (Map<String, String> binding : GraphQuery.match(self.asGraph(), patterns)) {
                MapValue m = new MapValue();
                for (Map.Entry<String, String> e : binding.entrySet()) m.put(e.getKey(), Value.string(e.getValue()));
                out.add(Value.map(m));
            }
            return Value.list(out);
        });
    }

    private static void registerObjectModel() {
        final Value.Type G = Value.Type.GRAPH;

        register(G, "clone", (itp, self, a) -> {
            Graph copy = self.asGraph().copy();
            copy.thaw();
            return Value.graph(copy);
        });
        register(G, "type_of", (itp, self, a) -> {
            String name = self.asGraph().getTypeName();
            return Value.string(name == null ? "graph" : name);
        });
        register(G, "is_a", (itp, self, a) -> {
            expectArgs("is_a", a, 1, 1);
            Value t = a.get(0);
            String name;
            if (t.type == Value.Type.GRAPH) name = t.asGraph().getTypeName();
            else name = BuiltinMethods.str(a, 0, "is_a");
            return Value.bool(name != null && self.asGraph().isA(name));
        });
        register(G, "responds_to", (itp, self, a) -> {
            expectArgs("responds_to", a, 1, 1);
            String name = BuiltinMethods.str(a, 0, "responds_to");
            for (Graph g = self.asGraph(); g != null; g = g.getParent()) {
                if (g.hasMethod(name)) return Value.bool(true);
            }
            return Value.bool(false);
        });
        register(G, "method_names", (itp, self, a) -> ids(self.asGraph().methodNames()));
        register(G, "property_names", (itp, self, a) -> ids(self.asGraph().propertyNames()));
        register(G, "ancestors", (itp, self, a) -> ids(self.asGraph().ancestors()));

        registerMutator(G, "include", (itp, self, a) -> {
            expectArgs("include", a, 1, 1);
            if (a.get(0).type != Value.Type.GRAPH) throw GraphoidException.runtime("include() argument must be a graph");
            Graph target = self.asGraph();
            target.checkMutable();
            Graph source = a.get(0).asGraph();
            List<String> included = new ArrayList<>();
            for (String name : source.methodNames()) {
                if (name.startsWith("_")) continue;
                boolean copied = false;
                List<GraphFunction> variants = source.findMethods(name);
                if (variants != null) {
                    for (GraphFunction fn : variants) {
                        if (fn.isPrivate) continue;
                        target.attachMethod(fn);
                        copied = true;
                    }
                }
                GraphFunction st = source.findStaticMethod(name);
                if (st != null && !st.isPrivate) {
                    target.attachMethod(st);
                    copied = true;
                }
                if (copied) included.add(name);
            }
            return ids(included);
        });
        registerMutator(G, "remove_method", (itp, self, a) -> {
            expectArgs("remove_method", a, 1, 1);
            return Value.bool(self.asGraph().removeMethod(BuiltinMethods.str(a, 0, "remove_method")));
        });
    }

    private static void registerRules() {
        final Value.Type G = Value.Type.GRAPH;

        registerMutator(G, "add_rule", (itp, self, a) -> {
            Graph g = self.asGraph();
            g.checkMutable();
            RuleInstance rule = CollectionMethods.ruleFromArguments(a, "add_rule");
            if (rule.spec.category() == RuleSpec.Category.TRANSFORMATION) {
                List<RuleInstance> single = Collections.singletonList(rule);
                for (String id : g.dataNodeIds()) g.addNode(id, itp.applyInsertRules(single, g.nodeValue(id)));
            }
            g.addRule(rule);
            return Value.none();
        });
        registerMutator(G, "remove_rule", (itp, self, a) -> {
            expectArgs("remove_rule", a, 1, 1);
            return Value.bool(self.asGraph().removeRule(CollectionMethods.ruleName(a.get(0))));
        });
        register(G, "has_rule", (itp, self, a) -> {
            expectArgs("has_rule", a, 1, 1);
            return Value.bool(self.asGraph().hasRule(CollectionMethods.ruleName(a.get(0))));
        });
        register(G, "rules", (itp, self, a) -> {
            List<Value> out = new ArrayList<>();
            for (RuleInstance r : self.asGraph().rules()) out.add(Value.symbol(r.spec.name()));
            return Value.list(out);
        });
        registerMutator(G, "with_ruleset", (itp, self, a) -> {
            expectArgs("with_ruleset", a, 1, 1);
            Value v = a.get(0);
            if (v.type != Value.Type.SYMBOL) throw GraphoidException.type("with_ruleset() expects a symbol, got " + v.typeName());
            if (!Rulesets.exists(v.asSymbol())) throw GraphoidException.runtime("Unknown ruleset: :" + v.asSymbol());
            self.asGraph().addRuleset(v.asSymbol());
            return Value.none();
        });
        register(G, "has_ruleset", (itp, self, a) -> {
            expectArgs("has_ruleset", a, 1, 1);
            Value v = a.get(0);
            String name = (v.type == Value.Type.SYMBOL) ? v.asSymbol() : BuiltinMethods.str(a, 0, "has_ruleset");
            return Value.bool(self.asGraph().hasRuleset(name));
        });
        registerMutator(G, "add_method_constraint", (itp, self, a) -> {
            expectArgs("add_method_constraint", a, 2, 2);
            Value fn = a.get(0);
            if (!fn.isCallable()) throw GraphoidException.type("add_method_constraint() expects a function, got " + fn.typeName());
            String name = BuiltinMethods.str(a, 1, "add_method_constraint");
            self.asGraph().addRule(new RuleInstance(RuleSpec.customConstraint(fn, name)));
            return Value.none();
        });
    }

    private static String nodeId(Value v) {
        if (v.type == Value.Type.STRING) return v.asString();
        if (v.isNumeric() || v.type == Value.Type.SYMBOL) return key(v);
        throw GraphoidException.type("Node id must be a string, got " + v.typeName());
    }

    private static Value ids(List<String> ids) {
        List<Value> out = new ArrayList<>(ids.size());
        for (String id : ids) out.add(Value.string(id));
        return Value.list(out);
    }
}
