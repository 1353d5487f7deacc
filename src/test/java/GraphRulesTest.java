import com.graphoid.debug.Debug;
import com.graphoid.debug.DebugLevel;
import com.graphoid.script.Graphoid;
import com.graphoid.script.errors.ErrorKind;
import com.graphoid.script.errors.GraphoidException;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GraphRulesTest {

    private static Graphoid withNodes(String header, String... ids) {
        Graphoid g = new Graphoid();
        StringBuilder src = new StringBuilder("g = " + header + "\n");
        for (String id : ids) src.append("g.add_node(\"").append(id).append("\", none)\n");
        g.executeSource(src.toString());
        return g;
    }

    @Test
    void dagGraphRejectsCycles() {
        Graphoid g = withNodes("graph(:dag) {}", "a", "b");
        g.executeSource("g.add_edge(\"a\", \"b\")");

        assertTrue(g.executeSource("g.has_ruleset(:dag)").asBool());
        assertTrue(g.executeSource("g.has_rule(:no_cycles)").asBool());

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("g.add_edge(\"b\", \"a\")"));
        assertEquals(ErrorKind.RULE_VIOLATION, ex.getKind());
        assertEquals("no_cycles", ex.getRuleName());
        assertEquals(1.0, g.executeSource("g.edge_count()").asNumber(), 1e-9);
    }

    @Test
    void declaredRuleWithParameter() {
        Graphoid g = withNodes("graph { rule :max_degree, 1 }", "hub", "x", "y");
        g.executeSource("g.add_edge(\"hub\", \"x\")");

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("g.add_edge(\"hub\", \"y\")"));
        assertEquals("Graph rule violated: max_degree - Node 'hub' would exceed maximum degree of 1", ex.getMessage());
    }

    @Test
    void ruleAddedFromScript() {
        Graphoid g = withNodes("graph {}", "a", "b");
        g.executeSource("g.add_rule(:no_cycles)\ng.add_edge(\"a\", \"b\")");

        assertThrows(GraphoidException.class, () -> g.executeSource("g.add_edge(\"b\", \"a\")"));
        g.executeSource("g.remove_rule(:no_cycles)");
        assertFalse(g.executeSource("g.has_rule(:no_cycles)").asBool());
        g.executeSource("g.add_edge(\"b\", \"a\")");
        assertEquals(2.0, g.executeSource("g.edge_count()").asNumber(), 1e-9);
    }

    @Test
    void warningSeverityLogsAndRejects() {
        List<String> warnings = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.WARN) warnings.add(tag + ": " + message);
        });
        try {
            Graphoid g = withNodes("graph {}", "a", "b");
            g.executeSource(String.join("\n",
                "g.add_rule(:no_cycles, :warning)",
                "g.add_edge(\"a\", \"b\")",
                "g.add_edge(\"b\", \"a\")"
            ));

            assertEquals(1.0, g.executeSource("g.edge_count()").asNumber(), 1e-9);
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).startsWith("Rules: rule :no_cycles rejected operation"));
        } finally {
            Debug.get().setSink(null);
        }
    }

    @Test
    void unknownRuleAndRuleset() {
        Graphoid g = withNodes("graph {}");

        GraphoidException rule = assertThrows(GraphoidException.class, () -> g.executeSource("g.add_rule(:sparkly)"));
        assertEquals("Runtime error: Unknown rule: :sparkly", rule.getMessage());
        GraphoidException set = assertThrows(GraphoidException.class, () -> g.executeSource("g.with_ruleset(:forest)"));
        assertEquals("Runtime error: Unknown ruleset: :forest", set.getMessage());
    }

    @Test
    void transformationRuleOnGraphRewritesExistingNodes() {
        Graphoid g = withNodes("graph {}", "a");
        g.executeSource("g.add_rule(:none_to_zero)\ng.add_node(\"b\", none)");

        assertEquals(0.0, g.executeSource("g.get_node(\"a\")").asNumber(), 1e-9);
        assertEquals(0.0, g.executeSource("g.get_node(\"b\")").asNumber(), 1e-9);
    }

    @Test
    void listTransformationRules() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "xs = [1, none]",
            "xs.add_rule(:none_to_zero)",
            "xs.append!(none)"
        ));

        assertEquals("[1, 0, 0]", g.getVariable("xs").toString());
        assertTrue(g.executeSource("xs.has_rule(:none_to_zero)").asBool());
    }

    @Test
    void mapRoundsOnAssignment() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "m = {\"a\": 1.4}",
            "m.add_rule(:round_to_int)",
            "m[\"x\"] = 2.5"
        ));

        assertEquals(1.0, g.executeSource("m[\"a\"]").asNumber(), 1e-9);
        assertEquals(3.0, g.executeSource("m[\"x\"]").asNumber(), 1e-9);
    }

    @Test
    void customAndConditionalRules() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "scaled = []",
            "scaled.add_rule(x => x * 10)",
            "scaled.append!(2)",
            "clamped = []",
            "clamped.add_rule(x => x < 0, x => 0)",
            "clamped.append!(-5)",
            "clamped.append!(7)"
        ));

        assertEquals("[20]", g.getVariable("scaled").toString());
        assertEquals("[0, 7]", g.getVariable("clamped").toString());
    }

    @Test
    void noFrozenRejectsFrozenValues() {
        Graphoid g = new Graphoid();
        g.executeSource("items = []\nitems.add_rule(:no_frozen)");

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("items.append!([1].freeze())"));
        assertEquals(ErrorKind.RULE_VIOLATION, ex.getKind());
        assertEquals("no_frozen", ex.getRuleName());
        g.executeSource("items.append!([2])");
        assertEquals("[[2]]", g.getVariable("items").toString());
    }

    @Test
    void addingSameRuleTwiceIsIgnored() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "xs = []",
            "xs.add_rule(:uppercase)",
            "xs.add_rule(:uppercase)",
            "xs.append!(\"abc\")"
        ));

        assertEquals("[\"ABC\"]", g.getVariable("xs").toString());
    }

    @Test
    void treeLiteralCarriesTreeRules() {
        Graphoid g = withNodes("tree {}", "a", "b");
        g.executeSource("g.add_edge(\"a\", \"b\")");

        assertTrue(g.executeSource("g.has_ruleset(:tree)").asBool());
        assertTrue(g.executeSource("g.has_rule(:single_root)").asBool());
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("g.add_edge(\"b\", \"a\")"));
        assertEquals("no_cycles", ex.getRuleName());
        assertEquals(1.0, g.executeSource("g.edge_count()").asNumber(), 1e-9);
    }

    @Test
    void bstOrderingChecksTypedChildEdges() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "g = graph { rule :bst_ordering }",
            "g.add_node(\"root\", 10)",
            "g.add_node(\"low\", 5)",
            "g.add_node(\"high\", 20)",
            "g.add_edge(\"root\", \"low\", \"left\")"
        ));

        GraphoidException wrongSide = assertThrows(GraphoidException.class,
                () -> g.executeSource("g.add_edge(\"root\", \"high\", \"left\")"));
        assertEquals(ErrorKind.RULE_VIOLATION, wrongSide.getKind());
        assertEquals("bst_ordering", wrongSide.getRuleName());
        assertEquals("Graph rule violated: bst_ordering - BST ordering violated: left child 'high' (20) must be less than 'root' (10)",
                wrongSide.getMessage());

        GraphoidException untyped = assertThrows(GraphoidException.class,
                () -> g.executeSource("g.add_edge(\"root\", \"high\")"));
        assertTrue(untyped.getMessage().endsWith("BST edge root -> high must be typed 'left' or 'right'"));

        g.executeSource("g.add_edge(\"root\", \"high\", \"right\")");
        assertEquals(2.0, g.executeSource("g.edge_count()").asNumber(), 1e-9);
    }

    @Test
    void bstRulesetAddsOrderingToBinaryTree() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "g = graph(:bst) {}",
            "g.add_node(\"root\", 5)",
            "g.add_node(\"a\", 1)",
            "g.add_node(\"b\", 9)",
            "g.add_node(\"c\", 12)",
            "g.add_edge(\"root\", \"a\", \"left\")",
            "g.add_edge(\"root\", \"b\", \"right\")"
        ));

        assertTrue(g.executeSource("g.has_rule(:bst_ordering)").asBool());
        GraphoidException ex = assertThrows(GraphoidException.class,
                () -> g.executeSource("g.add_edge(\"b\", \"c\", \"left\")"));
        assertEquals("bst_ordering", ex.getRuleName());
    }
}
