import com.graphoid.script.errors.ErrorKind;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.graph.EdgeInfo;
import com.graphoid.script.graph.Graph;
import com.graphoid.script.graph.GraphType;
import com.graphoid.script.rules.RuleInstance;
import com.graphoid.script.rules.RuleSeverity;
import com.graphoid.script.rules.RuleSpec;
import com.graphoid.script.runtime.Value;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GraphTest {

    private static Graph chain(String... ids) {
        Graph g = new Graph();
        for (String id : ids) g.addNode(id, Value.string(id.toUpperCase()));
        for (int i = 0; i + 1 < ids.length; i++) g.addEdge(ids[i], ids[i + 1], null, null);
        return g;
    }

    @Test
    void nodesAndEdges() {
        Graph g = chain("a", "b", "c");

        assertEquals(3, g.nodeCount());
        assertEquals(2, g.edgeCount());
        assertEquals(List.of("b"), g.neighbors("a"));
        assertEquals(List.of("a"), g.predecessors("b"));
        assertEquals("B", g.nodeValue("b").asString());
        assertTrue(g.hasEdge("b", "c"));
        assertFalse(g.hasEdge("c", "b"));
    }

    @Test
    void addNodeReplacesExistingValue() {
        Graph g = new Graph();
        g.addNode("x", Value.number(1));
        g.addNode("x", Value.number(2));

        assertEquals(1, g.nodeCount());
        assertEquals(2.0, g.nodeValue("x").asNumber(), 1e-9);
    }

    @Test
    void edgeToMissingNodeFails() {
        Graph g = new Graph();
        g.addNode("a", Value.none());

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.addEdge("a", "zzz", null, null));
        assertEquals("Runtime error: Node 'zzz' does not exist", ex.getMessage());
    }

    @Test
    void removeNodeDropsIncidentEdges() {
        Graph g = chain("a", "b", "c");

        assertTrue(g.removeNode("b"));
        assertFalse(g.removeNode("b"));
        assertEquals(0, g.edgeCount());
        assertTrue(g.neighbors("a").isEmpty());
        assertTrue(g.predecessors("c").isEmpty());
    }

    @Test
    void undirectedEdgesGoBothWaysButCountOnce() {
        Graph g = new Graph(GraphType.UNDIRECTED);
        g.addNode("a", Value.none());
        g.addNode("b", Value.none());
        g.addEdge("a", "b", "road", 4.0);

        assertTrue(g.hasEdge("b", "a"));
        assertEquals(1, g.edgeCount());
        List<EdgeInfo> edges = g.edges();
        assertEquals(1, edges.size());
        assertEquals("road", edges.get(0).edgeType);
        assertEquals(4.0, edges.get(0).weight, 1e-9);
    }

    @Test
    void traversals() {
        Graph g = chain("a", "b", "d");
        g.addNode("c", Value.none());
        g.addEdge("a", "c", null, null);

        assertEquals(List.of("a", "b", "c", "d"), g.bfs("a"));
        assertEquals(List.of("a", "b", "d", "c"), g.dfs("a"));
        assertEquals(List.of("a", "b", "d"), g.shortestPath("a", "d"));
        assertTrue(g.shortestPath("d", "a").isEmpty());
        assertTrue(g.hasPath("a", "d"));
        assertFalse(g.hasPath("d", "a"));
    }

    @Test
    void topologicalSortOrdersDependencies() {
        Graph g = new Graph();
        for (String id : new String[] {"shirt", "tie", "jacket", "belt"}) g.addNode(id, Value.none());
        g.addEdge("shirt", "tie", null, null);
        g.addEdge("tie", "jacket", null, null);
        g.addEdge("belt", "jacket", null, null);

        List<String> order = g.topologicalSort();
        assertTrue(order.indexOf("shirt") < order.indexOf("tie"));
        assertTrue(order.indexOf("tie") < order.indexOf("jacket"));
        assertTrue(order.indexOf("belt") < order.indexOf("jacket"));
    }

    @Test
    void topologicalSortRejectsCycles() {
        Graph g = chain("a", "b");
        g.addEdge("b", "a", null, null);

        GraphoidException ex = assertThrows(GraphoidException.class, g::topologicalSort);
        assertEquals("Runtime error: Graph contains a cycle", ex.getMessage());
    }

    @Test
    void propertiesAreNotDataNodes() {
        Graph g = new Graph();
        g.setProperty("name", Value.string("config"));
        g.addNode("n", Value.number(1));

        assertEquals(1, g.nodeCount());
        assertTrue(g.hasProperty("name"));
        assertEquals("config", g.getProperty("name").asString());
        assertEquals(List.of("name"), g.propertyNames());
        assertEquals(List.of("n"), g.dataNodeIds());
    }

    @Test
    void copyIsIndependent() {
        Graph g = chain("a", "b");
        Graph copy = g.copy();
        copy.addNode("c", Value.none());
        copy.removeEdge("a", "b");

        assertEquals(2, g.nodeCount());
        assertTrue(g.hasEdge("a", "b"));
        assertTrue(copy.structurallyEquals(copy.copy()));
        assertFalse(g.structurallyEquals(copy));
    }

    @Test
    void fromParentInheritsAndRecordsAncestry() {
        Graph animal = new Graph();
        animal.setTypeName("Animal");
        animal.setProperty("legs", Value.number(4));

        Graph dog = Graph.fromParent(animal);
        dog.setTypeName("Dog");

        assertEquals(4.0, dog.getProperty("legs").asNumber(), 1e-9);
        assertEquals(List.of("Animal"), dog.ancestors());
        assertTrue(dog.isA("Dog"));
        assertTrue(dog.isA("Animal"));
        assertFalse(animal.isA("Dog"));
        assertEquals(0, dog.nodeCount());
    }

    @Test
    void noCyclesRuleRejectsBackEdge() {
        Graph g = chain("a", "b", "c");
        g.addRule(new RuleInstance(RuleSpec.of(RuleSpec.Kind.NO_CYCLES)));

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.addEdge("c", "a", null, null));
        assertEquals(ErrorKind.RULE_VIOLATION, ex.getKind());
        assertEquals("no_cycles", ex.getRuleName());
        assertEquals("Graph rule violated: no_cycles - Adding edge c -> a would create a cycle", ex.getMessage());
        assertFalse(g.hasEdge("c", "a"));
    }

    @Test
    void silentRuleRejectsWithoutThrowing() {
        Graph g = chain("a", "b");
        g.addRule(new RuleInstance(RuleSpec.of(RuleSpec.Kind.NO_CYCLES), RuleSeverity.SILENT));

        assertFalse(g.addEdge("b", "a", null, null));
        assertEquals(1, g.edgeCount());
    }

    @Test
    void addingRuleToViolatingGraphFails() {
        Graph g = chain("a", "b");
        g.addEdge("b", "a", null, null);

        GraphoidException ex = assertThrows(GraphoidException.class,
                () -> g.addRule(new RuleInstance(RuleSpec.of(RuleSpec.Kind.NO_CYCLES))));
        assertEquals("Graph already contains a cycle", ex.getDetail());
        assertFalse(g.hasRule("no_cycles"));
    }

    @Test
    void removalViolatingConnectivityRollsBack() {
        Graph g = chain("a", "b", "c");
        g.addRule(new RuleInstance(RuleSpec.of(RuleSpec.Kind.CONNECTED)));

        assertThrows(GraphoidException.class, () -> g.removeEdge("a", "b"));
        assertTrue(g.hasEdge("a", "b"));
        assertEquals(2, g.edgeCount());
    }

    @Test
    void maxDegreeLimitsOutgoingEdges() {
        Graph g = new Graph();
        for (String id : new String[] {"hub", "x", "y"}) g.addNode(id, Value.none());
        g.addRule(new RuleInstance(RuleSpec.maxDegree(1)));
        g.addEdge("hub", "x", null, null);

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.addEdge("hub", "y", null, null));
        assertEquals("Node 'hub' would exceed maximum degree of 1", ex.getDetail());
    }

    @Test
    void dagRulesetAddsNoCycles() {
        Graph g = new Graph();
        g.addRuleset("dag");

        assertTrue(g.hasRuleset("dag"));
        assertTrue(g.hasRule("no_cycles"));
    }

    @Test
    void frozenGraphRejectsMutation() {
        Graph g = chain("a");
        g.freeze(true);

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.addNode("b", Value.none()));
        assertEquals("Runtime error: Cannot modify frozen graph", ex.getMessage());
    }
}
