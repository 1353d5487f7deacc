import com.graphoid.script.Graphoid;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.Value;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GraphObjectModelTest {

    private static final String ANIMALS = String.join("\n",
        "graph Animal {",
        "  name: \"generic\"",
        "  sound: \"...\"",
        "  fn speak() {",
        "    return self.name + \" says \" + self.sound",
        "  }",
        "  fn rename(n) {",
        "    self.name = n",
        "  }",
        "}",
        "graph Dog from Animal {",
        "  sound: \"woof\"",
        "  fn speak() {",
        "    return super.speak() + \"!\"",
        "  }",
        "}"
    );

    private static Graphoid animals() {
        Graphoid g = new Graphoid();
        g.executeSource(ANIMALS);
        return g;
    }

    @Test
    void instantiationOverridesProperties() {
        Graphoid g = animals();
        g.executeSource("a = Animal { name: \"Cat\" }");

        assertEquals("Cat says ...", g.executeSource("a.speak()").asString());
        assertEquals("generic", g.executeSource("Animal.name").asString());
    }

    @Test
    void instantiationRejectsUnknownProperty() {
        Graphoid g = animals();

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("Animal { colour: 1 }"));
        assertEquals("Runtime error: Unknown property 'colour' for type Animal", ex.getMessage());
    }

    @Test
    void inheritedPropertiesAndSuperCalls() {
        Graphoid g = animals();
        g.executeSource("d = Dog { name: \"Rex\" }");

        assertEquals("Rex says woof!", g.executeSource("d.speak()").asString());
        assertEquals("Dog", g.executeSource("d.type_of()").asString());
        assertTrue(g.executeSource("d.is_a(Animal)").asBool());
        assertTrue(g.executeSource("d.is_a(\"Dog\")").asBool());
        g.executeSource("a = Animal {}");
        assertFalse(g.executeSource("a.is_a(Dog)").asBool());
        assertEquals("[\"Animal\"]", g.executeSource("d.ancestors()").toString());
    }

    @Test
    void methodsMutateSelfAndWriteBack() {
        Graphoid g = animals();
        g.executeSource("d = Dog {}\nd.rename(\"Fido\")");

        assertEquals("Fido says woof!", g.executeSource("d.speak()").asString());
    }

    @Test
    void methodCallOnCopyLeavesOriginalAlone() {
        Graphoid g = animals();
        g.executeSource("a = Animal {}\nb = a\nb.rename(\"Other\")");

        assertEquals("generic", g.executeSource("a.name").asString());
        assertEquals("Other", g.executeSource("b.name").asString());
    }

    @Test
    void superOutsideMethodFails() {
        Graphoid g = animals();

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("super.speak()"));
        assertEquals("Runtime error: 'super' used outside of a method", ex.getMessage());
    }

    @Test
    void superWithoutParentMethodFails() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Base {",
            "  fn hello() { return super.hello() }",
            "}",
            "b = Base {}"
        ));

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("b.hello()"));
        assertEquals("Runtime error: No parent method 'hello' found for super call in 'hello'", ex.getMessage());
    }

    @Test
    void unknownPropertyMessageUsesTypeName() {
        Graphoid g = animals();

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("Dog.wings"));
        assertEquals("Runtime error: Type 'Dog' has no property 'wings'", ex.getMessage());
    }

    @Test
    void staticMethodsCallWithoutInstance() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph MathUtil {",
            "  static fn square(x) { return x * x }",
            "}"
        ));

        assertEquals(16.0, g.executeSource("MathUtil.square(4)").asNumber(), 1e-9);
    }

    @Test
    void privateMethodsOnlyFromInside() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Safe {",
            "  secret: 42",
            "  priv fn reveal() { return self.secret }",
            "  fn _hint() { return \"starts with 4\" }",
            "  fn peek() { return reveal() }",
            "  fn hint() { return self._hint() }",
            "}",
            "s = Safe {}"
        ));

        assertEquals(42.0, g.executeSource("s.peek()").asNumber(), 1e-9);
        assertEquals("starts with 4", g.executeSource("s.hint()").asString());
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("s.reveal()"));
        assertEquals("Runtime error: Cannot call private method 'reveal' from outside the graph's methods", ex.getMessage());
        assertThrows(GraphoidException.class, () -> g.executeSource("s._hint()"));
    }

    @Test
    void propertySetterRunsOnAssignment() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Temperature {",
            "  celsius: 0",
            "  set celsius(v) {",
            "    self.celsius = v if v > -273 else -273",
            "  }",
            "}",
            "t = Temperature {}",
            "t.celsius = -500"
        ));

        assertEquals(-273.0, g.executeSource("t.celsius").asNumber(), 1e-9);
        g.executeSource("t.celsius = 21");
        assertEquals(21.0, g.executeSource("t.celsius").asNumber(), 1e-9);
    }

    @Test
    void readableAndWritableSynthesizeAccessors() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Account {",
            "  balance: 10",
            "  owner: \"nobody\"",
            "  configure { readable: :balance, writable: :owner }",
            "}",
            "acct = Account {}",
            "acct.set_owner(\"Ann\")"
        ));

        assertEquals(10.0, g.executeSource("acct.balance()").asNumber(), 1e-9);
        assertEquals("Ann", g.executeSource("acct.owner").asString());
        assertTrue(g.executeSource("acct.responds_to(\"set_owner\")").asBool());
        assertFalse(g.executeSource("acct.responds_to(\"set_balance\")").asBool());
    }

    @Test
    void zeroArgumentMethodReadsAsProperty() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Circle {",
            "  r: 2",
            "  fn area() { return 3 * self.r * self.r }",
            "}",
            "c = Circle {}"
        ));

        assertEquals(12.0, g.executeSource("c.area").asNumber(), 1e-9);
    }

    @Test
    void methodsAttachedToExistingGraph() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "g = graph {}",
            "fn g.grow(id) { self.add_node(id, 1) }",
            "g.grow(\"a\")",
            "g.grow(\"b\")"
        ));

        assertEquals(2.0, g.executeSource("g.node_count()").asNumber(), 1e-9);
        assertEquals("[\"grow\"]", g.executeSource("g.method_names()").toString());
        g.executeSource("g.remove_method(\"grow\")");
        assertFalse(g.executeSource("g.responds_to(\"grow\")").asBool());
    }

    @Test
    void includeCopiesPublicMethods() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "Greeter = graph {",
            "  fn hello() { return \"hi \" + self.who }",
            "  priv fn secret() { return 1 }",
            "}",
            "graph Person {",
            "  who: \"Ann\"",
            "}",
            "p = Person {}",
            "added = p.include(Greeter)"
        ));

        assertEquals("[\"hello\"]", g.getVariable("added").toString());
        assertEquals("hi Ann", g.executeSource("p.hello()").asString());
        assertFalse(g.executeSource("p.responds_to(\"secret\")").asBool());
    }

    @Test
    void readOnlyConstraintRejectsStructuralChange() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Ledger {",
            "  total: 0",
            "  rule :read_only",
            "  fn peek() { return self.total }",
            "  fn scribble() { self.add_node(\"x\", 1) }",
            "}",
            "l = Ledger {}"
        ));

        assertEquals(0.0, g.executeSource("l.peek()").asNumber(), 1e-9);
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("l.scribble()"));
        assertEquals("Runtime error: Method 'scribble' violates :read_only constraint: graph was modified", ex.getMessage());
        assertEquals(0.0, g.executeSource("l.node_count()").asNumber(), 1e-9);
    }

    @Test
    void noNodeRemovalsConstraint() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "g = graph { rule :no_node_removals }",
            "g.add_node(\"keep\", 1)",
            "fn g.drop(id) { self.remove_node(id) }",
            "fn g.add(id) { self.add_node(id, 2) }"
        ));

        g.executeSource("g.add(\"more\")");
        assertEquals(2.0, g.executeSource("g.node_count()").asNumber(), 1e-9);
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("g.drop(\"keep\")"));
        assertTrue(ex.getMessage().startsWith("Runtime error: Method 'drop' violates :no_node_removals constraint"));
        assertTrue(g.executeSource("g.has_node(\"keep\")").asBool());
    }

    @Test
    void noEdgeRemovalsConstraint() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "g = graph { rule :no_edge_removals }",
            "g.add_node(\"a\", 1)",
            "g.add_node(\"b\", 2)",
            "g.add_edge(\"a\", \"b\")",
            "fn g.cut() { self.remove_edge(\"a\", \"b\") }",
            "fn g.extend() {",
            "  self.add_node(\"c\", 3)",
            "  self.add_edge(\"b\", \"c\")",
            "}"
        ));

        g.executeSource("g.extend()");
        assertEquals(2.0, g.executeSource("g.edge_count()").asNumber(), 1e-9);
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("g.cut()"));
        assertEquals("Runtime error: Method 'cut' violates :no_edge_removals constraint: edges removed", ex.getMessage());
        assertTrue(g.executeSource("g.has_edge(\"a\", \"b\")").asBool());
    }

    @Test
    void superChainsThroughSeveralLevels() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph A {",
            "  fn tag() { return \"A\" }",
            "}",
            "graph B from A {",
            "  fn tag() { return super.tag() + \"B\" }",
            "}",
            "graph C from B {",
            "  fn tag() { return super.tag() + \"C\" }",
            "}",
            "graph D from C {}",
            "b = B {}",
            "c = C {}",
            "d = D {}"
        ));

        assertEquals("ABC", g.executeSource("c.tag()").asString());
        assertEquals("ABC", g.executeSource("d.tag()").asString());
        assertEquals("AB", g.executeSource("b.tag()").asString());
    }

    @Test
    void staticMethodsResolveNamesInCallerScope() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Report {",
            "  static fn render() { return header() + \":\" + Report.footer() }",
            "  static fn footer() { return \"end\" }",
            "}",
            "fn outer() {",
            "  fn header() { return \"local\" }",
            "  return Report.render()",
            "}",
            "fn header() { return \"global\" }"
        ));

        assertEquals("local:end", g.executeSource("outer()").asString());
        assertEquals("global:end", g.executeSource("Report.render()").asString());
    }

    @Test
    void customMethodConstraint() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "g = graph {}",
            "fn g.grow(id) { self.add_node(id, 1) }",
            "g.add_method_constraint((before, after) => after.node_count() <= 1, \"max_one\")",
            "g.grow(\"a\")"
        ));

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("g.grow(\"b\")"));
        assertEquals("Runtime error: Method 'grow' violates custom constraint 'max_one': constraint returned false",
                ex.getMessage());
        assertEquals(1.0, g.executeSource("g.node_count()").asNumber(), 1e-9);
    }

    @Test
    void guardedMethodVariants() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "graph Light {",
            "  on: false",
            "  fn status() when self.on { return \"lit\" }",
            "  fn status() { return \"dark\" }",
            "  fn flip() { self.on = not self.on }",
            "}",
            "l = Light {}"
        ));

        assertEquals("dark", g.executeSource("l.status()").asString());
        g.executeSource("l.flip()");
        assertEquals("lit", g.executeSource("l.status()").asString());
    }

    @Test
    void graphValuesDisplayAsSummary() {
        Value v = new Graphoid().executeSource(String.join("\n",
            "g = graph {}",
            "g.add_node(\"a\", 1)",
            "g.add_node(\"b\", 2)",
            "g.add_edge(\"a\", \"b\")",
            "g.to_string()"
        ));
        assertEquals("<graph: 2 nodes, 1 edges>", v.asString());
    }
}
