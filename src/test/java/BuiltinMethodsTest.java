import com.graphoid.script.Graphoid;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.Value;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinMethodsTest {

    private static Value eval(String... lines) {
        return new Graphoid().executeSource(String.join("\n", lines));
    }

    @Test
    void stringMethods() {
        assertEquals("HELLO", eval("\"hello\".upper()").asString());
        assertEquals("hi", eval("\"  hi  \".trim()").asString());
        assertEquals(5.0, eval("\"hello\".length()").asNumber(), 1e-9);
        assertTrue(eval("\"graphoid\".starts_with(\"graph\")").asBool());
        assertTrue(eval("\"graphoid\".contains(\"pho\")").asBool());
        assertEquals("[\"a\", \"b\", \"\", \"c\"]", eval("\"a,b,,c\".split(\",\")").toString());
        assertEquals("[\"one\", \"two\"]", eval("\"  one   two \".split()").toString());
        assertEquals("b-b", eval("\"a-a\".replace(\"a\", \"b\")").asString());
        assertEquals("cba", eval("\"abc\".reverse()").asString());
        assertEquals("ell", eval("\"hello\".slice(1, 4)").asString());
        assertEquals("lo", eval("\"hello\".slice(-2)").asString());
        assertEquals(2.0, eval("\"hello\".index_of(\"l\")").asNumber(), 1e-9);
    }

    @Test
    void numberMethods() {
        assertEquals(3.0, eval("n = 3.7", "n.floor()").asNumber(), 1e-9);
        assertEquals(4.0, eval("n = 3.2", "n.ceil()").asNumber(), 1e-9);
        assertEquals(3.0, eval("n = 2.5", "n.round()").asNumber(), 1e-9);
        assertEquals(-3.0, eval("n = -2.5", "n.round()").asNumber(), 1e-9);
        assertEquals(3.14, eval("n = 3.14159", "n.round(2)").asNumber(), 1e-9);
        assertEquals(2.0, eval("n = -2", "n.abs()").asNumber(), 1e-9);
        assertEquals(3.0, eval("n = 9", "n.sqrt()").asNumber(), 1e-9);
        assertTrue(eval("n = 4", "n.is_integer()").asBool());
        assertFalse(eval("n = 4.5", "n.is_integer()").asBool());
    }

    @Test
    void commonMethods() {
        assertEquals("list", eval("[1].type()").asString());
        assertEquals("num", eval("n = 5", "n.type()").asString());
        assertEquals(42.0, eval("\"42\".to_num()").asNumber(), 1e-9);
        assertEquals(1.0, eval("true.to_num()").asNumber(), 1e-9);
        assertEquals("[1, 2]", eval("[1, 2].to_string()").asString());
        assertTrue(eval("n = 5", "n.to_bignum().is_bignum()").asBool());

        GraphoidException ex = assertThrows(GraphoidException.class, () -> eval("\"abc\".to_num()"));
        assertEquals("Cannot convert 'abc' to num", ex.getDetail());
    }

    @Test
    void listQueries() {
        assertEquals(1.0, eval("[1, 2, 3].first()").asNumber(), 1e-9);
        assertEquals(3.0, eval("[1, 2, 3].last()").asNumber(), 1e-9);
        assertTrue(eval("[1, 2, 3].contains(2)").asBool());
        assertEquals(-1.0, eval("[1, 2, 3].index_of(9)").asNumber(), 1e-9);
        assertTrue(eval("[].is_empty()").asBool());
        assertEquals("1-2-3", eval("[1, 2, 3].join(\"-\")").asString());
        assertEquals("[1, 2, 3]", eval("[1, 2, 1, 3, 2].uniq()").toString());
        assertEquals("[1, 2]", eval("[1, none, 2, none].compact()").toString());
        assertEquals("[2, 3]", eval("[1, 2, 3, 4].slice(1, 3)").toString());
        assertEquals("[1, 3]", eval("[1, 2, 3, 4].slice(0, 4, 2)").toString());
        assertEquals("[3, 2, 1]", eval("[1, 2, 3].reverse()").toString());
        assertEquals("[-2, 4]", eval("[-2, 3, 4].reject(:odd)").toString());
        assertEquals(6.0, eval("[1, 2, 3].sum()").asNumber(), 1e-9);
        assertEquals(3.0, eval("[2, 3, 1].max()").asNumber(), 1e-9);

        GraphoidException ex = assertThrows(GraphoidException.class, () -> eval("[].first()"));
        assertEquals("Runtime error: Cannot get first element of empty list", ex.getMessage());
    }

    @Test
    void listMethodsReturnNewListsUnlessBang() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "xs = [1, 2]",
            "ys = xs.append(3)",
            "xs.prepend!(0)",
            "xs.insert!(1, 9)",
            "xs.remove!(2)"
        ));

        assertEquals("[1, 2, 3]", g.getVariable("ys").toString());
        assertEquals("[0, 9, 1]", g.getVariable("xs").toString());

        g.executeSource("xs.remove_at_index!(0)\nxs.clear!()");
        assertEquals("[]", g.getVariable("xs").toString());
    }

    @Test
    void eachVisitsInOrder() {
        Graphoid g = new Graphoid();
        g.enableOutputCapture();
        g.executeSource("[1, 2].each(x => print(x))");

        assertEquals("1\n2\n", g.disableOutputCapture());
    }

    @Test
    void mapMethods() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "m = {\"a\": 1, \"b\": 2}",
            "keys = m.keys()",
            "vals = m.values()",
            "dflt = m.get(\"z\", 5)",
            "missing = m.get(\"z\")",
            "merged = m.merge({\"c\": 3})",
            "m.set!(\"d\", 4)",
            "m.remove!(\"a\")"
        ));

        assertEquals("[\"a\", \"b\"]", g.getVariable("keys").toString());
        assertEquals("[1, 2]", g.getVariable("vals").toString());
        assertEquals(5.0, g.getVariable("dflt").asNumber(), 1e-9);
        assertTrue(g.getVariable("missing").isNone());
        assertEquals("{\"a\": 1, \"b\": 2, \"c\": 3}", g.getVariable("merged").toString());
        assertEquals("{\"b\": 2, \"d\": 4}", g.getVariable("m").toString());
        assertTrue(g.executeSource("m.has_key(\"d\")").asBool());
        assertEquals(2.0, g.executeSource("m.size()").asNumber(), 1e-9);
    }

    @Test
    void functionMethods() {
        Graphoid g = new Graphoid();
        g.executeSource("fn add(a, b) { return a + b }");

        assertEquals("add", g.executeSource("add.name()").asString());
        assertEquals(2.0, g.executeSource("add.arity()").asNumber(), 1e-9);
        assertEquals(5.0, g.executeSource("add.call(2, 3)").asNumber(), 1e-9);
        assertEquals("print", g.executeSource("print.name()").asString());
    }

    @Test
    void frozenValuesRejectMutation() {
        Graphoid g = new Graphoid();
        g.executeSource("f = [1, [2]].freeze()");

        assertTrue(g.executeSource("f.is_frozen()").asBool());
        assertTrue(g.executeSource("f[1].is_frozen()").asBool());
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("f.append!(3)"));
        assertEquals("Runtime error: Cannot modify frozen list", ex.getMessage());
        assertFalse(g.executeSource("[1].is_frozen()").asBool());
    }

    @Test
    void shallowFreezeRule() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "xs = [[1]]",
            "xs.add_rule(:shallow_freeze_only)",
            "f = xs.freeze()"
        ));

        assertTrue(g.executeSource("f.is_frozen()").asBool());
        assertFalse(g.executeSource("f[0].is_frozen()").asBool());
    }

    @Test
    void builtinLenAndRange() {
        assertEquals(3.0, eval("len(\"abc\")").asNumber(), 1e-9);
        assertEquals(2.0, eval("len({\"a\": 1, \"b\": 2})").asNumber(), 1e-9);
        assertEquals("[0, 1, 2]", eval("range(3)").toString());
    }
}
