import com.graphoid.script.Graphoid;
import com.graphoid.script.errors.ErrorKind;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.Value;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GraphoidLanguageTest {

    private static Value run(String... lines) {
        return new Graphoid().executeSource(String.join("\n", lines));
    }

    @Test
    void arithmeticAndPrecedence() {
        assertEquals(14.0, run("2 + 3 * 4").asNumber(), 1e-9);
        assertEquals(20.0, run("(2 + 3) * 4").asNumber(), 1e-9);
        assertEquals(-8.0, run("-2 ** 3").asNumber(), 1e-9);
        assertEquals(3.0, run("7 // 2").asNumber(), 1e-9);
        assertEquals(1.0, run("7 % 2").asNumber(), 1e-9);
        assertEquals(512.0, run("2 ** 3 ** 2").asNumber(), 1e-9);
    }

    @Test
    void stringConcatenationUsesDisplayForm() {
        assertEquals("n = 3", run("\"n = \" + 3").asString());
        assertEquals("flag: true", run("\"flag: \" + true").asString());
    }

    @Test
    void logicalOperatorsShortCircuit() {
        Value v = run(
            "calls = 0",
            "fn touch() {",
            "  calls = calls + 1",
            "  return true",
            "}",
            "a = false and touch()",
            "b = true or touch()",
            "c = not false && touch()",
            "calls"
        );
        assertEquals(1.0, v.asNumber(), 1e-9);
    }

    @Test
    void suffixConditionals() {
        assertEquals("big", run("x = 10", "\"big\" if x > 5 else \"small\"").asString());
        assertTrue(run("x = 1", "\"big\" if x > 5").isNone());
        assertEquals("ok", run("x = 0", "\"ok\" unless x > 5").asString());
    }

    @Test
    void ifElseChain() {
        Value v = run(
            "fn grade(score) {",
            "  if score >= 90 {",
            "    return \"A\"",
            "  } else if score >= 80 {",
            "    return \"B\"",
            "  }",
            "  else {",
            "    return \"C\"",
            "  }",
            "}",
            "grade(95) + grade(85) + grade(10)"
        );
        assertEquals("ABC", v.asString());
    }

    @Test
    void whileWithBreakAndContinue() {
        Value v = run(
            "i = 0",
            "total = 0",
            "while true {",
            "  i = i + 1",
            "  if i > 10 { break }",
            "  if i % 2 == 0 { continue }",
            "  total = total + i",
            "}",
            "total"
        );
        assertEquals(25.0, v.asNumber(), 1e-9);
    }

    @Test
    void forIteratesListsMapKeysAndCharacters() {
        Value v = run(
            "out = []",
            "for x in [1, 2] { out.append!(x) }",
            "for k in {\"a\": 1, \"b\": 2} { out.append!(k) }",
            "for c in \"hi\" { out.append!(c) }",
            "out"
        );
        assertEquals("[1, 2, \"a\", \"b\", \"h\", \"i\"]", v.toString());
    }

    @Test
    void rangeProducesNumbers() {
        assertEquals("[0, 1, 2]", run("range(3)").toString());
        assertEquals("[2, 4, 6]", run("range(2, 8, 2)").toString());
    }

    @Test
    void patternFunctionRecursion() {
        Value v = run(
            "fn fact {",
            "  |0| => 1",
            "  |n| => n * fact(n - 1)",
            "}",
            "fact(5)"
        );
        assertEquals(120.0, v.asNumber(), 1e-9);
    }

    @Test
    void patternFunctionGuardsAndFallthrough() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "fn sign {",
            "  |n| if n < 0 => \"negative\",",
            "  |0| => \"zero\",",
            "  |_| => \"positive\"",
            "}",
            "fn only_one { |1| => \"one\" }"
        ));

        assertEquals("negative", g.executeSource("sign(-4)").asString());
        assertEquals("zero", g.executeSource("sign(0)").asString());
        assertEquals("positive", g.executeSource("sign(3)").asString());
        assertTrue(g.executeSource("only_one(2)").isNone());
    }

    @Test
    void clauseGuardBindingsStayInsideTheCall() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "n = 100",
            "fn bucket {",
            "  |n| if n < 0 => \"below\",",
            "  |m| if m > 10 => \"above\",",
            "  |_| => \"inside\"",
            "}",
            "r1 = bucket(-3)",
            "r2 = bucket(50)",
            "r3 = bucket(5)"
        ));

        assertEquals("below", g.getVariable("r1").asString());
        assertEquals("above", g.getVariable("r2").asString());
        assertEquals("inside", g.getVariable("r3").asString());
        assertEquals(100.0, g.getVariable("n").asNumber(), 1e-9);
        assertNull(g.getVariable("m"));
    }

    @Test
    void negativeZeroComparesEqualToZero() {
        Value v = run(
            "z = 0 * -1",
            "[z < 0, z == 0, z > -1, z <= 0, 0 > z]"
        );
        assertEquals("[false, true, true, true, false]", v.toString());
        assertEquals("[-1, 0, 1]", run("[1, -1, 0 * -1].sort()").toString());
    }

    @Test
    void patternLiteralsToleratePrecisionNoise() {
        Graphoid g = new Graphoid();
        g.executeSource("fn is_third { |0.3| => true, |_| => false }");

        assertTrue(g.executeSource("is_third(0.1 + 0.2)").asBool());
        assertFalse(g.executeSource("is_third(0.31)").asBool());
    }

    @Test
    void patternFunctionRequiresExactlyOneArgument() {
        Graphoid g = new Graphoid();
        g.executeSource("fn f { |x| => x }");

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("f(1, 2)"));
        assertEquals("Runtime error: Pattern function 'f' expects exactly 1 argument, got 2", ex.getMessage());
    }

    @Test
    void defaultNamedAndVariadicParameters() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "fn greet(name, greeting = \"Hello\") {",
            "  return greeting + \", \" + name",
            "}",
            "fn total(first, ...rest) {",
            "  return first + rest.sum()",
            "}"
        ));

        assertEquals("Hello, Bob", g.executeSource("greet(\"Bob\")").asString());
        assertEquals("Hi, Bob", g.executeSource("greet(\"Bob\", greeting: \"Hi\")").asString());
        assertEquals("Yo, Ann", g.executeSource("greet(greeting: \"Yo\", name: \"Ann\")").asString());
        assertEquals(6.0, g.executeSource("total(1, 2, 3)").asNumber(), 1e-9);
        assertEquals(1.0, g.executeSource("total(1)").asNumber(), 1e-9);
    }

    @Test
    void argumentBindingErrors() {
        Graphoid g = new Graphoid();
        g.executeSource("fn pair(a, b) { return [a, b] }");

        assertEquals("Runtime error: Missing required parameter 'b' in function 'pair'",
                assertThrows(GraphoidException.class, () -> g.executeSource("pair(1)")).getMessage());
        assertEquals("Runtime error: Too many arguments for function 'pair'",
                assertThrows(GraphoidException.class, () -> g.executeSource("pair(1, 2, 3)")).getMessage());
        assertEquals("Runtime error: Unknown parameter 'c' in function 'pair'",
                assertThrows(GraphoidException.class, () -> g.executeSource("pair(1, c: 2)")).getMessage());
        assertEquals("Runtime error: Parameter 'a' specified multiple times",
                assertThrows(GraphoidException.class, () -> g.executeSource("pair(1, 2, a: 3)")).getMessage());
        assertEquals("[3, 1]", g.executeSource("pair(1, a: 3)").toString());
    }

    @Test
    void argumentsAreCopiesUnlessWrittenBack() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "fn push_one(items) {",
            "  items.append!(1)",
            "}",
            "a = []",
            "b = []",
            "push_one(a)",
            "push_one(b!)"
        ));

        assertEquals("[]", g.getVariable("a").toString());
        assertEquals("[1]", g.getVariable("b").toString());
    }

    @Test
    void collectionsHaveValueSemantics() {
        Value v = run(
            "a = [1, 2]",
            "b = a",
            "b.append!(3)",
            "[a.size(), b.size()]"
        );
        assertEquals("[2, 3]", v.toString());
    }

    @Test
    void functionsCloseOverGlobals() {
        Value v = run(
            "counter = 0",
            "fn bump() { counter = counter + 1 }",
            "bump()",
            "bump()",
            "counter"
        );
        assertEquals(2.0, v.asNumber(), 1e-9);
    }

    @Test
    void guardedOverloads() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "fn describe(n) when n < 0 { return \"negative\" }",
            "fn describe(n) { return \"non-negative\" }",
            "fn describe(a, b) { return \"pair\" }"
        ));

        assertEquals("negative", g.executeSource("describe(-1)").asString());
        assertEquals("non-negative", g.executeSource("describe(5)").asString());
        assertEquals("pair", g.executeSource("describe(1, 2)").asString());
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("describe(1, 2, 3)"));
        assertEquals("Runtime error: No matching overload for 'describe' with 3 argument(s)", ex.getMessage());
    }

    @Test
    void lambdasAndHigherOrderListMethods() {
        assertEquals("[2, 4, 6]", run("[1, 2, 3].map(x => x * 2)").toString());
        assertEquals("[2, 4]", run("[1, 2, 3, 4].filter(:even)").toString());
        assertEquals("[1, 9]", run("[1, 3].map(:square)").toString());
        assertEquals(10.0, run("[1, 2, 3, 4].reduce(0, (acc, x) => acc + x)").asNumber(), 1e-9);
        assertEquals("[3, 2, 1]", run("[2, 3, 1].sort((a, b) => b - a)").toString());
        assertEquals(7.0, run("add = fn (a, b) { return a + b }", "add(3, 4)").asNumber(), 1e-9);
    }

    @Test
    void matchExpression() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "fn describe(v) {",
            "  return match v {",
            "    0 => \"zero\"",
            "    :ok => \"ok\"",
            "    [x] => \"one item\"",
            "    [x, ...rest] => \"many: \" + rest.size()",
            "    s if s == \"hi\" => \"greeting\"",
            "    _ => \"other\"",
            "  }",
            "}"
        ));

        assertEquals("zero", g.executeSource("describe(0)").asString());
        assertEquals("ok", g.executeSource("describe(:ok)").asString());
        assertEquals("one item", g.executeSource("describe([5])").asString());
        assertEquals("many: 2", g.executeSource("describe([1, 2, 3])").asString());
        assertEquals("greeting", g.executeSource("describe(\"hi\")").asString());
        assertEquals("other", g.executeSource("describe([])").asString());
    }

    @Test
    void matchWithoutMatchingArmYieldsNone() {
        assertTrue(run("match 5 {", "  1 => \"one\"", "}").isNone());
    }

    @Test
    void matchArmBlockReturnsValue() {
        Value v = run(
            "r = match [1, 2] {",
            "  [a, b] => {",
            "    s = a + b",
            "    return s * 10",
            "  }",
            "}",
            "r"
        );
        assertEquals(30.0, v.asNumber(), 1e-9);
    }

    @Test
    void typedDeclarations() {
        Graphoid g = new Graphoid();
        g.executeSource("num n = 3\nstring s = \"x\"\nlist l = [1]");

        assertEquals(3.0, g.getVariable("n").asNumber(), 1e-9);
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("num bad = \"text\""));
        assertEquals(ErrorKind.TYPE, ex.getKind());
        assertEquals("Cannot assign string to 'bad' declared as num", ex.getDetail());
    }

    @Test
    void indexAssignmentWritesThroughNestedContainers() {
        Value v = run(
            "data = {\"rows\": [[1, 2], [3, 4]]}",
            "data[\"rows\"][1][0] = 30",
            "data.rows[1]"
        );
        assertEquals("[30, 4]", v.toString());
    }

    @Test
    void negativeIndexesCountFromEnd() {
        assertEquals(3.0, run("[1, 2, 3][-1]").asNumber(), 1e-9);
        assertEquals("c", run("\"abc\"[-1]").asString());
    }

    @Test
    void mutatingPopReturnsRemovedElement() {
        Graphoid g = new Graphoid();
        Value popped = g.executeSource("stack = [1, 2, 3]\nstack.pop!()");

        assertEquals(3.0, popped.asNumber(), 1e-9);
        assertEquals("[1, 2]", g.getVariable("stack").toString());
    }

    @Test
    void mutatingCallOnExpressionIsRejected() {
        GraphoidException ex = assertThrows(GraphoidException.class, () -> run("[1, 2].append!(3)"));
        assertEquals("Runtime error: Mutating method 'append!' requires a variable, not an expression", ex.getMessage());
    }

    @Test
    void undefinedNames() {
        assertEquals("Runtime error: Undefined variable: ghost",
                assertThrows(GraphoidException.class, () -> run("ghost + 1")).getMessage());
        assertEquals("Runtime error: Undefined function: ghost",
                assertThrows(GraphoidException.class, () -> run("ghost(1)")).getMessage());
    }

    @Test
    void topLevelReturnEndsProgram() {
        Value v = run("x = 1", "return x + 1", "x = 100");
        assertEquals(2.0, v.asNumber(), 1e-9);
    }
}
