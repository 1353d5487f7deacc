import com.graphoid.script.Graphoid;
import com.graphoid.script.errors.ErrorKind;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.Value;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurationTest {

    private static Value run(String... lines) {
        return new Graphoid().executeSource(String.join("\n", lines));
    }

    @Test
    void integerModeTruncatesInsideBlockOnly() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "configure { :integer } {",
            "  x = 7 / 2",
            "}",
            "y = 7 / 2"
        ));

        assertEquals(3.0, g.getVariable("x").asNumber(), 1e-9);
        assertEquals(3.5, g.getVariable("y").asNumber(), 1e-9);
    }

    @Test
    void precisionBlockRoundsAssignments() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "precision 2 {",
            "  y = 3.14159",
            "}",
            "precision :int {",
            "  z = 2.5",
            "}"
        ));

        assertEquals(3.14, g.getVariable("y").asNumber(), 1e-9);
        assertEquals(3.0, g.getVariable("z").asNumber(), 1e-9);
    }

    @Test
    void decimalPlacesSetting() {
        Value v = run(
            "configure { decimal_places: 1 } {",
            "  r = 2.0 / 3.0",
            "}",
            "r"
        );
        assertEquals(0.7, v.asNumber(), 1e-9);
    }

    @Test
    void highPrecisionUsesDecimalArithmetic() {
        Value v = run(
            "configure { :high } {",
            "  s = 0.1 + 0.2",
            "}",
            "s"
        );
        assertEquals(Value.Type.BIGNUM, v.type);
        assertEquals("0.3", v.toString());
    }

    @Test
    void extendedPrecisionGrowsIntegers() {
        Value v = run(
            "configure { precision: :extended } {",
            "  big = 2 ** 100",
            "}",
            "big"
        );
        assertEquals("1267650600228229401496703205376", v.toString());
    }

    @Test
    void highIntegerModeOverflowGrows() {
        Value v = run(
            "configure { :high, :integer } {",
            "  n = 9223372036854775807 + 1",
            "}",
            "n"
        );
        assertEquals("9223372036854775808", v.toString());
    }

    @Test
    void unsignedModeRejectsNegativeResults() {
        GraphoidException ex = assertThrows(GraphoidException.class, () -> run(
            "configure { :high, :integer, :unsigned } {",
            "  n = 1 - 2",
            "}"
        ));
        assertTrue(ex.getMessage().contains("Unsigned integer underflow"));
    }

    @Test
    void bigNumberPowerFailuresAreCatchableRuntimeErrors() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "zero = none",
            "root = none",
            "huge = none",
            "configure { precision: :extended } {",
            "  try {",
            "    y = 0 ** -1",
            "  } catch RuntimeError as e {",
            "    zero = e.message()",
            "  }",
            "  try {",
            "    y = 2 ** 10000000000",
            "  } catch RuntimeError as e {",
            "    huge = e.message()",
            "  }",
            "}",
            "configure { :high } {",
            "  try {",
            "    y = (0 - 8) ** 0.5",
            "  } catch RuntimeError as e {",
            "    root = e.message()",
            "  }",
            "}"
        ));

        assertEquals("Division by zero", g.getVariable("zero").asString());
        assertEquals("Exponent too large: 10000000000", g.getVariable("huge").asString());
        assertEquals("Cannot raise negative number to fractional power", g.getVariable("root").asString());
    }

    @Test
    void bigNumberPowers() {
        assertEquals("0.125", run("configure { :high } {", "  p = 2 ** -3", "}", "p").toString());
        assertEquals("1024", run("configure { precision: :extended } {", "  p = 2 ** 10", "}", "p").toString());
    }

    @Test
    void bodylessConfigureLastsForTheRun() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "configure { :integer }",
            "a = 9 / 2"
        ));
        g.executeSource("b = 9 / 2");

        assertEquals(4.0, g.getVariable("a").asNumber(), 1e-9);
        assertEquals(4.5, g.getVariable("b").asNumber(), 1e-9);
    }

    @Test
    void configFrameIsRestoredAfterError() {
        Graphoid g = new Graphoid();
        assertThrows(GraphoidException.class, () -> g.executeSource(String.join("\n",
            "configure { :integer } {",
            "  raise \"stop\"",
            "}"
        )));
        g.executeSource("c = 5 / 2");

        assertEquals(2.5, g.getVariable("c").asNumber(), 1e-9);
    }

    @Test
    void unknownKeysAndBadValues() {
        GraphoidException key = assertThrows(GraphoidException.class, () -> run("configure { colour: :red } { }"));
        assertEquals(ErrorKind.CONFIG, key.getKind());
        assertEquals("Configuration error: Unknown configuration key: colour", key.getMessage());

        GraphoidException value = assertThrows(GraphoidException.class, () -> run("configure { error_mode: :loud } { }"));
        assertEquals("Invalid value for error_mode: :loud", value.getDetail());

        GraphoidException flag = assertThrows(GraphoidException.class, () -> run("configure { :sparkly } { }"));
        assertEquals("Unknown configuration flag: :sparkly", flag.getDetail());
    }

    @Test
    void skipNoneAffectsAggregates() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "data = [5, none, 2, 8]",
            "configure { skip_none: true } {",
            "  total = data.sum()",
            "  low = data.min()",
            "  high = data.max()",
            "}"
        ));

        assertEquals(15.0, g.getVariable("total").asNumber(), 1e-9);
        assertEquals(2.0, g.getVariable("low").asNumber(), 1e-9);
        assertEquals(8.0, g.getVariable("high").asNumber(), 1e-9);

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("data.sum()"));
        assertEquals(ErrorKind.TYPE, ex.getKind());
    }

    @Test
    void strictTypesRejectsMixedConcatenation() {
        assertEquals("n=1", run("\"n=\" + 1").asString());

        GraphoidException ex = assertThrows(GraphoidException.class, () -> run(
            "configure { strict_types: true } {",
            "  s = \"n=\" + 1",
            "}"
        ));
        assertEquals(ErrorKind.TYPE, ex.getKind());
        assertTrue(ex.getDetail().startsWith("Cannot add string and num"));
    }

    @Test
    void nestedBlocksRestoreOuterFrame() {
        Value v = run(
            "configure { skip_none: false } {",
            "  configure { skip_none: true } {",
            "    inner = [1, none, 2].sum()",
            "  }",
            "}",
            "inner"
        );
        assertEquals(3.0, v.asNumber(), 1e-9);
    }

    @Test
    void hostJsonBecomesBaseFrame() {
        Graphoid g = new Graphoid();
        g.applyConfigJson("{\"integer\": true, \"error_mode\": \":lenient\"}");
        g.executeSource("x = 7 / 2\ny = [][3]");

        assertEquals(3.0, g.getVariable("x").asNumber(), 1e-9);
        assertTrue(g.getVariable("y").isNone());
    }

    @Test
    void hostJsonMustBeAnObject() {
        Graphoid g = new Graphoid();

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.applyConfigJson("[1]"));
        assertEquals("Configuration error: Configuration JSON must be an object", ex.getMessage());
        GraphoidException bad = assertThrows(GraphoidException.class, () -> g.applyConfigJson("{nope"));
        assertEquals(ErrorKind.CONFIG, bad.getKind());
        assertTrue(bad.getDetail().startsWith("Invalid configuration JSON"));
    }

    @Test
    void bignumDeclarationConverts() {
        Value v = run("bignum b = 5", "b");
        assertEquals(Value.Type.BIGNUM, v.type);
        assertEquals("5", v.toString());
    }

    @Test
    void maxCallDepthIsEnforced() {
        Graphoid g = new Graphoid();
        g.setMaxCallDepth(50);
        g.executeSource("fn down(n) { return 0 if n == 0 else down(n - 1) }");

        assertEquals(0.0, g.executeSource("down(10)").asNumber(), 1e-9);
        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("down(100)"));
        assertEquals("Runtime error: Maximum call depth (50) exceeded", ex.getMessage());
    }

    @Test
    void unboundedRecursionBecomesRuntimeError() {
        Graphoid g = new Graphoid();
        g.executeSource("fn forever(n) { return forever(n + 1) }");

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("forever(0)"));
        assertEquals("Runtime error: Maximum recursion depth exceeded", ex.getMessage());
    }
}
