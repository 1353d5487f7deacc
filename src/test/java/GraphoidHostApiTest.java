import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphoid.debug.Debug;
import com.graphoid.debug.DebugLevel;
import com.graphoid.script.Graphoid;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.BuiltinFunction;
import com.graphoid.script.runtime.Value;
import com.graphoid.script.runtime.ValueJson;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GraphoidHostApiTest {

    @Test
    void globalsPersistAcrossRuns() {
        Graphoid g = new Graphoid();
        g.executeSource("counter = 1");
        g.executeSource("counter = counter + 1");

        assertEquals(2.0, g.getVariable("counter").asNumber(), 1e-9);
        assertNull(g.getVariable("missing"));
    }

    @Test
    void hostVariablesAreVisibleToScripts() {
        Graphoid g = new Graphoid();
        g.setVariable("limit", Value.number(10));

        assertEquals(20.0, g.executeSource("limit * 2").asNumber(), 1e-9);
    }

    @Test
    void getVariableReturnsCopy() {
        Graphoid g = new Graphoid();
        g.executeSource("xs = [1, 2]");

        Value copy = g.getVariable("xs");
        copy.asList().add(Value.number(3));
        assertEquals("[1, 2]", g.getVariable("xs").toString());
    }

    @Test
    void registeredFunctionsAreCallable() {
        Graphoid g = new Graphoid();
        List<String> seen = new ArrayList<>();
        g.registerFunction("host_log", args -> {
            seen.add(args.get(0).toDisplayString());
            return Value.bool(true);
        });

        assertTrue(g.executeSource("host_log(\"ping\")").asBool());
        assertEquals(List.of("ping"), seen);
    }

    @Test
    void outputCapture() {
        Graphoid g = new Graphoid();
        g.enableOutputCapture();
        g.executeSource("print(\"a\", 1)\nprint([1, 2])");

        assertEquals("a 1\n[1, 2]\n", g.getCapturedOutput());
        assertEquals("a 1\n[1, 2]\n", g.disableOutputCapture());
    }

    @Test
    void outputStream() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        Graphoid g = new Graphoid(new PrintStream(buf, true, StandardCharsets.UTF_8));
        g.executeSource("print(\"to stream\", :sym, none)");

        assertEquals("to stream :sym none" + System.lineSeparator(), buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void snapshotJsonSkipsFunctions() {
        Graphoid g = new Graphoid();
        g.executeSource(String.join("\n",
            "a = 1",
            "b = \"s\"",
            "c = [1, 2.5]",
            "fn helper() { return 0 }"
        ));

        ObjectNode node = g.snapshotJson();
        assertEquals("{\"a\":1,\"b\":\"s\",\"c\":[1,2.5]}", ValueJson.write(node, false));
        assertTrue(g.snapshot().containsKey("helper"));
    }

    @Test
    void graphsSerializeWithNodesAndEdges() {
        Graphoid g = new Graphoid();
        Value v = g.executeSource(String.join("\n",
            "g = graph {}",
            "g.add_node(\"a\", 1)",
            "g.add_node(\"b\", 2)",
            "g.add_edge(\"a\", \"b\", \"next\", 1.5)",
            "to_json(g)"
        ));

        assertEquals("{\"nodes\":{\"a\":1,\"b\":2},\"edges\":[{\"from\":\"a\",\"to\":\"b\",\"type\":\"next\",\"weight\":1.5}]}",
                v.asString());
    }

    @Test
    void jsonConversionFromScripts() {
        Graphoid g = new Graphoid();

        assertEquals("{\"k\":[1,true,null],\"s\":\":sym\"}",
                g.executeSource("to_json({\"k\": [1, true, none], \"s\": :sym})").asString());
        assertEquals(2.0, g.executeSource("parse_json('{\"a\": [1, 2]}')[\"a\"][1]").asNumber(), 1e-9);

        GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("parse_json(\"{oops\")"));
        assertTrue(ex.getDetail().startsWith("Invalid JSON"));
    }

    @Test
    void nativeModuleRegistration() {
        Graphoid g = new Graphoid();
        Map<String, BuiltinFunction> fns = new LinkedHashMap<>();
        fns.put("add", args -> Value.number(args.get(0).asNumber() + args.get(1).asNumber()));
        g.registerModule("calc", fns);

        assertEquals(5.0, g.executeSource("import \"calc\"\ncalc.add(2, 3)").asNumber(), 1e-9);
    }

    @Test
    void failuresAreLoggedAndRethrown() {
        List<String> logged = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.ERROR) logged.add(tag + "|" + message);
        });
        try {
            Graphoid g = new Graphoid();
            GraphoidException ex = assertThrows(GraphoidException.class, () -> g.executeSource("nope()"));

            assertEquals("Runtime error: Undefined function: nope", ex.getMessage());
            assertEquals(1, logged.size());
            assertEquals("Graphoid|script failed: Runtime error: Undefined function: nope", logged.get(0));
        } finally {
            Debug.get().setSink(null);
        }
    }

    @Test
    void printStreamSinkFiltersByLevel() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(buf, true, StandardCharsets.UTF_8);
        Debug.get().setSink(Debug.printStreamSink(ps, DebugLevel.WARN));
        try {
            Debug.get().d("Test", "hidden");
            Debug.get().w("Test", "shown");
        } finally {
            Debug.get().setSink(null);
        }

        assertEquals("[WARN] Test: shown" + System.lineSeparator(), buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void collectedErrorsExposedToHost() {
        Graphoid g = new Graphoid();
        g.executeSource("configure { error_mode: :collect } {\n  x = {\"a\": 1}[\"b\"]\n}");

        assertEquals(1, g.getErrors().size());
        assertEquals("Key not found: 'b'", g.getErrors().get(0).message);
    }
}
