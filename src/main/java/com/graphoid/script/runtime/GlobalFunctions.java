package com.graphoid.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.ErrorObject;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.graph.GraphQuery;

/**
 * Global functions every program sees: print, error constructors, error collection access, exec,
 * len, range, the graph pattern constructors and JSON conversion. Bound per interpreter because
 * print and exec go through its context.
 */
final class GlobalFunctions {

    static final String[] ERROR_TYPES = {
        "RuntimeError", "ValueError", "TypeError", "IOError", "NetworkError", "ParseError"
    };

    /** Host function taking named arguments. */
    private interface NamedFunction {
        Value call(List<Value> args, Map<String, Value> named);
    }

    private GlobalFunctions() {}

    static Map<String, Value> bind(Interpreter itp) {
        Map<String, Value> out = new LinkedHashMap<>();
        RuntimeContext ctx = itp.context();

        put(out, "print", args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i).toDisplayString());
            }
            ctx.output().println(sb.toString());
            return Value.none();
        });

        for (String type : ERROR_TYPES) {
            put(out, type, args -> {
                requireArgs(type, args, 1, 1);
                return Value.error(new ErrorObject(type, args.get(0).toDisplayString()));
            });
        }

        put(out, "get_errors", args -> {
            requireArgs("get_errors", args, 0, 0);
            List<Value> errors = new ArrayList<>();
            for (ErrorObject e : ctx.errors().getErrors()) errors.add(Value.error(e));
            return Value.list(errors);
        });

        put(out, "clear_errors", args -> {
            requireArgs("clear_errors", args, 0, 0);
            ctx.errors().clear();
            return Value.none();
        });

        put(out, "exec", args -> {
            requireArgs("exec", args, 1, 1);
            return Value.string(itp.execProgram(args.get(0).asString()));
        });

        put(out, "len", args -> {
            requireArgs("len", args, 1, 1);
            Value v = args.get(0);
            switch (v.type) {
                case STRING: return Value.number(v.asString().length());
                case LIST: return Value.number(v.asList().size());
                case MAP: return Value.number(v.asMap().size());
                case GRAPH: return Value.number(v.asGraph().nodeCount());
                default: throw GraphoidException.type("len() not supported for " + v.typeName());
            }
        });

        put(out, "range", args -> {
            requireArgs("range", args, 1, 3);
            double start = 0;
            double end;
            double step = 1;
            if (args.size() == 1) {
                end = args.get(0).asNumber();
            } else {
                start = args.get(0).asNumber();
                end = args.get(1).asNumber();
                if (args.size() == 3) step = args.get(2).asNumber();
            }
            if (step == 0) throw GraphoidException.runtime("range() step must not be zero");
            List<Value> items = new ArrayList<>();
            for (double x = start; step > 0 ? x < end : x > end; x += step) items.add(Value.number(x));
            return Value.list(items);
        });

        named(out, "node", (args, named) -> {
            requireArgs("node", args, 0, 1);
            String variable = args.isEmpty() ? null : args.get(0).asString();
            Value type = named.get("type");
            rejectUnknown("node", named, "type");
            return Value.nodePattern(new GraphQuery.NodePattern(variable, (type == null) ? null : BuiltinMethods.key(type)));
        });

        named(out, "edge", (args, named) -> {
            requireArgs("edge", args, 0, 0);
            rejectUnknown("edge", named, "type", "direction");
            Value type = named.get("type");
            Value direction = named.get("direction");
            return Value.edgePattern(new GraphQuery.EdgePattern(
                    (type == null) ? null : BuiltinMethods.key(type),
                    (direction == null) ? null : GraphQuery.EdgePattern.parseDirection(BuiltinMethods.key(direction))));
        });

        named(out, "path", (args, named) -> {
            requireArgs("path", args, 0, 0);
            rejectUnknown("path", named, "edge_type", "min", "max");
            Value type = named.get("edge_type");
            int min = named.containsKey("min") ? named.get("min").asInt() : 1;
            int max = named.containsKey("max") ? named.get("max").asInt() : min;
            return Value.pathPattern(new GraphQuery.PathPattern((type == null) ? null : BuiltinMethods.key(type), min, max));
        });

        put(out, "to_json", args -> {
            requireArgs("to_json", args, 1, 1);
            return Value.string(ValueJson.write(args.get(0)));
        });

        put(out, "parse_json", args -> {
            requireArgs("parse_json", args, 1, 1);
            return ValueJson.read(args.get(0).asString());
        });

        return Collections.unmodifiableMap(out);
    }

    private static void put(Map<String, Value> out, String name, BuiltinFunction fn) {
        out.put(name, Value.nativeFunction(name, fn));
    }

    private static void named(Map<String, Value> out, String name, NamedFunction fn) {
        out.put(name, Value.nativeFunction(name, new BuiltinFunction() {
            @Override
            public Value call(List<Value> args) {
                return fn.call(args, Collections.emptyMap());
            }

            @Override
            public Value call(List<Value> args, Map<String, Value> named) {
                return fn.call(args, (named == null) ? Collections.emptyMap() : named);
            }
        }));
    }

    private static void rejectUnknown(String fn, Map<String, Value> named, String... allowed) {
        outer:
        for (String key : named.keySet()) {
            for (String a : allowed) {
                if (a.equals(key)) continue outer;
            }
            throw GraphoidException.runtime(fn + "() got an unexpected named argument '" + key + "'");
        }
    }

    static void requireArgs(String name, List<Value> args, int min, int max) {
        int n = args.size();
        if (n < min || n > max) {
            String expected = (min == max) ? String.valueOf(min) : min + " to " + max;
            throw GraphoidException.runtime(name + "() expects " + expected + " argument(s), got " + n);
        }
    }
}
