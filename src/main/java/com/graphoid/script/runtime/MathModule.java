package com.graphoid.script.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.GraphoidException;

/**
 * The {@code math} native module.
 *
 * Usage in scripts:
 *   import "math"
 *   x = math.sqrt(16)
 *   y = math.pow(2, 8)
 */
public final class MathModule {

    private MathModule() {}

    public static Map<String, Value> members() {
        Map<String, Value> m = new LinkedHashMap<>();

        fn(m, "sqrt", args -> {
            requireArgs("sqrt", args, 1);
            double x = num(args, 0);
            if (x < 0) throw GraphoidException.runtime("Cannot take square root of negative number");
            return Value.number(Math.sqrt(x));
        });

        fn(m, "pow", args -> {
            requireArgs("pow", args, 2);
            return Value.number(Math.pow(num(args, 0), num(args, 1)));
        });

        fn(m, "abs", args -> {
            requireArgs("abs", args, 1);
            return Value.number(Math.abs(num(args, 0)));
        });

        fn(m, "floor", args -> {
            requireArgs("floor", args, 1);
            return Value.number(Math.floor(num(args, 0)));
        });

        fn(m, "ceil", args -> {
            requireArgs("ceil", args, 1);
            return Value.number(Math.ceil(num(args, 0)));
        });

        fn(m, "min", args -> {
            requireArgs("min", args, 2);
            return Value.number(Math.min(num(args, 0), num(args, 1)));
        });

        fn(m, "max", args -> {
            requireArgs("max", args, 2);
            return Value.number(Math.max(num(args, 0), num(args, 1)));
        });

        m.put("pi", Value.number(Math.PI));
        return m;
    }

    private static void fn(Map<String, Value> m, String name, BuiltinFunction f) {
        m.put(name, Value.nativeFunction(name, f));
    }

    private static void requireArgs(String name, List<Value> args, int n) {
        if (args.size() != n) {
            throw GraphoidException.runtime(name + "() expects " + n + " argument(s), got " + args.size());
        }
    }

    private static double num(List<Value> args, int idx) {
        Value v = args.get(idx);
        if (!v.isNumeric()) {
            throw GraphoidException.type("Argument " + idx + " must be a number, got " + v.typeName());
        }
        return v.asNumber();
    }
}
