package com.graphoid.script.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.parser.Expr.ExprInterface;
import com.graphoid.script.parser.Expr.Param;

/**
 * Binds evaluated call-site arguments to a function's parameters: named first, then positional into
 * the next open slot (diverting into the variadic collector once it is reached), then defaults.
 */
public final class ArgumentBinder {

    /** Evaluated argument; {@code writeBackVar} names the caller variable of an {@code x!} argument. */
    public static final class ArgValue {
        public final String name;
        public final Value value;
        public final String writeBackVar;

        public ArgValue(String name, Value value, String writeBackVar) {
            this.name = name;
            this.value = value;
            this.writeBackVar = writeBackVar;
        }

        public static ArgValue positional(Value value) {
            return new ArgValue(null, value, null);
        }
    }

    /** (parameter, caller variable) pair to copy back after the callee returns. */
    public static final class WriteBack {
        public final String param;
        public final String variable;

        WriteBack(String param, String variable) {
            this.param = param;
            this.variable = variable;
        }
    }

    public static final class Bound {
        public final LinkedHashMap<String, Value> values;
        public final List<WriteBack> writeBacks;

        Bound(LinkedHashMap<String, Value> values, List<WriteBack> writeBacks) {
            this.values = values;
            this.writeBacks = writeBacks;
        }
    }

    /** Evaluates default expressions in the caller's scope. */
    @FunctionalInterface
    public interface DefaultEvaluator {
        Value evaluate(ExprInterface expr);
    }

    private ArgumentBinder() {}

    public static Bound bind(GraphFunction fn, List<ArgValue> args, DefaultEvaluator defaults) {
        List<Param> params = fn.params;
        int n = params.size();
        Value[] slots = new Value[n];
        int variadicIndex = -1;
        for (int i = 0; i < n; i++) if (params.get(i).variadic) variadicIndex = i;
        List<Value> rest = new ArrayList<>();
        List<WriteBack> writeBacks = new ArrayList<>();
        String fnName = fn.displayName();

        for (ArgValue a : args) {
            if (a.name == null) continue;
            int idx = indexOf(params, a.name);
            if (idx < 0) throw GraphoidException.runtime("Unknown parameter '" + a.name + "' in function '" + fnName + "'");
            if (slots[idx] != null) throw GraphoidException.runtime("Parameter '" + a.name + "' specified multiple times");
            slots[idx] = a.value;
            if (a.writeBackVar != null) writeBacks.add(new WriteBack(a.name, a.writeBackVar));
        }

        boolean[] named = new boolean[n];
        for (int i = 0; i < n; i++) named[i] = slots[i] != null;

        int next = 0;
        int positional = 0;
        for (ArgValue a : args) {
            if (a.name != null) continue;
            positional++;
            while (next < n && next != variadicIndex && slots[next] != null) next++;
            if (next >= n) throw overflow(params, named, positional, fnName);
            if (next == variadicIndex) {
                rest.add(a.value);
                continue;
            }
            slots[next] = a.value;
            if (a.writeBackVar != null) writeBacks.add(new WriteBack(params.get(next).name.lexeme, a.writeBackVar));
            next++;
        }

        LinkedHashMap<String, Value> values = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            Param p = params.get(i);
            String name = p.name.lexeme;
            if (i == variadicIndex) {
                values.put(name, slots[i] != null ? slots[i] : Value.list(rest));
            } else if (slots[i] != null) {
                values.put(name, slots[i]);
            } else if (p.defaultValue != null) {
                values.put(name, defaults.evaluate(p.defaultValue));
            } else {
                throw GraphoidException.runtime("Missing required parameter '" + name + "' in function '" + fnName + "'");
            }
        }
        return new Bound(values, writeBacks);
    }

    /**
     * A positional argument found no open slot. If a named argument took a slot that this argument
     * would otherwise have filled, the parameter was given twice.
     */
    private static GraphoidException overflow(List<Param> params, boolean[] named, int positional, String fnName) {
        for (int i = 0; i < Math.min(positional, named.length); i++) {
            if (named[i]) {
                return GraphoidException.runtime("Parameter '" + params.get(i).name.lexeme + "' specified multiple times");
            }
        }
        return GraphoidException.runtime("Too many arguments for function '" + fnName + "'");
    }

    private static int indexOf(List<Param> params, String name) {
        for (int i = 0; i < params.size(); i++) {
            if (params.get(i).name.lexeme.equals(name)) return i;
        }
        return -1;
    }
}
