package com.graphoid.script.runtime;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.graphoid.script.errors.ErrorObject;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.errors.SourcePosition;
import com.graphoid.script.rules.RuleInstance;
import com.graphoid.script.rules.RuleSpec;
import com.graphoid.script.rules.TransformationRules;

/**
 * Method tables for built-in value kinds, keyed by (kind, method name). A kind's own table is
 * consulted before the methods every value understands.
 */
public final class BuiltinMethods {

    /** Native method bound to a receiver. */
    @FunctionalInterface
    public interface NativeMethod {
        Value call(Interpreter interpreter, Value self, List<Value> args);
    }

    /**
     * A table entry. Mutators change {@code self} in place; the interpreter then stores the changed
     * receiver back where it was read from.
     */
    public static final class Entry {
        public final String name;
        public final NativeMethod method;
        public final boolean mutator;

        Entry(String name, NativeMethod method, boolean mutator) {
            this.name = name;
            this.method = method;
            this.mutator = mutator;
        }
    }

    private static final Map<Value.Type, Map<String, Entry>> TABLES = new EnumMap<>(Value.Type.class);
    private static final Map<String, Entry> COMMON = new LinkedHashMap<>();

    static {
        registerCommon();
        registerNumbers();
        registerStrings();
        registerFunctions();
        registerErrors();
        CollectionMethods.registerAll();
        GraphMethods.registerAll();
    }

    private BuiltinMethods() {}

    /** Entry for {@code name} on values of {@code type}, or null. */
    public static Entry find(Value.Type type, String name) {
        Map<String, Entry> table = TABLES.get(type);
        if (table != null) {
            Entry e = table.get(name);
            if (e != null) return e;
        }
        return COMMON.get(name);
    }

    static void register(Value.Type type, String name, NativeMethod method) {
        TABLES.computeIfAbsent(type, k -> new LinkedHashMap<>()).put(name, new Entry(name, method, false));
    }

    static void registerMutator(Value.Type type, String name, NativeMethod method) {
        TABLES.computeIfAbsent(type, k -> new LinkedHashMap<>()).put(name, new Entry(name, method, true));
    }

    // -------------------------
    // Every kind
    // -------------------------

    private static void registerCommon() {
        common("type", (itp, self, a) -> {
            expectArgs("type", a, 0, 0);
            return Value.string(self.typeName());
        });
        common("to_string", (itp, self, a) -> {
            expectArgs("to_string", a, 0, 0);
            return Value.string(self.toDisplayString());
        });
        common("to_num", (itp, self, a) -> {
            expectArgs("to_num", a, 0, 0);
            return toNum(self);
        });
        common("to_bignum", (itp, self, a) -> {
            expectArgs("to_bignum", a, 0, 0);
            return Value.bignum(Operators.toBigNumber(self, itp.config()));
        });
        common("is_bignum", (itp, self, a) -> {
            expectArgs("is_bignum", a, 0, 0);
            return Value.bool(self.type == Value.Type.BIGNUM);
        });
        common("freeze", (itp, self, a) -> {
            expectArgs("freeze", a, 0, 0);
            return self.freeze(!TransformationRules.hasRule(rulesOf(self), RuleSpec.Kind.SHALLOW_FREEZE_ONLY));
        });
        common("is_frozen", (itp, self, a) -> {
            expectArgs("is_frozen", a, 0, 0);
            return Value.bool(self.isFrozen());
        });
    }

    private static void common(String name, NativeMethod method) {
        COMMON.put(name, new Entry(name, method, false));
    }

    private static Value toNum(Value self) {
        switch (self.type) {
            case NUMBER:
                return self;
            case BIGNUM:
                return Value.number(self.asBigNumber().toDouble());
            case BOOL:
                return Value.number(self.asBool() ? 1 : 0);
            case NONE:
                return Value.number(0);
            case STRING:
                try {
                    return Value.number(Double.parseDouble(self.asString().trim()));
                } catch (NumberFormatException e) {
                    throw GraphoidException.type("Cannot convert '" + self.asString() + "' to num");
                }
            default:
                throw GraphoidException.type("Cannot convert " + self.typeName() + " to num");
        }
    }

    static List<RuleInstance> rulesOf(Value v) {
        switch (v.type) {
            case LIST: return v.asList().rules();
            case MAP: return v.asMap().rules();
            case GRAPH: return v.asGraph().rules();
            default: return new ArrayList<>();
        }
    }

    // -------------------------
    // num / bignum
    // -------------------------

    private static void registerNumbers() {
        numeric("abs", (itp, self, a) -> {
            expectArgs("abs", a, 0, 0);
            return (self.type == Value.Type.BIGNUM) ? Value.bignum(self.asBigNumber().abs()) : Value.number(Math.abs(self.asNumber()));
        });
        numeric("sqrt", (itp, self, a) -> {
            expectArgs("sqrt", a, 0, 0);
            if (self.type == Value.Type.BIGNUM) {
                BigDecimal d = self.asBigNumber().toBigDecimal();
                if (d.signum() < 0) throw GraphoidException.runtime("Cannot take square root of negative number");
                return Value.bignum(BigNumber.float128(d.sqrt(MathContext.DECIMAL128)));
            }
            if (self.asNumber() < 0) throw GraphoidException.runtime("Cannot take square root of negative number");
            return Value.number(Math.sqrt(self.asNumber()));
        });
        numeric("floor", (itp, self, a) -> {
            expectArgs("floor", a, 0, 0);
            if (self.type == Value.Type.BIGNUM) return Value.bignum(scaleBig(self.asBigNumber(), RoundingMode.FLOOR));
            return Value.number(Math.floor(self.asNumber()));
        });
        numeric("ceil", (itp, self, a) -> {
            expectArgs("ceil", a, 0, 0);
            if (self.type == Value.Type.BIGNUM) return Value.bignum(scaleBig(self.asBigNumber(), RoundingMode.CEILING));
            return Value.number(Math.ceil(self.asNumber()));
        });
        numeric("round", (itp, self, a) -> {
            expectArgs("round", a, 0, 1);
            int places = a.isEmpty() ? 0 : a.get(0).asInt();
            if (self.type == Value.Type.BIGNUM) return Value.bignum(self.asBigNumber().round(places));
            if (places == 0) return Value.number(TransformationRules.roundHalfAwayFromZero(self.asNumber()));
            return Value.number(Operators.roundTo(self.asNumber(), places));
        });
        numeric("is_integer", (itp, self, a) -> {
            expectArgs("is_integer", a, 0, 0);
            if (self.type == Value.Type.BIGNUM) return Value.bool(self.asBigNumber().isInteger());
            double d = self.asNumber();
            return Value.bool(!Double.isInfinite(d) && d == Math.floor(d));
        });
    }

    private static void numeric(String name, NativeMethod method) {
        register(Value.Type.NUMBER, name, method);
        register(Value.Type.BIGNUM, name, method);
    }

    private static BigNumber scaleBig(BigNumber b, RoundingMode mode) {
        if (b.kind != BigNumber.Kind.FLOAT128) return b;
        return BigNumber.float128(b.toBigDecimal().setScale(0, mode));
    }

    // -------------------------
    // string
    // -------------------------

    private static void registerStrings() {
        NativeMethod length = (itp, self, a) -> {
            expectArgs("length", a, 0, 0);
            return Value.number(self.asString().length());
        };
        register(Value.Type.STRING, "length", length);
        register(Value.Type.STRING, "size", length);
        register(Value.Type.STRING, "upper", (itp, self, a) -> Value.string(self.asString().toUpperCase()));
        register(Value.Type.STRING, "lower", (itp, self, a) -> Value.string(self.asString().toLowerCase()));
        register(Value.Type.STRING, "trim", (itp, self, a) -> Value.string(self.asString().trim()));
        register(Value.Type.STRING, "contains", (itp, self, a) -> {
            expectArgs("contains", a, 1, 1);
            return Value.bool(self.asString().contains(str(a, 0, "contains")));
        });
        register(Value.Type.STRING, "starts_with", (itp, self, a) -> {
            expectArgs("starts_with", a, 1, 1);
            return Value.bool(self.asString().startsWith(str(a, 0, "starts_with")));
        });
        register(Value.Type.STRING, "ends_with", (itp, self, a) -> {
            expectArgs("ends_with", a, 1, 1);
            return Value.bool(self.asString().endsWith(str(a, 0, "ends_with")));
        });
        register(Value.Type.STRING, "split", (itp, self, a) -> {
            expectArgs("split", a, 0, 1);
            String s = self.asString();
            List<Value> parts = new ArrayList<>();
            if (a.isEmpty()) {
                for (String p : s.trim().split("\\s+")) if (!p.isEmpty()) parts.add(Value.string(p));
                return Value.list(parts);
            }
            String sep = str(a, 0, "split");
            if (sep.isEmpty()) return chars(s);
            for (String p : s.split(Pattern.quote(sep), -1)) parts.add(Value.string(p));
            return Value.list(parts);
        });
        register(Value.Type.STRING, "replace", (itp, self, a) -> {
            expectArgs("replace", a, 2, 2);
            return Value.string(self.asString().replace(str(a, 0, "replace"), str(a, 1, "replace")));
        });
        register(Value.Type.STRING, "reverse", (itp, self, a) ->
                Value.string(new StringBuilder(self.asString()).reverse().toString()));
        register(Value.Type.STRING, "chars", (itp, self, a) -> chars(self.asString()));
        register(Value.Type.STRING, "index_of", (itp, self, a) -> {
            expectArgs("index_of", a, 1, 1);
            return Value.number(self.asString().indexOf(str(a, 0, "index_of")));
        });
        register(Value.Type.STRING, "slice", (itp, self, a) -> {
            expectArgs("slice", a, 1, 2);
            String s = self.asString();
            int start = clampIndex(a.get(0).asInt(), s.length());
            int end = (a.size() > 1) ? clampIndex(a.get(1).asInt(), s.length()) : s.length();
            return Value.string(start >= end ? "" : s.substring(start, end));
        });
    }

    private static Value chars(String s) {
        List<Value> out = new ArrayList<>();
        s.codePoints().forEach(cp -> out.add(Value.string(new String(Character.toChars(cp)))));
        return Value.list(out);
    }

    /** Negative indexes count from the end; the result is clamped to [0, length]. */
    static int clampIndex(int index, int length) {
        int i = (index < 0) ? length + index : index;
        return Math.max(0, Math.min(i, length));
    }

    // -------------------------
    // function
    // -------------------------

    private static void registerFunctions() {
        NativeMethod name = (itp, self, a) -> {
            if (self.type == Value.Type.NATIVE_FUNCTION) return Value.string(self.asNativeFunction().name);
            String n = self.asFunction().name;
            return (n == null) ? Value.none() : Value.string(n);
        };
        NativeMethod arity = (itp, self, a) -> {
            if (self.type == Value.Type.NATIVE_FUNCTION) return Value.number(-1);
            return Value.number(self.asFunction().arity());
        };
        NativeMethod call = (itp, self, a) -> itp.callValue(self, a);
        for (Value.Type t : new Value.Type[] {Value.Type.FUNCTION, Value.Type.NATIVE_FUNCTION}) {
            register(t, "name", name);
            register(t, "arity", arity);
            register(t, "call", call);
        }
    }

    // -------------------------
    // error
    // -------------------------

    private static void registerErrors() {
        register(Value.Type.ERROR, "message", (itp, self, a) -> Value.string(self.asError().message));
        register(Value.Type.ERROR, "type", (itp, self, a) -> Value.string(self.asError().type));
        register(Value.Type.ERROR, "position", (itp, self, a) -> {
            SourcePosition p = self.asError().position;
            if (!p.isKnown()) return Value.none();
            LinkedHashMap<String, Value> m = new LinkedHashMap<>();
            m.put("line", Value.number(p.line));
            m.put("column", Value.number(p.column));
            if (p.file != null) m.put("file", Value.string(p.file));
            return Value.map(new MapValue(m));
        });
        register(Value.Type.ERROR, "stack_trace", (itp, self, a) -> {
            List<Value> frames = new ArrayList<>();
            for (String f : self.asError().stackTrace) frames.add(Value.string(f));
            return Value.list(frames);
        });
        register(Value.Type.ERROR, "cause", (itp, self, a) -> {
            ErrorObject c = self.asError().cause;
            return (c == null) ? Value.none() : Value.error(c);
        });
        register(Value.Type.ERROR, "with_cause", (itp, self, a) -> {
            expectArgs("with_cause", a, 1, 1);
            return Value.error(self.asError().withCause(a.get(0).asError()));
        });
        register(Value.Type.ERROR, "full_message", (itp, self, a) -> Value.string(self.asError().fullMessage()));
    }

    // -------------------------
    // Argument helpers
    // -------------------------

    static void expectArgs(String method, List<Value> args, int min, int max) {
        int n = args.size();
        if (n >= min && n <= max) return;
        String expected = (min == max) ? String.valueOf(min) : min + " to " + max;
        throw GraphoidException.runtime("Method '" + method + "' expects " + expected
                + " argument" + (max == 1 ? "" : "s") + ", but got " + n);
    }

    static String str(List<Value> args, int i, String method) {
        Value v = args.get(i);
        if (v.type == Value.Type.STRING) return v.asString();
        throw GraphoidException.type("Method '" + method + "' expects a string argument, got " + v.typeName());
    }

    /** Node ids, map keys and similar names: strings as is, symbols by name, numbers in display form. */
    static String key(Value v) {
        switch (v.type) {
            case STRING: return v.asString();
            case SYMBOL: return v.asSymbol();
            case NUMBER:
            case BIGNUM:
                return v.toString();
            default:
                throw GraphoidException.type("Expected string key, got " + v.typeName());
        }
    }
}
