package com.graphoid.script.runtime;

import static com.graphoid.script.runtime.BuiltinMethods.expectArgs;
import static com.graphoid.script.runtime.BuiltinMethods.key;
import static com.graphoid.script.runtime.BuiltinMethods.register;
import static com.graphoid.script.runtime.BuiltinMethods.registerMutator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.parser.TokenType;
import com.graphoid.script.rules.RuleInstance;
import com.graphoid.script.rules.RuleSeverity;
import com.graphoid.script.rules.RuleSpec;
import com.graphoid.script.rules.RuleSymbols;

/**
 * List and map methods. Apart from the rule methods they never touch the receiver: they return a
 * new collection, which {@code x.m!()} stores back into {@code x}.
 */
final class CollectionMethods {
    private CollectionMethods() {}

    static void registerAll() {
        registerLists();
        registerMaps();
    }

    // -------------------------
    // list
    // -------------------------

    private static void registerLists() {
        final Value.Type L = Value.Type.LIST;

        BuiltinMethods.NativeMethod size = (itp, self, a) -> {
            expectArgs("size", a, 0, 0);
            return Value.number(self.asList().size());
        };
        register(L, "size", size);
        register(L, "length", size);
        register(L, "first", (itp, self, a) -> {
            expectArgs("first", a, 0, 0);
            ListValue l = self.asList();
            if (l.size() == 0) throw GraphoidException.runtime("Cannot get first element of empty list");
            return l.get(0);
        });
        register(L, "last", (itp, self, a) -> {
            expectArgs("last", a, 0, 0);
            ListValue l = self.asList();
            if (l.size() == 0) throw GraphoidException.runtime("Cannot get last element of empty list");
            return l.get(l.size() - 1);
        });
        register(L, "contains", (itp, self, a) -> {
            expectArgs("contains", a, 1, 1);
            return Value.bool(indexOf(self.asList(), a.get(0)) >= 0);
        });
        register(L, "is_empty", (itp, self, a) -> Value.bool(self.asList().size() == 0));
        register(L, "index_of", (itp, self, a) -> {
            expectArgs("index_of", a, 1, 1);
            return Value.number(indexOf(self.asList(), a.get(0)));
        });

        register(L, "map", (itp, self, a) -> {
            expectArgs("map", a, 1, 1);
            Value fn = a.get(0);
            List<Value> out = new ArrayList<>();
            for (Value v : self.asList().items()) {
                out.add(fn.type == Value.Type.SYMBOL ? namedTransformation(v, fn.asSymbol()) : call(itp, fn, "map", v));
            }
            return Value.list(out);
        });
        register(L, "filter", (itp, self, a) -> {
            expectArgs("filter", a, 1, 1);
            return Value.list(self.asList().derive(select(itp, self.asList(), a.get(0), "filter", true)));
        });
        register(L, "reject", (itp, self, a) -> {
            expectArgs("reject", a, 1, 1);
            return Value.list(self.asList().derive(select(itp, self.asList(), a.get(0), "reject", false)));
        });
        register(L, "each", (itp, self, a) -> {
            expectArgs("each", a, 1, 1);
            for (Value v : self.asList().items()) call(itp, a.get(0), "each", v);
            return self;
        });
        register(L, "reduce", (itp, self, a) -> {
            expectArgs("reduce", a, 2, 2);
            Value acc = a.get(0);
            Value fn = requireCallable(a.get(1), "reduce");
            for (Value v : self.asList().items()) acc = itp.callValue(fn, Arrays.asList(acc, v));
            return acc;
        });
        register(L, "sort", (itp, self, a) -> {
            expectArgs("sort", a, 0, 1);
            List<Value> items = new ArrayList<>(self.asList().items());
            if (a.isEmpty()) {
                items.sort((x, y) -> Operators.compare(x, y, "sort"));
            } else {
                Value fn = requireCallable(a.get(0), "sort");
                items.sort((x, y) -> comparatorResult(itp, fn, x, y));
            }
            return Value.list(self.asList().derive(items));
        });
        register(L, "reverse", (itp, self, a) -> {
            List<Value> items = new ArrayList<>(self.asList().items());
            Collections.reverse(items);
            return Value.list(self.asList().derive(items));
        });
        register(L, "join", (itp, self, a) -> {
            expectArgs("join", a, 0, 1);
            String sep = a.isEmpty() ? "" : BuiltinMethods.str(a, 0, "join");
            StringBuilder sb = new StringBuilder();
            List<Value> items = self.asList().items();
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(sep);
                sb.append(items.get(i).toDisplayString());
            }
            return Value.string(sb.toString());
        });
        register(L, "uniq", (itp, self, a) -> {
            List<Value> out = new ArrayList<>();
            for (Value v : self.asList().items()) {
                boolean seen = false;
                for (Value o : out) if (o.valueEquals(v)) { seen = true; break; }
                if (!seen) out.add(v);
            }
            return Value.list(self.asList().derive(out));
        });
        register(L, "compact", (itp, self, a) -> {
            List<Value> out = new ArrayList<>();
            for (Value v : self.asList().items()) if (!v.isNone()) out.add(v);
            return Value.list(self.asList().derive(out));
        });
        register(L, "slice", (itp, self, a) -> {
            expectArgs("slice", a, 1, 3);
            List<Value> items = self.asList().items();
            int start = BuiltinMethods.clampIndex(a.get(0).asInt(), items.size());
            int end = (a.size() > 1) ? BuiltinMethods.clampIndex(a.get(1).asInt(), items.size()) : items.size();
            int step = (a.size() > 2) ? a.get(2).asInt() : 1;
            if (step <= 0) throw GraphoidException.runtime("Slice step must be positive");
            List<Value> out = new ArrayList<>();
            for (int i = start; i < end; i += step) out.add(items.get(i));
            return Value.list(self.asList().derive(out));
        });
        register(L, "sum", (itp, self, a) -> {
            Value total = Value.number(0);
            for (Value v : numericItems(itp, self.asList(), "sum")) total = Operators.binary(TokenType.PLUS, total, v);
            return total;
        });
        register(L, "min", (itp, self, a) -> extreme(itp, self.asList(), "min", -1));
        register(L, "max", (itp, self, a) -> extreme(itp, self.asList(), "max", 1));

        register(L, "append", (itp, self, a) -> {
            expectArgs("append", a, 1, 1);
            ListValue copy = self.asList().copy();
            copy.add(itp.applyInsertRules(copy.rules(), a.get(0)));
            return Value.list(copy);
        });
        register(L, "prepend", (itp, self, a) -> {
            expectArgs("prepend", a, 1, 1);
            ListValue copy = self.asList().copy();
            copy.add(0, itp.applyInsertRules(copy.rules(), a.get(0)));
            return Value.list(copy);
        });
        register(L, "insert", (itp, self, a) -> {
            expectArgs("insert", a, 2, 2);
            ListValue copy = self.asList().copy();
            int i = a.get(0).asInt();
            if (i < 0 || i > copy.size()) {
                throw GraphoidException.runtime("Index " + i + " out of bounds for list of length " + copy.size());
            }
            copy.add(i, itp.applyInsertRules(copy.rules(), a.get(1)));
            return Value.list(copy);
        });
        register(L, "remove", (itp, self, a) -> {
            expectArgs("remove", a, 1, 1);
            ListValue copy = self.asList().copy();
            int i = indexOf(copy, a.get(0));
            if (i >= 0) copy.removeAt(i);
            return Value.list(copy);
        });
        register(L, "remove_at_index", (itp, self, a) -> {
            expectArgs("remove_at_index", a, 1, 1);
            ListValue copy = self.asList().copy();
            copy.removeAt(checkedIndex(a.get(0).asInt(), copy.size()));
            return Value.list(copy);
        });
        register(L, "pop", (itp, self, a) -> {
            expectArgs("pop", a, 0, 0);
            ListValue l = self.asList();
            if (l.size() == 0) throw GraphoidException.runtime("Cannot pop from empty list");
            return l.get(l.size() - 1);
        });
        register(L, "clear", (itp, self, a) -> {
            ListValue copy = self.asList().copy();
            copy.clear();
            return Value.list(copy);
        });

        registerMutator(L, "add_rule", (itp, self, a) -> {
            ListValue l = self.asList();
            RuleInstance rule = ruleFromArguments(a, "add_rule");
            if (containsRule(l.rules(), rule)) return Value.none();
            List<RuleInstance> single = Collections.singletonList(rule);
            for (int i = 0; i < l.size(); i++) l.set(i, itp.applyInsertRules(single, l.get(i)));
            l.rules().add(rule);
            return Value.none();
        });
        registerMutator(L, "remove_rule", (itp, self, a) -> {
            expectArgs("remove_rule", a, 1, 1);
            return Value.bool(removeRule(self.asList().rules(), ruleName(a.get(0))));
        });
        register(L, "has_rule", (itp, self, a) -> {
            expectArgs("has_rule", a, 1, 1);
            return Value.bool(hasRule(self.asList().rules(), ruleName(a.get(0))));
        });
    }

    /** {@code pop!}: removes the last element in place and returns it. */
    static Value popInPlace(ListValue list) {
        if (list.size() == 0) throw GraphoidException.runtime("Cannot pop from empty list");
        return list.removeAt(list.size() - 1);
    }

    // -------------------------
    // map
    // -------------------------

    private static void registerMaps() {
        final Value.Type M = Value.Type.MAP;

        register(M, "keys", (itp, self, a) -> {
            List<Value> out = new ArrayList<>();
            for (String k : self.asMap().entries().keySet()) out.add(Value.string(k));
            return Value.list(out);
        });
        register(M, "values", (itp, self, a) -> Value.list(new ArrayList<>(self.asMap().entries().values())));
        BuiltinMethods.NativeMethod size = (itp, self, a) -> Value.number(self.asMap().size());
        register(M, "size", size);
        register(M, "length", size);
        register(M, "has_key", (itp, self, a) -> {
            expectArgs("has_key", a, 1, 1);
            return Value.bool(self.asMap().containsKey(key(a.get(0))));
        });
        register(M, "get", (itp, self, a) -> {
            expectArgs("get", a, 1, 2);
            Value v = self.asMap().get(key(a.get(0)));
            if (v != null) return v;
            return (a.size() > 1) ? a.get(1) : Value.none();
        });
        register(M, "set", (itp, self, a) -> {
            expectArgs("set", a, 2, 2);
            MapValue copy = self.asMap().copy();
            copy.put(key(a.get(0)), itp.applyInsertRules(copy.rules(), a.get(1)));
            return Value.map(copy);
        });
        register(M, "remove", (itp, self, a) -> {
            expectArgs("remove", a, 1, 1);
            MapValue copy = self.asMap().copy();
            copy.remove(key(a.get(0)));
            return Value.map(copy);
        });
        register(M, "is_empty", (itp, self, a) -> Value.bool(self.asMap().size() == 0));
        register(M, "merge", (itp, self, a) -> {
            expectArgs("merge", a, 1, 1);
            MapValue copy = self.asMap().copy();
            for (Map.Entry<String, Value> e : a.get(0).asMap().entries().entrySet()) {
                copy.put(e.getKey(), itp.applyInsertRules(copy.rules(), e.getValue()));
            }
            return Value.map(copy);
        });

        registerMutator(M, "add_rule", (itp, self, a) -> {
            MapValue m = self.asMap();
            RuleInstance rule = ruleFromArguments(a, "add_rule");
            if (containsRule(m.rules(), rule)) return Value.none();
            List<RuleInstance> single = Collections.singletonList(rule);
            LinkedHashMap<String, Value> snapshot = new LinkedHashMap<>(m.entries());
            for (Map.Entry<String, Value> e : snapshot.entrySet()) m.put(e.getKey(), itp.applyInsertRules(single, e.getValue()));
            m.rules().add(rule);
            return Value.none();
        });
        registerMutator(M, "remove_rule", (itp, self, a) -> {
            expectArgs("remove_rule", a, 1, 1);
            return Value.bool(removeRule(self.asMap().rules(), ruleName(a.get(0))));
        });
        register(M, "has_rule", (itp, self, a) -> {
            expectArgs("has_rule", a, 1, 1);
            return Value.bool(hasRule(self.asMap().rules(), ruleName(a.get(0))));
        });
    }

    // -------------------------
    // Rules
    // -------------------------

    /**
     * {@code add_rule(:name[, param | :severity])}, {@code add_rule(fn)} for a custom transform, or
     * {@code add_rule(predicate, transform[, fallback])} for a conditional one.
     */
    static RuleInstance ruleFromArguments(List<Value> a, String method) {
        expectArgs(method, a, 1, 3);
        Value first = a.get(0);
        if (first.isCallable()) {
            if (a.size() == 1) return new RuleInstance(RuleSpec.customFunction(first));
            Value transform = requireCallable(a.get(1), method);
            Value fallback = (a.size() > 2) ? requireCallable(a.get(2), method) : null;
            return new RuleInstance(RuleSpec.conditional(first, transform, fallback));
        }
        if (first.type != Value.Type.SYMBOL) {
            throw GraphoidException.type("Method '" + method + "' expects a rule symbol or function, got " + first.typeName());
        }
        Value param = null;
        RuleSeverity severity = RuleSeverity.ERROR;
        for (int i = 1; i < a.size(); i++) {
            Value v = a.get(i);
            RuleSeverity s = (v.type == Value.Type.SYMBOL) ? RuleSeverity.fromSymbol(v.asSymbol()) : null;
            if (s != null) severity = s;
            else param = v;
        }
        return new RuleInstance(RuleSymbols.fromSymbol(first.asSymbol(), param), severity);
    }

    static String ruleName(Value v) {
        if (v.type == Value.Type.SYMBOL) {
            return "no_dups".equals(v.asSymbol()) ? RuleSpec.Kind.NO_DUPLICATES.symbol : v.asSymbol();
        }
        if (v.type == Value.Type.STRING) return v.asString();
        throw GraphoidException.type("Expected rule symbol, got " + v.typeName());
    }

    private static boolean containsRule(List<RuleInstance> rules, RuleInstance rule) {
        for (RuleInstance r : rules) if (r.spec.sameRule(rule.spec) && r.spec.function == rule.spec.function) return true;
        return false;
    }

    private static boolean hasRule(List<RuleInstance> rules, String name) {
        for (RuleInstance r : rules) if (r.spec.name().equals(name)) return true;
        return false;
    }

    private static boolean removeRule(List<RuleInstance> rules, String name) {
        return rules.removeIf(r -> r.spec.name().equals(name));
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static int indexOf(ListValue l, Value needle) {
        for (int i = 0; i < l.size(); i++) if (l.get(i).valueEquals(needle)) return i;
        return -1;
    }

    static int checkedIndex(int index, int size) {
        int i = (index < 0) ? size + index : index;
        if (i < 0 || i >= size) {
            throw GraphoidException.runtime("Index " + index + " out of bounds for list of length " + size);
        }
        return i;
    }

    /** Items of an aggregate; with {@code skip_none} active, none entries are dropped first. */
    private static List<Value> numericItems(Interpreter itp, ListValue list, String method) {
        boolean skip = itp.config().skipNone;
        List<Value> out = new ArrayList<>();
        for (Value v : list.items()) {
            if (v.isNone()) {
                if (skip) continue;
                throw GraphoidException.type("Method '" + method + "' cannot use none values (configure skip_none to ignore them)");
            }
            out.add(v);
        }
        return out;
    }

    private static Value extreme(Interpreter itp, ListValue list, String method, int sign) {
        List<Value> items = numericItems(itp, list, method);
        if (items.isEmpty()) throw GraphoidException.runtime("Cannot get " + method + " of empty list");
        Value best = items.get(0);
        for (Value v : items) {
            if (Integer.signum(Operators.compare(v, best, method)) == sign) best = v;
        }
        return best;
    }

    private static Value requireCallable(Value v, String method) {
        if (!v.isCallable()) throw GraphoidException.type("Method '" + method + "' expects a function, got " + v.typeName());
        return v;
    }

    private static Value call(Interpreter itp, Value fn, String method, Value arg) {
        return itp.callValue(requireCallable(fn, method), Collections.singletonList(arg));
    }

    private static List<Value> select(Interpreter itp, ListValue list, Value fn, String method, boolean keep) {
        List<Value> out = new ArrayList<>();
        for (Value v : list.items()) {
            boolean hit = (fn.type == Value.Type.SYMBOL) ? namedPredicate(v, fn.asSymbol()) : call(itp, fn, method, v).isTruthy();
            if (hit == keep) out.add(v);
        }
        return out;
    }

    /** A comparator function returns a number (negative: first before second) or a boolean "less than". */
    private static int comparatorResult(Interpreter itp, Value fn, Value x, Value y) {
        Value r = itp.callValue(fn, Arrays.asList(x, y));
        if (r.isNumeric()) return Operators.compareNumbers(r.asNumber(), 0);
        if (r.isTruthy()) return -1;
        return itp.callValue(fn, Arrays.asList(y, x)).isTruthy() ? 1 : 0;
    }

    static Value namedTransformation(Value v, String name) {
        requireNumber(v, "Transformation", name);
        switch (name) {
            case "double": return Operators.binary(TokenType.STAR, v, Value.number(2));
            case "square": return Operators.binary(TokenType.STAR, v, v);
            case "negate": return Operators.negate(v);
            case "increment":
            case "inc":
                return Operators.binary(TokenType.PLUS, v, Value.number(1));
            case "decrement":
            case "dec":
                return Operators.binary(TokenType.MINUS, v, Value.number(1));
            default:
                throw GraphoidException.runtime("Unknown named transformation: '" + name + "'");
        }
    }

    static boolean namedPredicate(Value v, String name) {
        requireNumber(v, "Predicate", name);
        double d = v.asNumber();
        switch (name) {
            case "even": return Math.abs(d % 2.0) < 0.0001;
            case "odd": return Math.abs(d % 2.0) > 0.0001;
            case "positive":
            case "pos":
                return d > 0;
            case "negative":
            case "neg":
                return d < 0;
            case "zero": return Math.abs(d) < 0.0001;
            default:
                throw GraphoidException.runtime("Unknown named predicate: '" + name + "'");
        }
    }

    private static void requireNumber(Value v, String what, String name) {
        if (!v.isNumeric()) {
            throw GraphoidException.runtime(what + " '" + name + "' requires a number, got " + v.typeName());
        }
    }
}
