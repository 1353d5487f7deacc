package com.graphoid.script.runtime;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.graphoid.script.errors.ErrorObject;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.graph.Graph;
import com.graphoid.script.graph.GraphQuery;

public class Value {
    public enum Type {
        NUMBER, BIGNUM, STRING, BOOL, NONE, SYMBOL, LIST, MAP, GRAPH, FUNCTION, NATIVE_FUNCTION,
        MODULE, ERROR, PATTERN_NODE, PATTERN_EDGE, PATTERN_PATH
    }

    private static final Value NONE = new Value(Type.NONE, null, false);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE, false);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE, false);

    public final Type type;
    public final Object value;
    // Frozen flag for scalar kinds; collections and graphs carry their own.
    private final boolean frozen;

    private Value(Type type, Object value, boolean frozen) {
        this.type = type;
        this.value = value;
        this.frozen = frozen;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d, false); }
    public static Value bignum(BigNumber b) { return new Value(Type.BIGNUM, b, false); }
    public static Value string(String s) { return new Value(Type.STRING, s, false); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value none() { return NONE; }
    public static Value symbol(String name) { return new Value(Type.SYMBOL, name, false); }
    public static Value list(ListValue l) { return new Value(Type.LIST, l, false); }
    public static Value list(List<Value> items) { return list(new ListValue(items)); }
    public static Value map(MapValue m) { return new Value(Type.MAP, m, false); }
    public static Value graph(Graph g) { return new Value(Type.GRAPH, g, false); }
    public static Value function(GraphFunction f) { return new Value(Type.FUNCTION, f, false); }
    public static Value nativeFunction(String name, BuiltinFunction fn) {
        return new Value(Type.NATIVE_FUNCTION, new NativeFunction(name, fn), false);
    }
    public static Value module(ModuleValue m) { return new Value(Type.MODULE, m, false); }
    public static Value error(ErrorObject e) { return new Value(Type.ERROR, e, false); }
    public static Value nodePattern(GraphQuery.NodePattern p) { return new Value(Type.PATTERN_NODE, p, false); }
    public static Value edgePattern(GraphQuery.EdgePattern p) { return new Value(Type.PATTERN_EDGE, p, false); }
    public static Value pathPattern(GraphQuery.PathPattern p) { return new Value(Type.PATTERN_PATH, p, false); }

    /** Host function bound to a name. */
    public static final class NativeFunction {
        public final String name;
        public final BuiltinFunction fn;

        public NativeFunction(String name, BuiltinFunction fn) {
            this.name = name;
            this.fn = fn;
        }
    }

    public Type getType() { return type; }

    public boolean isNone() { return type == Type.NONE; }
    public boolean isNumeric() { return type == Type.NUMBER || type == Type.BIGNUM; }
    public boolean isCallable() { return type == Type.FUNCTION || type == Type.NATIVE_FUNCTION; }

    /** Numeric value as a double; big numbers are narrowed. */
    public double asNumber() {
        if (type == Type.NUMBER) return (double) value;
        if (type == Type.BIGNUM) return ((BigNumber) value).toDouble();
        throw mismatch("num");
    }

    public BigNumber asBigNumber() {
        if (type == Type.BIGNUM) return (BigNumber) value;
        if (type == Type.NUMBER) return BigNumber.fromDouble((double) value);
        throw mismatch("bignum");
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw mismatch("bool");
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw mismatch("string");
        return (String) value;
    }

    public String asSymbol() {
        if (type != Type.SYMBOL) throw mismatch("symbol");
        return (String) value;
    }

    public ListValue asList() {
        if (type != Type.LIST) throw mismatch("list");
        return (ListValue) value;
    }

    public MapValue asMap() {
        if (type != Type.MAP) throw mismatch("map");
        return (MapValue) value;
    }

    public Graph asGraph() {
        if (type != Type.GRAPH) throw mismatch("graph");
        return (Graph) value;
    }

    public GraphFunction asFunction() {
        if (type != Type.FUNCTION) throw mismatch("function");
        return (GraphFunction) value;
    }

    public NativeFunction asNativeFunction() {
        if (type != Type.NATIVE_FUNCTION) throw mismatch("function");
        return (NativeFunction) value;
    }

    public ModuleValue asModule() {
        if (type != Type.MODULE) throw mismatch("module");
        return (ModuleValue) value;
    }

    public ErrorObject asError() {
        if (type != Type.ERROR) throw mismatch("error");
        return (ErrorObject) value;
    }

    /** Integral index or count; rejects fractional numbers. */
    public int asInt() {
        double d = asNumber();
        if (d != Math.floor(d) || Double.isInfinite(d)) {
            throw GraphoidException.type("Expected integer, got " + toDisplayString());
        }
        return (int) d;
    }

    private GraphoidException mismatch(String expected) {
        return GraphoidException.type("Expected " + expected + ", got " + typeName());
    }

    public String typeName() {
        switch (type) {
            case NUMBER: return "num";
            case BIGNUM: return "bignum";
            case STRING: return "string";
            case BOOL: return "bool";
            case NONE: return "none";
            case SYMBOL: return "symbol";
            case LIST: return "list";
            case MAP: return "map";
            case GRAPH: return "graph";
            case FUNCTION:
            case NATIVE_FUNCTION: return "function";
            case MODULE: return "module";
            case ERROR: return "error";
            case PATTERN_NODE: return "node_pattern";
            case PATTERN_EDGE: return "edge_pattern";
            case PATTERN_PATH: return "path_pattern";
            default: throw new IllegalStateException("Unhandled value type " + type);
        }
    }

    public boolean isTruthy() {
        switch (type) {
            case NONE: return false;
            case BOOL: return (boolean) value;
            case NUMBER: return (double) value != 0.0;
            case BIGNUM: return !((BigNumber) value).isZero();
            case STRING: return !((String) value).isEmpty();
            case LIST: return ((ListValue) value).size() > 0;
            case MAP: return ((MapValue) value).size() > 0;
            case GRAPH: return ((Graph) value).nodeCount() > 0;
            default: return true;
        }
    }

    // -------------------------
    // Copy / freeze
    // -------------------------

    /**
     * Central point: how collection values travel between variables. Lists, maps and graphs are
     * copied so that a read never aliases the stored value; everything else is shared.
     */
    public Value deepCopy() {
        switch (type) {
            case LIST: return list(((ListValue) value).copy());
            case MAP: return map(((MapValue) value).copy());
            case GRAPH: return graph(((Graph) value).copy());
            default: return this;
        }
    }

    public boolean isFrozen() {
        switch (type) {
            case LIST: return ((ListValue) value).isFrozen();
            case MAP: return ((MapValue) value).isFrozen();
            case GRAPH: return ((Graph) value).isFrozen();
            default: return frozen;
        }
    }

    /** Frozen copy; nested collections are frozen too unless {@code deep} is false. */
    public Value freeze(boolean deep) {
        switch (type) {
            case LIST: {
                ListValue copy = ((ListValue) value).copy();
                copy.freeze(deep);
                return list(copy);
            }
            case MAP: {
                MapValue copy = ((MapValue) value).copy();
                copy.freeze(deep);
                return map(copy);
            }
            case GRAPH: {
                Graph copy = ((Graph) value).copy();
                copy.freeze(deep);
                return graph(copy);
            }
            case NONE:
            case BOOL:
                return this;
            default:
                return new Value(type, value, true);
        }
    }

    /** Unfrozen deep copy. */
    public Value thaw() {
        switch (type) {
            case LIST: {
                ListValue copy = ((ListValue) value).copy();
                copy.thaw();
                return list(copy);
            }
            case MAP: {
                MapValue copy = ((MapValue) value).copy();
                copy.thaw();
                return map(copy);
            }
            case GRAPH: {
                Graph copy = ((Graph) value).copy();
                copy.thaw();
                return graph(copy);
            }
            default:
                return frozen ? new Value(type, value, false) : this;
        }
    }

    // -------------------------
    // Display
    // -------------------------

    /** Form used by print and string concatenation. */
    public String toDisplayString() {
        switch (type) {
            case STRING: return (String) value;
            default: return toString();
        }
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) return Long.toString((long) d);
        return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER: return formatNumber((double) value);
            case BIGNUM: return value.toString();
            case STRING: return '"' + (String) value + '"';
            case BOOL: return Boolean.toString((boolean) value);
            case NONE: return "none";
            case SYMBOL: return ":" + value;
            case LIST: {
                StringBuilder sb = new StringBuilder("[");
                Iterator<Value> it = ((ListValue) value).items().iterator();
                while (it.hasNext()) {
                    sb.append(it.next());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append(']').toString();
            }
            case MAP: {
                StringBuilder sb = new StringBuilder("{");
                Iterator<Map.Entry<String, Value>> it = ((MapValue) value).entries().entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Value> e = it.next();
                    sb.append('"').append(e.getKey()).append("\": ").append(e.getValue());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append('}').toString();
            }
            case GRAPH: {
                Graph g = (Graph) value;
                return "<graph: " + g.nodeCount() + " nodes, " + g.edgeCount() + " edges>";
            }
            case FUNCTION: {
                String name = ((GraphFunction) value).name;
                return (name == null) ? "<lambda>" : "<function " + name + ">";
            }
            case NATIVE_FUNCTION: return "<native function " + ((NativeFunction) value).name + ">";
            case MODULE: return "<module " + ((ModuleValue) value).name + ">";
            case ERROR: {
                ErrorObject e = (ErrorObject) value;
                return "<error " + e.type + ": " + e.message + ">";
            }
            case PATTERN_NODE:
            case PATTERN_EDGE:
            case PATTERN_PATH:
                return value.toString();
            default:
                throw new IllegalStateException("Unhandled value type " + type);
        }
    }

    // -------------------------
    // Equality
    // -------------------------

    /** Structural equality used by {@code ==}; numbers compare across num/bignum. */
    public boolean valueEquals(Value other) {
        if (other == null) return false;
        if (isNumeric() && other.isNumeric()) {
            if (type == Type.NUMBER && other.type == Type.NUMBER) return (double) value == (double) other.value;
            return asBigNumber().compareTo(other.asBigNumber()) == 0;
        }
        if (type != other.type) return false;
        switch (type) {
            case NONE: return true;
            case BOOL:
            case STRING:
            case SYMBOL:
                return value.equals(other.value);
            case LIST: {
                List<Value> a = ((ListValue) value).items();
                List<Value> b = ((ListValue) other.value).items();
                if (a.size() != b.size()) return false;
                for (int i = 0; i < a.size(); i++) {
                    if (!a.get(i).valueEquals(b.get(i))) return false;
                }
                return true;
            }
            case MAP: {
                Map<String, Value> a = ((MapValue) value).entries();
                Map<String, Value> b = ((MapValue) other.value).entries();
                if (!a.keySet().equals(b.keySet())) return false;
                for (Map.Entry<String, Value> e : a.entrySet()) {
                    if (!e.getValue().valueEquals(b.get(e.getKey()))) return false;
                }
                return true;
            }
            case GRAPH:
                return ((Graph) value).structurallyEquals((Graph) other.value);
            case ERROR: {
                ErrorObject a = (ErrorObject) value;
                ErrorObject b = (ErrorObject) other.value;
                return a.type.equals(b.type) && a.message.equals(b.message);
            }
            default:
                return value == other.value;
        }
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Value) && valueEquals((Value) o);
    }

    @Override
    public int hashCode() {
        if (isNumeric()) return Double.hashCode(asNumber());
        if (type == Type.STRING || type == Type.SYMBOL || type == Type.BOOL) return Objects.hash(type, value);
        return type.hashCode();
    }

    static List<Value> copyAll(List<Value> items) {
        List<Value> out = new ArrayList<>(items.size());
        for (Value v : items) out.add(v.deepCopy());
        return out;
    }
}
