package com.graphoid.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.GraphoidException;

/**
 * One lexical scope. Scopes are shared by reference between the code that created them and every
 * closure capturing them, so a mutation on either side is visible on the other.
 */
public class Environment {
    private final Map<String, Value> values = new LinkedHashMap<>();
    // Named functions declared in this scope, grouped by name for arity/guard overloading.
    private final Map<String, List<GraphFunction>> overloads = new LinkedHashMap<>();
    private Environment parent;

    public Environment() {
        this.parent = null;
    }

    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment getParent() {
        return parent;
    }

    /** Inserts or overwrites in this scope. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name) {
        Value v = lookup(name);
        if (v == null) throw GraphoidException.runtime("Undefined variable: " + name);
        return v;
    }

    /** Like {@link #get} but returns null when undefined. */
    public Value lookup(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            Value v = env.values.get(name);
            if (v != null) return v;
        }
        return null;
    }

    /** Mutates the nearest scope already defining {@code name}. */
    public void set(String name, Value value) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) {
                env.values.put(name, value);
                return;
            }
        }
        throw GraphoidException.runtime("Undefined variable: " + name);
    }

    public boolean exists(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsLocally(String name) {
        return values.containsKey(name);
    }

    public Value removeVariable(String name) {
        return values.remove(name);
    }

    /**
     * Detaches and returns the parent scope. Used when a short-lived child scope (catch block,
     * guard evaluation) ends: its own bindings are dropped, while writes it made through
     * {@link #set} already landed in the shared parent.
     */
    public Environment takeParent() {
        Environment p = parent;
        parent = null;
        return p;
    }

    /**
     * Registers a named function variant and binds the name to it. A variant with the same arity and
     * no guard replaces the earlier one.
     */
    public void defineFunction(GraphFunction fn) {
        List<GraphFunction> variants = overloads.computeIfAbsent(fn.name, k -> new ArrayList<>());
        if (fn.guard == null) {
            variants.removeIf(v -> v.guard == null && v.arity() == fn.arity() && v.isVariadic() == fn.isVariadic());
        }
        variants.add(fn);
        values.put(fn.name, Value.function(fn));
    }

    /**
     * Overload variants visible under {@code name}, or null. The nearest scope binding the name decides:
     * a plain variable there shadows any overload table further out.
     */
    public List<GraphFunction> lookupOverloads(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            List<GraphFunction> variants = env.overloads.get(name);
            if (variants != null) {
                Value bound = env.values.get(name);
                if (bound != null && bound.type == Value.Type.FUNCTION && variants.contains(bound.asFunction())) {
                    return Collections.unmodifiableList(variants);
                }
                return null;
            }
            if (env.values.containsKey(name)) return null;
        }
        return null;
    }

    /** Bindings of this scope only. */
    public Map<String, Value> getLocalBindings() {
        return Collections.unmodifiableMap(values);
    }

    /** Every visible binding, inner scopes shadowing outer ones. */
    public Map<String, Value> getAllBindings() {
        Map<String, Value> out = parent == null ? new LinkedHashMap<>() : parent.getAllBindings();
        out.putAll(values);
        return out;
    }
}
