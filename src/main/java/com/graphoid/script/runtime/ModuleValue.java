package com.graphoid.script.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.graphoid.script.errors.GraphoidException;

/** Evaluated module: its exported top-level bindings. Private names are remembered for diagnostics. */
public final class ModuleValue {
    public final String name;
    public final String alias;
    public final String path;
    private final Map<String, Value> exports;
    private final Set<String> privateNames;

    public ModuleValue(String name, String alias, String path, Map<String, Value> exports, Set<String> privateNames) {
        this.name = name;
        this.alias = alias;
        this.path = path;
        this.exports = new LinkedHashMap<>(exports);
        this.privateNames = Collections.unmodifiableSet(privateNames);
    }

    public Map<String, Value> getExports() {
        return Collections.unmodifiableMap(exports);
    }

    public boolean has(String member) {
        return exports.containsKey(member);
    }

    public Value member(String member) {
        Value v = exports.get(member);
        if (v != null) return v;
        if (privateNames.contains(member)) {
            throw GraphoidException.runtime("Cannot access private symbol '" + member + "' in module '" + name + "'");
        }
        throw GraphoidException.runtime("Module '" + name + "' has no member '" + member + "'");
    }

    /** Binding name for importers: declared alias, else declared name. */
    public String bindingName() {
        return (alias != null) ? alias : name;
    }
}
