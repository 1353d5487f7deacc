package com.graphoid.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.rules.RuleInstance;

/** String-keyed map payload, insertion ordered. */
public final class MapValue {
    private final LinkedHashMap<String, Value> entries;
    private final List<RuleInstance> rules;
    private boolean frozen;

    public MapValue() {
        this(new LinkedHashMap<>());
    }

    public MapValue(LinkedHashMap<String, Value> entries) {
        this.entries = entries;
        this.rules = new ArrayList<>();
    }

    private MapValue(LinkedHashMap<String, Value> entries, List<RuleInstance> rules, boolean frozen) {
        this.entries = entries;
        this.rules = rules;
        this.frozen = frozen;
    }

    public Map<String, Value> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public Value get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public void put(String key, Value v) {
        checkMutable();
        entries.put(key, v);
    }

    public Value remove(String key) {
        checkMutable();
        return entries.remove(key);
    }

    public List<RuleInstance> rules() {
        return rules;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public void checkMutable() {
        if (frozen) throw GraphoidException.runtime("Cannot modify frozen map");
    }

    void freeze(boolean deep) {
        frozen = true;
        if (deep) entries.replaceAll((k, v) -> v.freeze(true));
    }

    void thaw() {
        frozen = false;
        entries.replaceAll((k, v) -> v.thaw());
    }

    public MapValue copy() {
        LinkedHashMap<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : entries.entrySet()) out.put(e.getKey(), e.getValue().deepCopy());
        return new MapValue(out, new ArrayList<>(rules), frozen);
    }

    public MapValue derive(LinkedHashMap<String, Value> newEntries) {
        return new MapValue(newEntries, new ArrayList<>(rules), false);
    }
}
