package com.graphoid.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.rules.RuleInstance;

/** Ordered, mutable list payload with its attached rules. */
public final class ListValue {
    private final List<Value> items;
    private final List<RuleInstance> rules;
    private boolean frozen;

    public ListValue() {
        this(new ArrayList<>());
    }

    public ListValue(List<Value> items) {
        this.items = items;
        this.rules = new ArrayList<>();
    }

    private ListValue(List<Value> items, List<RuleInstance> rules, boolean frozen) {
        this.items = items;
        this.rules = rules;
        this.frozen = frozen;
    }

    public List<Value> items() {
        return Collections.unmodifiableList(items);
    }

    public int size() {
        return items.size();
    }

    public Value get(int index) {
        return items.get(index);
    }

    public void add(Value v) {
        checkMutable();
        items.add(v);
    }

    public void add(int index, Value v) {
        checkMutable();
        items.add(index, v);
    }

    public void set(int index, Value v) {
        checkMutable();
        items.set(index, v);
    }

    public Value removeAt(int index) {
        checkMutable();
        return items.remove(index);
    }

    public void clear() {
        checkMutable();
        items.clear();
    }

    public List<RuleInstance> rules() {
        return rules;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public void checkMutable() {
        if (frozen) throw GraphoidException.runtime("Cannot modify frozen list");
    }

    void freeze(boolean deep) {
        frozen = true;
        if (deep) {
            for (int i = 0; i < items.size(); i++) items.set(i, items.get(i).freeze(true));
        }
    }

    void thaw() {
        frozen = false;
        for (int i = 0; i < items.size(); i++) items.set(i, items.get(i).thaw());
    }

    /** Deep copy keeping rules and frozen state. */
    public ListValue copy() {
        return new ListValue(Value.copyAll(items), new ArrayList<>(rules), frozen);
    }

    /** New unfrozen list with the same rules, holding the given items. */
    public ListValue derive(List<Value> newItems) {
        return new ListValue(newItems, new ArrayList<>(rules), false);
    }
}
