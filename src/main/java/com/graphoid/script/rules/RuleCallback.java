package com.graphoid.script.rules;

import java.util.List;

import com.graphoid.script.runtime.Value;

/** Calls back into the interpreter for rules built from user functions. */
@FunctionalInterface
public interface RuleCallback {
    Value invoke(Value function, List<Value> args);
}
