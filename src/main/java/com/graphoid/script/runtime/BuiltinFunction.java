package com.graphoid.script.runtime;

import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.GraphoidException;

/** Host function callable from scripts. */
@FunctionalInterface
public interface BuiltinFunction {
    Value call(List<Value> args);

    /** Named-argument entry point; plain builtins reject named arguments. */
    default Value call(List<Value> args, Map<String, Value> named) {
        if (named != null && !named.isEmpty()) {
            throw GraphoidException.runtime("Named arguments are not supported by this function: " + named.keySet());
        }
        return call(args);
    }
}
