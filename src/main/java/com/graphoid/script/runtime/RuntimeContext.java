package com.graphoid.script.runtime;

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.graphoid.script.config.ConfigStack;
import com.graphoid.script.config.RuntimeConfig;
import com.graphoid.script.errors.ErrorCollector;

/**
 * State shared by the top-level interpreter and every module or {@code exec} interpreter it spawns:
 * configuration, collected errors, the call graph, the module cache and the output channel.
 */
public final class RuntimeContext {
    private final ConfigStack config = new ConfigStack();
    private final ErrorCollector errors = new ErrorCollector();
    private final FunctionGraph calls = new FunctionGraph();
    private final ModuleManager modules = new ModuleManager();
    private final OutputChannel output;
    private final Map<String, Value> hostFunctions = new LinkedHashMap<>();
    private int maxCallDepth = 0;

    public RuntimeContext(PrintStream out) {
        this.output = new OutputChannel(out);
        modules.registerNative("math", MathModule.members());
    }

    public ConfigStack configStack() { return config; }
    public RuntimeConfig config() { return config.current(); }
    public ErrorCollector errors() { return errors; }
    public FunctionGraph calls() { return calls; }
    public ModuleManager modules() { return modules; }
    public OutputChannel output() { return output; }

    /** Host functions visible to every interpreter, including module interpreters. */
    public void registerFunction(String name, BuiltinFunction fn) {
        hostFunctions.put(name, Value.nativeFunction(name, fn));
    }

    public Map<String, Value> hostFunctions() {
        return Collections.unmodifiableMap(hostFunctions);
    }

    /** 0 leaves recursion bounded only by the host stack. */
    public int getMaxCallDepth() { return maxCallDepth; }

    public void setMaxCallDepth(int maxCallDepth) {
        if (maxCallDepth < 0) throw new IllegalArgumentException("maxCallDepth must be >= 0");
        this.maxCallDepth = maxCallDepth;
    }
}
