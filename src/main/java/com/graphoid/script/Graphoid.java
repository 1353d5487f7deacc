package com.graphoid.script;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphoid.debug.Debug;
import com.graphoid.script.config.ConfigJson;
import com.graphoid.script.errors.ErrorObject;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.BuiltinFunction;
import com.graphoid.script.runtime.Interpreter;
import com.graphoid.script.runtime.RuntimeContext;
import com.graphoid.script.runtime.Value;
import com.graphoid.script.runtime.ValueJson;

/**
 * Core Graphoid engine.
 *
 * - Graph-first scripting: graphs, lists and maps are values with copy semantics
 * - Graph types with properties, methods, inheritance and rules
 * - Pattern-matching functions and match expressions
 * - Scoped runtime configuration (error modes, numeric precision)
 * - Modules: import / load, plus native modules registered by the host
 *
 * One engine keeps its global scope across {@link #executeSource} calls. Errors escaping a program
 * are logged and rethrown to the host as {@link GraphoidException}.
 */
public class Graphoid {
    private static final String TAG = "Graphoid";

    private final RuntimeContext context;
    private final Interpreter interpreter;

    public Graphoid() {
        this(System.out);
    }

    public Graphoid(PrintStream out) {
        this.context = new RuntimeContext(out);
        this.interpreter = new Interpreter(context, null);
    }

    // ===================== EXECUTION =====================

    /** Runs a program; returns the value of its last expression statement. */
    public Value executeSource(String source) {
        try {
            return interpreter.executeSource(source);
        } catch (GraphoidException e) {
            Debug.get().e(TAG, "script failed: " + e.getMessage(), e);
            throw e;
        }
    }

    /** Runs a file; its imports resolve relative to its directory. */
    public Value executeFile(Path file) {
        try {
            return interpreter.executeFile(file.toAbsolutePath().normalize());
        } catch (GraphoidException e) {
            Debug.get().e(TAG, "script " + file + " failed: " + e.getMessage(), e);
            throw e;
        }
    }

    // ===================== VARIABLES =====================

    /** Copy of a global binding, or null when undefined. */
    public Value getVariable(String name) {
        Value v = interpreter.getGlobals().lookup(name);
        return (v == null) ? null : v.deepCopy();
    }

    public void setVariable(String name, Value value) {
        interpreter.getGlobals().define(name, value);
    }

    /** Copies of every global binding, in definition order. */
    public Map<String, Value> snapshot() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : interpreter.getGlobals().getLocalBindings().entrySet()) {
            out.put(e.getKey(), e.getValue().deepCopy());
        }
        return Collections.unmodifiableMap(out);
    }

    /** Global data bindings as a JSON object; functions and modules are left out. */
    public ObjectNode snapshotJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, Value> e : interpreter.getGlobals().getLocalBindings().entrySet()) {
            Value v = e.getValue();
            if (v.isCallable() || v.type == Value.Type.MODULE) continue;
            root.set(e.getKey(), ValueJson.toJson(v));
        }
        return root;
    }

    // ===================== OUTPUT =====================

    public void setOutput(PrintStream out) {
        context.output().setStream(out);
    }

    public void enableOutputCapture() {
        context.output().beginCapture();
    }

    /** Stops capturing and returns what was captured. */
    public String disableOutputCapture() {
        return context.output().endCapture();
    }

    /** Output captured so far, without stopping the capture. */
    public String getCapturedOutput() {
        return context.output().peekCapture();
    }

    // ===================== HOST EXTENSIONS =====================

    public void registerFunction(String name, BuiltinFunction fn) {
        context.registerFunction(name, fn);
    }

    /** Native module importable by name: {@code import "name"}. */
    public void registerModule(String name, Map<String, BuiltinFunction> functions) {
        Map<String, Value> members = new LinkedHashMap<>();
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            members.put(e.getKey(), Value.nativeFunction(e.getKey(), e.getValue()));
        }
        context.modules().registerNative(name, members);
    }

    public void addModuleSearchPath(Path dir) {
        context.modules().addSearchPath(dir);
    }

    // ===================== CONFIGURATION =====================

    /** Replaces the base configuration frame with settings read from JSON. */
    public void applyConfigJson(String json) {
        context.configStack().replaceBase(ConfigJson.read(json, context.configStack().current()));
    }

    /** 0 (the default) leaves recursion bounded only by the host stack. */
    public void setMaxCallDepth(int depth) {
        context.setMaxCallDepth(depth);
    }

    // ===================== DIAGNOSTICS =====================

    /** Errors collected while {@code error_mode} was {@code :collect}. */
    public List<ErrorObject> getErrors() {
        return context.errors().getErrors();
    }

    public RuntimeContext getContext() {
        return context;
    }
}
