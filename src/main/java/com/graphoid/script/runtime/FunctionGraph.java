package com.graphoid.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Call graph of a run: the live stack of call frames plus caller-to-callee edges with call counts.
 * Every push is paired with a pop, including on error paths.
 */
public final class FunctionGraph {
    public static final String TOP_LEVEL = "<main>";

    private final Deque<CallFrame> stack = new ArrayDeque<>();
    private final Map<String, Map<String, Integer>> calls = new LinkedHashMap<>();

    public void push(String function, List<Value> args) {
        String caller = stack.isEmpty() ? TOP_LEVEL : stack.peek().functionName;
        calls.computeIfAbsent(caller, k -> new LinkedHashMap<>()).merge(function, 1, Integer::sum);
        stack.push(new CallFrame(function, args));
    }

    public void pop() {
        if (stack.isEmpty()) throw new IllegalStateException("Internal error: call stack underflow");
        stack.pop();
    }

    public int depth() {
        return stack.size();
    }

    public CallFrame current() {
        return stack.peek();
    }

    /** Innermost frame first. */
    public List<String> stackTrace() {
        List<String> out = new ArrayList<>();
        for (CallFrame f : stack) out.add("at " + f);
        return out;
    }

    public int callCount(String caller, String callee) {
        Map<String, Integer> out = calls.get(caller);
        if (out == null) return 0;
        return out.getOrDefault(callee, 0);
    }

    public int totalCalls(String callee) {
        int n = 0;
        for (Map<String, Integer> out : calls.values()) n += out.getOrDefault(callee, 0);
        return n;
    }

    public Map<String, Integer> calleesOf(String caller) {
        Map<String, Integer> out = calls.get(caller);
        return (out == null) ? Collections.emptyMap() : Collections.unmodifiableMap(out);
    }
}
