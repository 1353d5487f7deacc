package com.graphoid.script.runtime;

import java.util.List;

public class CallFrame {
    public final String functionName;
    public final List<Value> args;

    public CallFrame(String functionName, List<Value> args) {
        this.functionName = functionName;
        this.args = args;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(functionName).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
