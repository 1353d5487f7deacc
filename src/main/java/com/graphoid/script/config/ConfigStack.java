package com.graphoid.script.config;

import java.util.ArrayDeque;
import java.util.Deque;

/** LIFO of configuration frames; the bottom frame is the host-supplied base. */
public final class ConfigStack {
    private final Deque<RuntimeConfig> frames = new ArrayDeque<>();

    public ConfigStack() {
        frames.push(new RuntimeConfig());
    }

    public ConfigStack(RuntimeConfig base) {
        frames.push(base.copy());
    }

    public RuntimeConfig current() {
        return frames.peek();
    }

    public void push(RuntimeConfig config) {
        frames.push(config);
    }

    public void pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop base configuration frame");
        }
        frames.pop();
    }

    public int depth() {
        return frames.size();
    }

    /** Replaces the base frame; scoped frames above it are kept. */
    public void replaceBase(RuntimeConfig base) {
        Deque<RuntimeConfig> scoped = new ArrayDeque<>();
        while (frames.size() > 1) scoped.push(frames.pop());
        frames.pop();
        frames.push(base);
        while (!scoped.isEmpty()) frames.push(scoped.pop());
    }
}
