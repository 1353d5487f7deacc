package com.graphoid.script.runtime;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Destination of {@code print}. Captures nest: while one or more capture buffers are open, output
 * goes to the innermost one instead of the stream.
 */
public final class OutputChannel {
    private PrintStream out;
    private final Deque<StringBuilder> captures = new ArrayDeque<>();

    public OutputChannel(PrintStream out) {
        this.out = out;
    }

    public void setStream(PrintStream out) {
        this.out = out;
    }

    public void println(String line) {
        StringBuilder capture = captures.peek();
        if (capture != null) {
            capture.append(line).append('\n');
        } else {
            out.println(line);
            out.flush();
        }
    }

    public void beginCapture() {
        captures.push(new StringBuilder());
    }

    /** Closes the innermost capture and returns what it collected. */
    public String endCapture() {
        if (captures.isEmpty()) throw new IllegalStateException("Internal error: no output capture active");
        return captures.pop().toString();
    }

    public boolean isCapturing() {
        return !captures.isEmpty();
    }

    /** Contents of the innermost capture without closing it. */
    public String peekCapture() {
        StringBuilder capture = captures.peek();
        return (capture == null) ? "" : capture.toString();
    }
}
