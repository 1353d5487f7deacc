package com.graphoid.script.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Script-visible error value: the payload of {@code raise}, of {@code catch ... as e} bindings and of
 * collected diagnostics.
 */
public final class ErrorObject {
    public final String type;
    public final String message;
    public final SourcePosition position;
    public final ErrorObject cause;
    public final List<String> stackTrace;

    public ErrorObject(String type, String message, SourcePosition position, ErrorObject cause, List<String> stackTrace) {
        this.type = type;
        this.message = message;
        this.position = (position == null) ? SourcePosition.UNKNOWN : position;
        this.cause = cause;
        this.stackTrace = (stackTrace == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(stackTrace));
    }

    public ErrorObject(String type, String message) {
        this(type, message, SourcePosition.UNKNOWN, null, null);
    }

    public ErrorObject withCause(ErrorObject newCause) {
        return new ErrorObject(type, message, position, newCause, stackTrace);
    }

    public ErrorObject withStackTrace(List<String> frames) {
        return new ErrorObject(type, message, position, cause, frames);
    }

    /** "Type: message", followed by one "Caused by: ..." line per link of the cause chain. */
    public String fullMessage() {
        StringBuilder sb = new StringBuilder(type).append(": ").append(message);
        ErrorObject c = cause;
        while (c != null) {
            sb.append("\nCaused by: ").append(c.type).append(": ").append(c.message);
            c = c.cause;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "<error " + type + ": " + message + ">";
    }
}
