package com.graphoid.script.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single exception type raised by the engine. User-raised errors carry their {@link ErrorObject};
 * engine errors are described by kind, message and position.
 */
public class GraphoidException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String detail;
    private final SourcePosition position;
    private final String ruleName;
    private final List<String> chain;
    private final ErrorObject errorObject;
    private List<String> scriptTrace;

    private GraphoidException(ErrorKind kind, String detail, SourcePosition position,
                              String ruleName, List<String> chain, ErrorObject errorObject) {
        super(format(kind, detail, position, ruleName, chain, errorObject));
        this.kind = kind;
        this.detail = detail;
        this.position = (position == null) ? SourcePosition.UNKNOWN : position;
        this.ruleName = ruleName;
        this.chain = (chain == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(chain));
        this.errorObject = errorObject;
    }

    public static GraphoidException syntax(String message, SourcePosition position) {
        return new GraphoidException(ErrorKind.SYNTAX, message, position, null, null, null);
    }

    public static GraphoidException type(String message) {
        return new GraphoidException(ErrorKind.TYPE, message, null, null, null, null);
    }

    public static GraphoidException type(String message, SourcePosition position) {
        return new GraphoidException(ErrorKind.TYPE, message, position, null, null, null);
    }

    public static GraphoidException runtime(String message) {
        return new GraphoidException(ErrorKind.RUNTIME, message, null, null, null, null);
    }

    public static GraphoidException ruleViolation(String rule, String message) {
        return new GraphoidException(ErrorKind.RULE_VIOLATION, message, null, rule, null, null);
    }

    public static GraphoidException moduleNotFound(String module, SourcePosition position) {
        return new GraphoidException(ErrorKind.MODULE_NOT_FOUND, module, position, null, null, null);
    }

    public static GraphoidException io(String message, SourcePosition position) {
        return new GraphoidException(ErrorKind.IO, message, position, null, null, null);
    }

    public static GraphoidException circularDependency(List<String> chain, SourcePosition position) {
        return new GraphoidException(ErrorKind.CIRCULAR_DEPENDENCY, String.join(" -> ", chain), position, null, chain, null);
    }

    public static GraphoidException config(String message) {
        return new GraphoidException(ErrorKind.CONFIG, message, null, null, null, null);
    }

    /** Error raised by script code ({@code raise ValueError("...")}). */
    public static GraphoidException raised(ErrorObject error) {
        return new GraphoidException(ErrorKind.RUNTIME, error.message, error.position, null, null, error);
    }

    public ErrorKind getKind() { return kind; }
    public String getDetail() { return detail; }
    public SourcePosition getPosition() { return position; }
    public String getRuleName() { return ruleName; }
    public List<String> getChain() { return chain; }
    public ErrorObject getErrorObject() { return errorObject; }

    /** Same error located at {@code pos}; errors that already carry a position are returned as is. */
    public GraphoidException atPosition(SourcePosition pos) {
        if (errorObject != null || position.isKnown() || pos == null || !pos.isKnown()) return this;
        GraphoidException located = new GraphoidException(kind, detail, pos, ruleName, chain, null);
        located.scriptTrace = scriptTrace;
        located.setStackTrace(getStackTrace());
        return located;
    }

    /** Records the script call stack at the innermost point the error crossed; later calls are ignored. */
    public void recordTrace(List<String> frames) {
        if (scriptTrace == null) scriptTrace = new ArrayList<>(frames);
    }

    public List<String> getScriptTrace() {
        return (scriptTrace == null) ? Collections.emptyList() : Collections.unmodifiableList(scriptTrace);
    }

    public boolean isRaised() {
        return errorObject != null;
    }

    /** Name used for {@code catch Type} matching: the user error type when raised, else the kind's name. */
    public String typeName() {
        return (errorObject != null) ? errorObject.type : kind.typeName();
    }

    /** Script-visible form of this error. */
    public ErrorObject toErrorObject() {
        if (errorObject != null) return errorObject;
        return new ErrorObject(kind.typeName(), detail, position, null, getScriptTrace());
    }

    private static String format(ErrorKind kind, String detail, SourcePosition pos,
                                 String ruleName, List<String> chain, ErrorObject raised) {
        if (raised != null) return raised.type + ": " + raised.message;
        String at = (pos != null && pos.isKnown()) ? " at " + pos : "";
        switch (kind) {
            case SYNTAX:
                return "Syntax error: " + detail + at;
            case TYPE:
                return "Type error: " + detail + at;
            case RULE_VIOLATION:
                return "Graph rule violated: " + ruleName + " - " + detail;
            case MODULE_NOT_FOUND:
                return "Module not found: '" + detail + "'" + at;
            case IO:
                return "I/O error: " + detail + at;
            case CIRCULAR_DEPENDENCY:
                return "Circular dependency detected" + at + ": " + detail;
            case CONFIG:
                return "Configuration error: " + detail;
            case RUNTIME:
            default:
                return "Runtime error: " + detail;
        }
    }
}
