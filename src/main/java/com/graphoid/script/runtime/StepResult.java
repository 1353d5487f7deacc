package com.graphoid.script.runtime;

/** Outcome of executing a statement: normal completion or a control signal travelling outward. */
public final class StepResult {
    public enum Kind { NORMAL, RETURN, BREAK, CONTINUE }

    public static final StepResult NORMAL = new StepResult(Kind.NORMAL, null);
    public static final StepResult BREAK = new StepResult(Kind.BREAK, null);
    public static final StepResult CONTINUE = new StepResult(Kind.CONTINUE, null);

    public final Kind kind;
    public final Value value;

    private StepResult(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static StepResult returning(Value value) {
        return new StepResult(Kind.RETURN, value);
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }
}
