package com.graphoid.script.errors;

/** Error categories crossing the engine boundary. The type name is what {@code catch} clauses match. */
public enum ErrorKind {
    SYNTAX("SyntaxError"),
    TYPE("TypeError"),
    RUNTIME("RuntimeError"),
    RULE_VIOLATION("RuleViolation"),
    MODULE_NOT_FOUND("ModuleNotFound"),
    IO("IOError"),
    CIRCULAR_DEPENDENCY("CircularDependency"),
    CONFIG("ConfigError");

    private final String typeName;

    ErrorKind(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
