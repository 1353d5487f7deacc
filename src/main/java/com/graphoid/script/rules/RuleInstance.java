package com.graphoid.script.rules;

/** A rule attached to a list, map or graph. */
public final class RuleInstance {
    public final RuleSpec spec;
    public final RuleSeverity severity;

    public RuleInstance(RuleSpec spec, RuleSeverity severity) {
        this.spec = spec;
        this.severity = severity;
    }

    public RuleInstance(RuleSpec spec) {
        this(spec, RuleSeverity.ERROR);
    }

    @Override
    public String toString() {
        return spec.toString();
    }
}
