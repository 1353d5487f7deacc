package com.graphoid.script.rules;

import com.graphoid.script.runtime.Value;

/** What a rule enforces. Parameterised kinds carry their parameter (degree, functions, name). */
public final class RuleSpec {

    public enum Category { STRUCTURAL, TRANSFORMATION, FREEZE_CONTROL, METHOD_CONSTRAINT }

    public enum Kind {
        NO_CYCLES("no_cycles", Category.STRUCTURAL),
        SINGLE_ROOT("single_root", Category.STRUCTURAL),
        CONNECTED("connected", Category.STRUCTURAL),
        BINARY_TREE("binary_tree", Category.STRUCTURAL),
        NO_DUPLICATES("no_duplicates", Category.STRUCTURAL),
        MAX_DEGREE("max_degree", Category.STRUCTURAL),
        WEIGHTED_EDGES("weighted_edges", Category.STRUCTURAL),
        UNWEIGHTED_EDGES("unweighted_edges", Category.STRUCTURAL),
        BST_ORDERING("bst_ordering", Category.STRUCTURAL),

        NONE_TO_ZERO("none_to_zero", Category.TRANSFORMATION),
        NONE_TO_EMPTY("none_to_empty", Category.TRANSFORMATION),
        POSITIVE("positive", Category.TRANSFORMATION),
        ROUND_TO_INT("round_to_int", Category.TRANSFORMATION),
        UPPERCASE("uppercase", Category.TRANSFORMATION),
        LOWERCASE("lowercase", Category.TRANSFORMATION),
        CUSTOM_FUNCTION("custom_function", Category.TRANSFORMATION),
        CONDITIONAL("conditional", Category.TRANSFORMATION),

        NO_FROZEN("no_frozen", Category.FREEZE_CONTROL),
        COPY_ELEMENTS("copy_elements", Category.FREEZE_CONTROL),
        SHALLOW_FREEZE_ONLY("shallow_freeze_only", Category.FREEZE_CONTROL),

        NO_NODE_REMOVALS("no_node_removals", Category.METHOD_CONSTRAINT),
        NO_EDGE_REMOVALS("no_edge_removals", Category.METHOD_CONSTRAINT),
        READ_ONLY("read_only", Category.METHOD_CONSTRAINT),
        CUSTOM_METHOD_CONSTRAINT("custom_constraint", Category.METHOD_CONSTRAINT);

        public final String symbol;
        public final Category category;

        Kind(String symbol, Category category) {
            this.symbol = symbol;
            this.category = category;
        }
    }

    public final Kind kind;
    public final int maxDegree;
    public final Value function;
    public final Value predicate;
    public final Value fallback;
    public final String constraintName;

    private RuleSpec(Kind kind, int maxDegree, Value function, Value predicate, Value fallback, String constraintName) {
        this.kind = kind;
        this.maxDegree = maxDegree;
        this.function = function;
        this.predicate = predicate;
        this.fallback = fallback;
        this.constraintName = constraintName;
    }

    public static RuleSpec of(Kind kind) {
        return new RuleSpec(kind, 0, null, null, null, null);
    }

    public static RuleSpec maxDegree(int n) {
        return new RuleSpec(Kind.MAX_DEGREE, n, null, null, null, null);
    }

    public static RuleSpec customFunction(Value fn) {
        return new RuleSpec(Kind.CUSTOM_FUNCTION, 0, fn, null, null, null);
    }

    /** Applies {@code transform} where {@code predicate} holds, {@code fallback} (if any) elsewhere. */
    public static RuleSpec conditional(Value predicate, Value transform, Value fallback) {
        return new RuleSpec(Kind.CONDITIONAL, 0, transform, predicate, fallback, null);
    }

    public static RuleSpec customConstraint(Value fn, String name) {
        return new RuleSpec(Kind.CUSTOM_METHOD_CONSTRAINT, 0, fn, null, null, name);
    }

    public Category category() {
        return kind.category;
    }

    /** Name used by has_rule / remove_rule and in violation messages. */
    public String name() {
        return (kind == Kind.CUSTOM_METHOD_CONSTRAINT && constraintName != null) ? constraintName : kind.symbol;
    }

    public boolean sameRule(RuleSpec other) {
        return kind == other.kind && maxDegree == other.maxDegree && name().equals(other.name());
    }

    @Override
    public String toString() {
        return (kind == Kind.MAX_DEGREE) ? ":" + name() + "(" + maxDegree + ")" : ":" + name();
    }
}
