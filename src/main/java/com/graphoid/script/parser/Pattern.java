package com.graphoid.script.parser;

import java.util.List;

/** Patterns shared by function clauses and match arms. */
public abstract class Pattern {

    private Pattern() {}

    /** Number (Double), string, boolean, none (null) or symbol. */
    public static final class Literal extends Pattern {
        public final Object value;
        public final boolean symbol;

        public Literal(Object value, boolean symbol) {
            this.value = value;
            this.symbol = symbol;
        }
    }

    /** Binds the whole value; the name {@code _} behaves as a wildcard. */
    public static final class Variable extends Pattern {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }
    }

    public static final class Wildcard extends Pattern {
        public static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {}
    }

    /** {@code [p1, p2, ...rest]}; {@code rest} is null when absent and "_" when anonymous. */
    public static final class ListPattern extends Pattern {
        public final List<Pattern> elements;
        public final String rest;

        public ListPattern(List<Pattern> elements, String rest) {
            this.elements = elements;
            this.rest = rest;
        }

        public boolean hasRest() {
            return rest != null;
        }
    }
}
