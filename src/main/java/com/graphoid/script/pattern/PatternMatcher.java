package com.graphoid.script.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.graphoid.script.parser.Expr.ExprInterface;
import com.graphoid.script.parser.Expr.PatternClause;
import com.graphoid.script.parser.Pattern;
import com.graphoid.script.runtime.ListValue;
import com.graphoid.script.runtime.Value;

/**
 * Structural matching shared by pattern-clause functions and match expressions. A kind mismatch is
 * a non-match, never an error.
 */
public final class PatternMatcher {
    /** Tolerance for numeric literal patterns: the spacing of doubles at 1.0. */
    public static final double EPSILON = Math.ulp(1.0);

    /** Evaluates a clause guard with the clause's bindings in scope. */
    @FunctionalInterface
    public interface GuardEvaluator {
        boolean test(ExprInterface guard, Map<String, Value> bindings);
    }

    public static final class ClauseMatch {
        public final PatternClause clause;
        public final Map<String, Value> bindings;

        ClauseMatch(PatternClause clause, Map<String, Value> bindings) {
            this.clause = clause;
            this.bindings = bindings;
        }
    }

    private PatternMatcher() {}

    /** First clause whose pattern matches and whose guard (if any) holds; null when none does. */
    public static ClauseMatch findMatch(List<PatternClause> clauses, Value value, GuardEvaluator guards) {
        for (PatternClause clause : clauses) {
            Map<String, Value> bindings = match(clause.pattern, value);
            if (bindings == null) continue;
            if (clause.guard != null && !guards.test(clause.guard, bindings)) continue;
            return new ClauseMatch(clause, bindings);
        }
        return null;
    }

    /** Bindings produced by matching, or null for no match. */
    public static Map<String, Value> match(Pattern pattern, Value value) {
        Map<String, Value> bindings = new LinkedHashMap<>();
        return matchInto(pattern, value, bindings) ? bindings : null;
    }

    private static boolean matchInto(Pattern pattern, Value value, Map<String, Value> bindings) {
        if (pattern instanceof Pattern.Wildcard) return true;

        if (pattern instanceof Pattern.Variable) {
            String name = ((Pattern.Variable) pattern).name;
            if (!"_".equals(name)) bindings.put(name, value);
            return true;
        }

        if (pattern instanceof Pattern.Literal) {
            return literalMatches((Pattern.Literal) pattern, value);
        }

        if (pattern instanceof Pattern.ListPattern) {
            if (value.type != Value.Type.LIST) return false;
            Pattern.ListPattern lp = (Pattern.ListPattern) pattern;
            ListValue list = value.asList();
            int fixed = lp.elements.size();
            if (lp.hasRest() ? list.size() < fixed : list.size() != fixed) return false;
            for (int i = 0; i < fixed; i++) {
                if (!matchInto(lp.elements.get(i), list.get(i), bindings)) return false;
            }
            if (lp.hasRest() && !"_".equals(lp.rest)) {
                List<Value> rest = new ArrayList<>(list.items().subList(fixed, list.size()));
                bindings.put(lp.rest, Value.list(rest));
            }
            return true;
        }

        throw new IllegalStateException("Unhandled pattern " + pattern.getClass().getSimpleName());
    }

    private static boolean literalMatches(Pattern.Literal lit, Value value) {
        Object expected = lit.value;
        if (lit.symbol) return value.type == Value.Type.SYMBOL && expected.equals(value.asSymbol());
        if (expected == null) return value.isNone();
        if (expected instanceof Double) {
            if (!value.isNumeric()) return false;
            return Math.abs(value.asNumber() - (Double) expected) < EPSILON;
        }
        if (expected instanceof String) return value.type == Value.Type.STRING && expected.equals(value.asString());
        if (expected instanceof Boolean) return value.type == Value.Type.BOOL && expected.equals(value.asBool());
        return false;
    }
}
