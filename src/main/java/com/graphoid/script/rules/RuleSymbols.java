package com.graphoid.script.rules;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.Value;

/** Maps {@code rule :name[, param]} symbols to rule specs. */
public final class RuleSymbols {
    private RuleSymbols() {}

    public static RuleSpec fromSymbol(String name, Value param) {
        if ("max_degree".equals(name)) {
            if (param == null || !param.isNumeric()) {
                throw GraphoidException.runtime("Rule :max_degree requires a numeric parameter");
            }
            return RuleSpec.maxDegree(param.asInt());
        }

        RuleSpec.Kind kind = simpleKind(name);
        if (kind == null) throw GraphoidException.runtime("Unknown rule: :" + name);
        if (param != null) throw GraphoidException.runtime("Rule :" + name + " does not accept parameters");
        return RuleSpec.of(kind);
    }

    private static RuleSpec.Kind simpleKind(String name) {
        switch (name) {
            case "no_dups":
                return RuleSpec.Kind.NO_DUPLICATES;
            case "custom_function":
            case "conditional":
            case "custom_constraint":
                return null;
            default:
                for (RuleSpec.Kind k : RuleSpec.Kind.values()) {
                    if (k.symbol.equals(name)) return k;
                }
                return null;
        }
    }
}
