package com.graphoid.script.rules;

import java.util.Collections;
import java.util.List;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.runtime.Value;

/** Applies transformation and freeze-control rules to a value entering a collection or graph. */
public final class TransformationRules {
    private TransformationRules() {}

    public static Value applyOnInsert(List<RuleInstance> rules, Value value, RuleCallback callback) {
        Value v = value;
        for (RuleInstance r : rules) {
            RuleSpec spec = r.spec;
            switch (spec.kind) {
                case NONE_TO_ZERO:
                    if (v.isNone()) v = Value.number(0);
                    break;
                case NONE_TO_EMPTY:
                    if (v.isNone()) v = Value.string("");
                    break;
                case POSITIVE:
                    if (v.type == Value.Type.NUMBER) v = Value.number(Math.abs(v.asNumber()));
                    else if (v.type == Value.Type.BIGNUM) v = Value.bignum(v.asBigNumber().abs());
                    break;
                case ROUND_TO_INT:
                    if (v.type == Value.Type.NUMBER) v = Value.number(roundHalfAwayFromZero(v.asNumber()));
                    else if (v.type == Value.Type.BIGNUM) v = Value.bignum(v.asBigNumber().round(0));
                    break;
                case UPPERCASE:
                    if (v.type == Value.Type.STRING) v = Value.string(v.asString().toUpperCase());
                    break;
                case LOWERCASE:
                    if (v.type == Value.Type.STRING) v = Value.string(v.asString().toLowerCase());
                    break;
                case CUSTOM_FUNCTION:
                    v = callback.invoke(spec.function, Collections.singletonList(v));
                    break;
                case CONDITIONAL:
                    if (callback.invoke(spec.predicate, Collections.singletonList(v)).isTruthy()) {
                        v = callback.invoke(spec.function, Collections.singletonList(v));
                    } else if (spec.fallback != null) {
                        v = callback.invoke(spec.fallback, Collections.singletonList(v));
                    }
                    break;
                case NO_FROZEN:
                    if (v.isFrozen()) {
                        throw GraphoidException.ruleViolation(spec.name(), "Cannot add frozen value " + v);
                    }
                    break;
                case COPY_ELEMENTS:
                    v = v.thaw();
                    break;
                default:
                    break;
            }
        }
        return v;
    }

    public static boolean hasRule(List<RuleInstance> rules, RuleSpec.Kind kind) {
        for (RuleInstance r : rules) if (r.spec.kind == kind) return true;
        return false;
    }

    public static double roundHalfAwayFromZero(double d) {
        return Math.signum(d) * Math.floor(Math.abs(d) + 0.5);
    }
}
