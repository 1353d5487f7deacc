package com.graphoid.script.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.graphoid.script.errors.GraphoidException;

/** Named bundles of structural rules. */
public final class Rulesets {
    private Rulesets() {}

    public static List<RuleSpec> forName(String name) {
        switch (name) {
            case "tree":
                return tree();
            case "binary_tree": {
                List<RuleSpec> rules = tree();
                rules.add(RuleSpec.maxDegree(2));
                return rules;
            }
            case "bst": {
                List<RuleSpec> rules = forName("binary_tree");
                rules.add(RuleSpec.of(RuleSpec.Kind.BST_ORDERING));
                return rules;
            }
            case "dag":
                return new ArrayList<>(Arrays.asList(RuleSpec.of(RuleSpec.Kind.NO_CYCLES)));
            default:
                throw GraphoidException.runtime("Unknown ruleset: :" + name);
        }
    }

    public static boolean exists(String name) {
        return "tree".equals(name) || "binary_tree".equals(name) || "bst".equals(name) || "dag".equals(name);
    }

    private static List<RuleSpec> tree() {
        return new ArrayList<>(Arrays.asList(
                RuleSpec.of(RuleSpec.Kind.NO_CYCLES),
                RuleSpec.of(RuleSpec.Kind.SINGLE_ROOT),
                RuleSpec.of(RuleSpec.Kind.CONNECTED)));
    }
}
