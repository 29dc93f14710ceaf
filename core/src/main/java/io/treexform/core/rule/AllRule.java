package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Matches when every sub-rule matches. Sub-rules run in order against one shared environment, so a
 * variable bound by an earlier sub-rule constrains the later ones.
 */
public record AllRule(List<Rule> rules) implements Rule {

    public AllRule {
        rules = List.copyOf(rules);
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        MetaVarEnv shared = env.copy();
        for (Rule rule : rules) {
            if (!rule.matchNode(node, shared)) {
                return false;
            }
        }
        env.absorb(shared);
        return true;
    }

    /** Intersection of the sub-rules that restrict kinds. */
    @Override
    public BitSet potentialKinds() {
        BitSet result = null;
        for (Rule rule : rules) {
            BitSet kinds = rule.potentialKinds();
            if (kinds == null) {
                continue;
            }
            if (result == null) {
                result = (BitSet) kinds.clone();
            } else {
                result.and(kinds);
            }
        }
        return result;
    }

    @Override
    public boolean isPositive() {
        for (Rule rule : rules) {
            if (rule.isPositive()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Set<String> definedVariables() {
        Set<String> names = new LinkedHashSet<>();
        rules.forEach(rule -> names.addAll(rule.definedVariables()));
        return names;
    }

    @Override
    public void collectReferents(Set<String> ids) {
        rules.forEach(rule -> rule.collectReferents(ids));
    }

    @Override
    public boolean refersTo(String id) {
        return rules.stream().anyMatch(rule -> rule.refersTo(id));
    }
}
