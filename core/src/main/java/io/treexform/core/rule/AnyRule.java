package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Matches when some sub-rule matches. Sub-rules are tried in declared order and only the bindings
 * of the first one that matches are kept.
 */
public record AnyRule(List<Rule> rules) implements Rule {

    public AnyRule {
        rules = List.copyOf(rules);
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        for (Rule rule : rules) {
            if (rule.matchNode(node, env)) {
                return true;
            }
        }
        return false;
    }

    /** Union of the sub-rules' kinds, or {@code null} if any sub-rule accepts every kind. */
    @Override
    public BitSet potentialKinds() {
        BitSet result = new BitSet();
        for (Rule rule : rules) {
            BitSet kinds = rule.potentialKinds();
            if (kinds == null) {
                return null;
            }
            result.or(kinds);
        }
        return result;
    }

    @Override
    public boolean isPositive() {
        for (Rule rule : rules) {
            if (!rule.isPositive()) {
                return false;
            }
        }
        return true;
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
