package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.Objects;
import java.util.Set;

/** Matches a node followed by a sibling matching {@code rule}. */
public record PrecedesRule(Rule rule, StopBy stopBy) implements Rule {

    public PrecedesRule {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(stopBy, "stopBy must not be null");
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        for (Node sibling : stopBy.reachable(node.next(), node.nextAll())) {
            if (rule.matchNode(sibling, env)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isPositive() {
        return false;
    }

    @Override
    public Set<String> definedVariables() {
        return rule.definedVariables();
    }

    @Override
    public void collectReferents(Set<String> ids) {
        rule.collectReferents(ids);
        stopBy.stopRule().ifPresent(stop -> stop.collectReferents(ids));
    }
}
