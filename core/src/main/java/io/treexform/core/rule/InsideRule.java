package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a node that has an ancestor matching {@code rule}. A non-zero {@code fieldId} only
 * accepts an ancestor reached through a child stored in that field.
 */
public record InsideRule(Rule rule, StopBy stopBy, int fieldId) implements Rule {

    public InsideRule {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(stopBy, "stopBy must not be null");
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        Node child = node;
        Optional<Node> ancestor = node.parent();
        while (ancestor.isPresent()) {
            Node current = ancestor.get();
            if ((fieldId == 0 || child.fieldId() == fieldId) && rule.matchNode(current, env)) {
                return true;
            }
            if (stopBy.kind() == StopBy.Kind.NEIGHBOR || stopBy.isBoundary(current)) {
                return false;
            }
            child = current;
            ancestor = current.parent();
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
