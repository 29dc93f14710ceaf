package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a node by its position among its named siblings. When {@code ofRule} is present only
 * siblings matching it are counted; {@code reverse} counts from the last sibling.
 */
public record NthChildRule(NthChildPosition position, Optional<Rule> ofRule, boolean reverse) implements Rule {

    public NthChildRule {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(ofRule, "ofRule must not be null");
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        Optional<Node> parent = node.parent();
        if (parent.isEmpty()) {
            return false;
        }
        List<Node> counted = new ArrayList<>();
        for (Node sibling : parent.get().children()) {
            if (sibling.isNamed() && (ofRule.isEmpty() || ofRule.get().matchNode(sibling, env.copy()))) {
                counted.add(sibling);
            }
        }
        int index = counted.indexOf(node);
        if (index < 0) {
            return false;
        }
        return position.matches(reverse ? counted.size() - index : index + 1);
    }

    @Override
    public boolean isPositive() {
        return true;
    }

    @Override
    public void collectReferents(Set<String> ids) {
        ofRule.ifPresent(rule -> rule.collectReferents(ids));
    }
}
