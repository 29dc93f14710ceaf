package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.Objects;
import java.util.Set;

/** Matches when the inner rule does not. Never binds variables. */
public record NotRule(Rule rule) implements Rule {

    public NotRule {
        Objects.requireNonNull(rule, "rule must not be null");
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        return !rule.matchNode(node, env.copy());
    }

    @Override
    public boolean isPositive() {
        return false;
    }

    @Override
    public void collectReferents(Set<String> ids) {
        rule.collectReferents(ids);
    }

    @Override
    public boolean refersTo(String id) {
        return rule.refersTo(id);
    }
}
