package io.treexform.core.rule;

import io.treexform.core.match.Pattern;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.BitSet;
import java.util.Objects;
import java.util.Set;

/** Matches nodes with a code {@link Pattern}. */
public record PatternRule(Pattern pattern) implements Rule {

    public PatternRule {
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        return pattern.matchNode(node, env);
    }

    @Override
    public BitSet potentialKinds() {
        return pattern.potentialKinds();
    }

    @Override
    public boolean isPositive() {
        return true;
    }

    @Override
    public Set<String> definedVariables() {
        return pattern.definedVariables();
    }
}
