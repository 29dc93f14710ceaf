package io.treexform.core.rule;

import io.treexform.core.error.MatcherCompileException;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.spi.Language;
import io.treexform.core.tree.Node;
import java.util.BitSet;

/** Matches nodes of one grammar kind, e.g. {@code call_expression}. */
public record KindRule(String kind, int kindId) implements Rule {

    /**
     * Resolves {@code kind} in {@code language}.
     *
     * @throws MatcherCompileException if the grammar has no such kind
     */
    public static KindRule of(Language language, String kind) {
        int id = language.kindId(kind);
        if (id == 0) {
            throw new MatcherCompileException(
                    "Invalid kind '" + kind + "' for language '" + language.id() + "'", "kind");
        }
        return new KindRule(kind, id);
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        return node.kindId() == kindId;
    }

    @Override
    public BitSet potentialKinds() {
        BitSet kinds = new BitSet();
        kinds.set(kindId);
        return kinds;
    }

    @Override
    public boolean isPositive() {
        return true;
    }
}
