package io.treexform.core.match;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.replace.Fixer;
import io.treexform.core.tree.Edit;
import io.treexform.core.tree.Node;
import java.util.Objects;

/** A matched node together with the bindings collected while matching it. */
public record NodeMatch(Node node, MetaVarEnv env) {

    public NodeMatch {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(env, "env must not be null");
    }

    public String text() {
        return node.text();
    }

    /** The text {@code fixer} would put in place of this match. */
    public String replacement(Fixer fixer) {
        return fixer.render(this);
    }

    /** The edit that applies {@code fixer} to this match. */
    public Edit makeEdit(Fixer fixer) {
        return fixer.edit(this);
    }
}
