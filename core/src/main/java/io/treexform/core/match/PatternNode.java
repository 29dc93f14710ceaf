package io.treexform.core.match;

import io.treexform.core.meta.MetaVariable;
import java.util.List;
import java.util.Objects;

/** The compiled form of a pattern: a tree of meta-variables, tokens and inner nodes. */
public sealed interface PatternNode {

    /** Kind id the parser gives to error nodes; a goal of this kind matches any candidate kind. */
    int ERROR_KIND = 65535;

    /** A meta-variable in place of a node. */
    record MetaVar(MetaVariable variable) implements PatternNode {
        public MetaVar {
            Objects.requireNonNull(variable, "variable must not be null");
        }
    }

    /** A leaf that must match by kind and, when named, by text. */
    record Terminal(int kindId, String text, boolean named) implements PatternNode {}

    /** An inner node whose children are matched as a sibling sequence. */
    record Internal(int kindId, List<PatternNode> children) implements PatternNode {
        public Internal {
            children = List.copyOf(children);
        }
    }

    /** True for ellipsis meta-variables. */
    default boolean isEllipsis() {
        return this instanceof MetaVar metaVar && metaVar.variable().isEllipsis();
    }
}
