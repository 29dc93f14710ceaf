package io.treexform.core.match;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.BitSet;
import java.util.Optional;

/**
 * Anything that can decide whether a single node matches, collecting meta-variable bindings on the
 * way. Patterns, atomic rules, relational rules and composite rules all implement this interface.
 */
public interface Matcher {

    /**
     * Tests {@code node}, adding bindings to {@code env} on success.
     *
     * <p>
     * Implementations leave {@code env} exactly as it was when they return {@code false}.
     *
     * @param node the candidate node
     * @param env  bindings collected so far
     * @return true if the node matches
     */
    boolean matchNode(Node node, MetaVarEnv env);

    /**
     * The node kinds this matcher can possibly match, used to skip nodes during a scan.
     *
     * @return a set of kind ids, or {@code null} if any kind may match
     */
    default BitSet potentialKinds() {
        return null;
    }

    /** Matches {@code node} with a fresh environment. */
    default Optional<NodeMatch> match(Node node) {
        MetaVarEnv env = new MetaVarEnv();
        return matchNode(node, env) ? Optional.of(new NodeMatch(node, env)) : Optional.empty();
    }
}
