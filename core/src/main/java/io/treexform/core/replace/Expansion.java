package io.treexform.core.replace;

import io.treexform.core.match.NodeMatch;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.rule.Rule;
import io.treexform.core.rule.StopBy;
import io.treexform.core.tree.Node;
import java.util.List;
import java.util.Objects;

/**
 * Widens the range a fix replaces to neighbouring siblings, e.g. to swallow the comma after a
 * deleted argument. The range grows to the farthest sibling within {@code stopBy} that matches
 * {@code rule}.
 */
public record Expansion(Rule rule, StopBy stopBy) {

    public Expansion {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(stopBy, "stopBy must not be null");
    }

    /** Start byte of the widened range, looking at preceding siblings. */
    int expandStart(NodeMatch match) {
        Node node = match.node();
        Node farthest = farthest(stopBy.reachable(node.prev(), node.prevAll()), match.env());
        return farthest == null ? node.startByte() : farthest.startByte();
    }

    /** End byte of the widened range, looking at following siblings. */
    int expandEnd(NodeMatch match) {
        Node node = match.node();
        Node farthest = farthest(stopBy.reachable(node.next(), node.nextAll()), match.env());
        return farthest == null ? node.endByte() : farthest.endByte();
    }

    private Node farthest(List<Node> candidates, MetaVarEnv env) {
        Node farthest = null;
        for (Node candidate : candidates) {
            if (rule.matchNode(candidate, env.copy())) {
                farthest = candidate;
            }
        }
        return farthest;
    }
}
