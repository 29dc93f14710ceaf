package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Matches a node that has a descendant matching {@code rule}. A non-zero {@code fieldId} restricts
 * the search to the children stored in that field and their subtrees.
 *
 * <p>
 * With a stop rule the search does not descend below a node matching it, though that node is still
 * tested itself.
 */
public record HasRule(Rule rule, StopBy stopBy, int fieldId) implements Rule {

    public HasRule {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(stopBy, "stopBy must not be null");
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        for (Node child : node.children()) {
            if (fieldId != 0 && child.fieldId() != fieldId) {
                continue;
            }
            if (search(child, env)) {
                return true;
            }
        }
        return false;
    }

    private boolean search(Node start, MetaVarEnv env) {
        return switch (stopBy.kind()) {
            case NEIGHBOR -> rule.matchNode(start, env);
            case END -> start.dfs().stream().anyMatch(node -> rule.matchNode(node, env));
            case RULE -> searchUntilBoundary(start, env);
        };
    }

    /** Pre-order search that does not descend below nodes matching the stop rule. */
    private boolean searchUntilBoundary(Node start, MetaVarEnv env) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (rule.matchNode(node, env)) {
                return true;
            }
            if (stopBy.isBoundary(node)) {
                continue;
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
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
