package io.treexform.core.rule;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * How far a relational rule searches.
 *
 * <ul>
 * <li>{@link #NEIGHBOR}: only the immediate relative (parent, direct children, adjacent sibling)</li>
 * <li>{@link #END}: every relative up to the root, the whole subtree, or every sibling on that
 * side</li>
 * <li>{@link #until(Rule)}: relatives in order up to and including the first one matching the stop
 * rule</li>
 * </ul>
 */
public final class StopBy {

    /** Search kind. */
    public enum Kind {
        NEIGHBOR,
        END,
        RULE
    }

    public static final StopBy NEIGHBOR = new StopBy(Kind.NEIGHBOR, null);
    public static final StopBy END = new StopBy(Kind.END, null);

    private final Kind kind;
    private final Rule stopRule;

    private StopBy(Kind kind, Rule stopRule) {
        this.kind = kind;
        this.stopRule = stopRule;
    }

    /** Searches until a node matching {@code stopRule} is reached, that node included. */
    public static StopBy until(Rule stopRule) {
        return new StopBy(Kind.RULE, Objects.requireNonNull(stopRule, "stopRule must not be null"));
    }

    public Kind kind() {
        return kind;
    }

    /** The stop rule, present only for {@link Kind#RULE}. */
    public Optional<Rule> stopRule() {
        return Optional.ofNullable(stopRule);
    }

    /**
     * The relatives this policy lets a search visit, in search order.
     *
     * @param nearest the immediate relative, if any
     * @param all     every relative in order, nearest first
     * @return the relatives to test
     */
    public List<Node> reachable(Optional<Node> nearest, List<Node> all) {
        return switch (kind) {
            case NEIGHBOR -> nearest.map(List::of).orElse(List.of());
            case END -> all;
            case RULE -> untilBoundary(all);
        };
    }

    private List<Node> untilBoundary(List<Node> all) {
        List<Node> visited = new ArrayList<>();
        for (Node node : all) {
            visited.add(node);
            if (isBoundary(node)) {
                break;
            }
        }
        return visited;
    }

    /** True if a search must not go past {@code node}. Always false except for {@link Kind#RULE}. */
    boolean isBoundary(Node node) {
        return stopRule != null && stopRule.matchNode(node, new MetaVarEnv());
    }

    @Override
    public String toString() {
        return kind == Kind.RULE ? "StopBy[rule]" : "StopBy[" + kind.name().toLowerCase(Locale.ROOT) + "]";
    }
}
