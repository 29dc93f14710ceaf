package io.treexform.core.rule;

import io.treexform.core.match.Matcher;
import java.util.Set;

/**
 * A node in a rule tree.
 *
 * <p>
 * Atomic rules ({@link PatternRule}, {@link KindRule}, {@link RegexRule}, {@link NthChildRule},
 * {@link RangeRule}) test the node itself. Relational rules ({@link InsideRule}, {@link HasRule},
 * {@link PrecedesRule}, {@link FollowsRule}) test its surroundings. Composite rules ({@link
 * AllRule}, {@link AnyRule}, {@link NotRule}) combine other rules, and {@link MatchesRule} refers
 * to a named utility rule.
 *
 * <p>
 * Rules are immutable and thread-safe once built.
 */
public sealed interface Rule extends Matcher
        permits PatternRule,
                KindRule,
                RegexRule,
                NthChildRule,
                RangeRule,
                InsideRule,
                HasRule,
                PrecedesRule,
                FollowsRule,
                AllRule,
                AnyRule,
                NotRule,
                MatchesRule {

    /**
     * Whether this rule selects nodes by itself. A rule tree used as a rule's root must be positive,
     * otherwise it would have to be tried against every node with nothing to anchor it.
     */
    boolean isPositive();

    /** Names of meta-variables this rule can bind. */
    default Set<String> definedVariables() {
        return Set.of();
    }

    /**
     * Adds the ids of every utility rule referenced anywhere in this tree, relational sub-rules and
     * stop rules included.
     */
    default void collectReferents(Set<String> ids) {}

    /**
     * Whether {@code id} can be reached from this rule through composite and {@code matches}
     * nesting. Relational rules consume a different node, so they never close a cycle.
     */
    default boolean refersTo(String id) {
        return false;
    }
}
