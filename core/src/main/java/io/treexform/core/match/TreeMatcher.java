package io.treexform.core.match;

import io.treexform.core.match.MatchStrictness.Comparison;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.meta.MetaVariable;
import io.treexform.core.tree.Node;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches a {@link PatternNode} tree against a candidate node.
 *
 * <p>
 * Pattern and candidate descend together. Sibling lists are walked left to right and the
 * strictness decides which unmatched goals or candidates may be skipped. The only backtracking
 * point is an ellipsis: each split of the remaining candidates between the ellipsis and the goals
 * after it is tried, shortest first, each on its own copy of the environment. A step budget bounds
 * the work when several ellipses share one list.
 *
 * <p>
 * One instance serves one root match and is not thread-safe.
 */
final class TreeMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(TreeMatcher.class);

    private final MatchStrictness strictness;
    private final int maxSteps;
    private int steps;

    TreeMatcher(MatchStrictness strictness, int maxSteps) {
        this.strictness = strictness;
        this.maxSteps = maxSteps;
    }

    boolean matchRoot(PatternNode goal, Node candidate, MetaVarEnv env) {
        MetaVarEnv work = env.copy();
        try {
            if (compare(goal, candidate, work) != Comparison.MATCHED_BOTH) {
                return false;
            }
        } catch (BudgetExhausted e) {
            LOG.debug("Ellipsis budget exhausted: node={}, steps={}", candidate, steps);
            return false;
        }
        env.absorb(work);
        return true;
    }

    /** Compares one goal with one candidate; {@code env} changes only on {@code MATCHED_BOTH}. */
    private Comparison compare(PatternNode goal, Node candidate, MetaVarEnv env) {
        if (goal instanceof PatternNode.Terminal terminal) {
            return strictness.matchTerminal(terminal.named(), terminal.text(), terminal.kindId(), candidate);
        }
        if (goal instanceof PatternNode.MetaVar metaVar) {
            if (matchMetaVar(metaVar.variable(), candidate, env)) {
                return Comparison.MATCHED_BOTH;
            }
            return strictness.shouldSkipCandidate(candidate) ? Comparison.SKIP_CANDIDATE : Comparison.NO_MATCH;
        }
        PatternNode.Internal internal = (PatternNode.Internal) goal;
        if (MatchStrictness.kindsMatch(internal.kindId(), candidate.kindId())) {
            MetaVarEnv attempt = env.copy();
            if (matchSiblings(internal.children(), 0, candidate.children(), 0, attempt)) {
                env.absorb(attempt);
                return Comparison.MATCHED_BOTH;
            }
        }
        return strictness.shouldSkipCandidate(candidate) ? Comparison.SKIP_CANDIDATE : Comparison.NO_MATCH;
    }

    private boolean matchMetaVar(MetaVariable variable, Node candidate, MetaVarEnv env) {
        if (variable instanceof MetaVariable.Capture capture) {
            if (capture.named() && !candidate.isNamed()) {
                return false;
            }
            return env.insert(capture.captureName(), candidate);
        }
        if (variable instanceof MetaVariable.Dropped dropped) {
            return !dropped.named() || candidate.isNamed();
        }
        if (variable instanceof MetaVariable.MultiCapture multi) {
            return env.insertMulti(multi.captureName(), List.of(candidate));
        }
        return true;
    }

    /**
     * Matches {@code goals[gi..]} against {@code candidates[ci..]}. May leave partial bindings in
     * {@code env} when it fails, so callers pass a copy.
     */
    private boolean matchSiblings(List<PatternNode> goals, int gi, List<Node> candidates, int ci, MetaVarEnv env) {
        while (true) {
            tick();
            if (gi == goals.size()) {
                for (int i = ci; i < candidates.size(); i++) {
                    if (!strictness.shouldSkipTrailing(candidates.get(i))) {
                        return false;
                    }
                }
                return true;
            }
            PatternNode goal = goals.get(gi);
            if (goal.isEllipsis()) {
                return matchEllipsis(goals, gi, candidates, ci, env);
            }
            if (ci == candidates.size()) {
                return matchRemainingGoalsEmpty(goals, gi, env);
            }
            switch (compare(goal, candidates.get(ci), env)) {
                case MATCHED_BOTH, SKIP_BOTH -> {
                    gi++;
                    ci++;
                }
                case SKIP_GOAL -> gi++;
                case SKIP_CANDIDATE -> ci++;
                default -> {
                    return false;
                }
            }
        }
    }

    private boolean matchEllipsis(List<PatternNode> goals, int gi, List<Node> candidates, int ci, MetaVarEnv env) {
        MetaVariable ellipsis = ((PatternNode.MetaVar) goals.get(gi)).variable();
        // a trailing ellipsis takes everything that is left
        int shortest = gi + 1 == goals.size() ? candidates.size() : ci;
        for (int end = shortest; end <= candidates.size(); end++) {
            tick();
            MetaVarEnv attempt = env.copy();
            if (bindEllipsis(ellipsis, candidates.subList(ci, end), attempt)
                    && matchSiblings(goals, gi + 1, candidates, end, attempt)) {
                env.absorb(attempt);
                return true;
            }
        }
        return false;
    }

    private boolean matchRemainingGoalsEmpty(List<PatternNode> goals, int gi, MetaVarEnv env) {
        for (int i = gi; i < goals.size(); i++) {
            PatternNode goal = goals.get(i);
            if (goal instanceof PatternNode.MetaVar metaVar && goal.isEllipsis()) {
                if (!bindEllipsis(metaVar.variable(), List.of(), env)) {
                    return false;
                }
            } else if (!strictness.shouldSkipGoal(goal)) {
                return false;
            }
        }
        return true;
    }

    /** Ellipsis captures keep named nodes only. */
    private static boolean bindEllipsis(MetaVariable ellipsis, List<Node> consumed, MetaVarEnv env) {
        if (!(ellipsis instanceof MetaVariable.MultiCapture multi)) {
            return true;
        }
        List<Node> named = new ArrayList<>(consumed.size());
        for (Node node : consumed) {
            if (node.isNamed()) {
                named.add(node);
            }
        }
        return env.insertMulti(multi.captureName(), named);
    }

    private void tick() {
        if (++steps > maxSteps) {
            throw new BudgetExhausted();
        }
    }

    /** Unwinds the whole root match once the step budget is spent. */
    private static final class BudgetExhausted extends RuntimeException {

        private static final long serialVersionUID = 1L;

        BudgetExhausted() {
            super(null, null, false, false);
        }
    }
}
