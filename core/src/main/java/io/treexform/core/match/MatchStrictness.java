package io.treexform.core.match;

import io.treexform.core.meta.MetaVariable;
import io.treexform.core.tree.Node;
import java.util.Locale;

/**
 * How closely a pattern must follow the candidate's concrete syntax. Each level decides which
 * pattern nodes (goals) and which candidate nodes may be passed over when they do not match.
 */
public enum MatchStrictness {
    /** Every node, punctuation included, must match. */
    CST,
    /** Unnamed candidate tokens may be skipped. The default. */
    SMART,
    /** Unnamed tokens on either side may be skipped. */
    AST,
    /** Like {@link #AST}, and candidate comments may be skipped too. */
    RELAXED,
    /** Like {@link #RELAXED}, and terminal text is ignored when kinds agree. */
    SIGNATURE;

    /** Outcome of comparing one pattern node with one candidate node. */
    enum Comparison {
        MATCHED_BOTH,
        SKIP_BOTH,
        SKIP_GOAL,
        SKIP_CANDIDATE,
        NO_MATCH
    }

    /**
     * Parses a strictness name as written in rule documents ({@code cst}, {@code smart}, ...).
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static MatchStrictness parse(String value) {
        if (value != null) {
            for (MatchStrictness strictness : values()) {
                if (strictness.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return strictness;
                }
            }
        }
        throw new IllegalArgumentException(
                "Invalid strictness '" + value + "', valid options are: cst, smart, ast, relaxed, signature");
    }

    /** The name used in rule documents. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    Comparison matchTerminal(boolean goalNamed, String goalText, int goalKind, Node candidate) {
        boolean kindMatched = kindsMatch(goalKind, candidate.kindId());
        // unnamed tokens compare by kind only; some grammars report odd spans for them
        if (kindMatched && (!goalNamed || goalText.equals(candidate.text()))) {
            return Comparison.MATCHED_BOTH;
        }
        if (this == SIGNATURE && kindMatched) {
            return Comparison.MATCHED_BOTH;
        }
        boolean skipGoal = switch (this) {
            case CST, SMART -> false;
            case AST, RELAXED, SIGNATURE -> !goalNamed;
        };
        boolean skipCandidate = switch (this) {
            case CST -> false;
            case SMART, AST -> !candidate.isNamed();
            case RELAXED, SIGNATURE -> isCommentOrUnnamed(candidate);
        };
        if (skipGoal) {
            return skipCandidate ? Comparison.SKIP_BOTH : Comparison.SKIP_GOAL;
        }
        return skipCandidate ? Comparison.SKIP_CANDIDATE : Comparison.NO_MATCH;
    }

    /** Whether a candidate that failed to match a non-terminal goal may be passed over. */
    boolean shouldSkipCandidate(Node candidate) {
        return switch (this) {
            case CST -> false;
            case SMART, AST -> !candidate.isNamed();
            case RELAXED, SIGNATURE -> isCommentOrUnnamed(candidate);
        };
    }

    /** Whether a candidate left over after every goal matched may be ignored. */
    boolean shouldSkipTrailing(Node candidate) {
        return switch (this) {
            case CST, AST -> false;
            case SMART -> true;
            case RELAXED, SIGNATURE -> isCommentOrUnnamed(candidate);
        };
    }

    /** Whether a goal left over after every candidate was consumed may be ignored. */
    boolean shouldSkipGoal(PatternNode goal) {
        if (goal instanceof PatternNode.MetaVar metaVar) {
            MetaVariable variable = metaVar.variable();
            if (variable.isEllipsis()) {
                return true;
            }
            if (this == CST || this == SMART) {
                return false;
            }
            if (variable instanceof MetaVariable.Capture capture) {
                return !capture.named();
            }
            return variable instanceof MetaVariable.Dropped dropped && !dropped.named();
        }
        if (goal instanceof PatternNode.Terminal terminal) {
            return this != CST && this != SMART && !terminal.named();
        }
        return false;
    }

    static boolean kindsMatch(int goalKind, int candidateKind) {
        return goalKind == candidateKind || goalKind == PatternNode.ERROR_KIND;
    }

    private static boolean isCommentOrUnnamed(Node node) {
        return !node.isNamed() || node.isComment();
    }
}
