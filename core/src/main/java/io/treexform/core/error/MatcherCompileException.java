package io.treexform.core.error;

/**
 * Thrown when an atomic matcher cannot be built: an unknown node kind, an invalid regular
 * expression, an unparsable {@code nthChild} position or an inverted range.
 */
public final class MatcherCompileException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    private final String matcherType;

    public MatcherCompileException(String message, String matcherType) {
        this(message, matcherType, null, null);
    }

    public MatcherCompileException(String message, String matcherType, String ruleId, String source) {
        super(message, ruleId, source);
        this.matcherType = matcherType;
    }

    public MatcherCompileException(String message, Throwable cause, String matcherType) {
        super(message, cause, null, null);
        this.matcherType = matcherType;
    }

    /** The rule key of the failing matcher, e.g. {@code kind} or {@code regex}. */
    public String matcherType() {
        return matcherType;
    }
}
