package io.treexform.core.error;

/**
 * Abstract base for all tree-xform exceptions. Never thrown directly, use the concrete subclasses
 * under {@link RuleLoadException}.
 */
public abstract class TreeXformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String ruleId;

    protected TreeXformException(String message, String ruleId) {
        super(message);
        this.ruleId = ruleId;
    }

    protected TreeXformException(String message, Throwable cause, String ruleId) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    /** The rule that triggered the error, or {@code null} if not yet identified. */
    public String ruleId() {
        return ruleId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
