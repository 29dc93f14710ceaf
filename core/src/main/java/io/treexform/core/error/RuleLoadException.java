package io.treexform.core.error;

/**
 * Abstract parent for errors raised while a rule is being built. Thrown from {@code
 * RuleConfigParser}, {@code RuleCore.builder()} and {@code RuleEngine.loadRule()}. Carries an
 * additional {@code source} field identifying the file or resource that caused the error.
 */
public abstract class RuleLoadException extends TreeXformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RuleLoadException(String message, String ruleId, String source) {
        super(message, ruleId);
        this.source = source;
    }

    protected RuleLoadException(String message, Throwable cause, String ruleId, String source) {
        super(message, cause, ruleId);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} for in-memory rules. */
    public String source() {
        return source;
    }
}
