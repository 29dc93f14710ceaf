package io.treexform.core.error;

/** Thrown when a rule document has invalid syntax, unknown keys or missing required fields. */
public final class RuleParseException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    public RuleParseException(String message, String ruleId, String source) {
        super(message, ruleId, source);
    }

    public RuleParseException(String message, Throwable cause, String ruleId, String source) {
        super(message, cause, ruleId, source);
    }
}
