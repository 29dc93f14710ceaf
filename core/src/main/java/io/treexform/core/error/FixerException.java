package io.treexform.core.error;

/** Thrown when a fix cannot be built, e.g. a template that is not valid code in the rule's language. */
public final class FixerException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    public FixerException(String message) {
        super(message, null, null);
    }

    public FixerException(String message, Throwable cause) {
        super(message, cause, null, null);
    }
}
