package io.treexform.core.error;

/** Thrown when a pattern is empty, does not parse cleanly or does not reduce to a single node. */
public final class PatternParseException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    private final String pattern;

    public PatternParseException(String message, String pattern) {
        super(message + ": '" + pattern + "'", null, null);
        this.pattern = pattern;
    }

    /** The offending pattern text. */
    public String pattern() {
        return pattern;
    }
}
