package io.treexform.core.error;

/**
 * Thrown when a {@code transform} section is invalid: a transformation string that does not
 * parse, a source that is not a meta-variable, transforms that depend on each other in a cycle or
 * a rewrite that names an unknown rewriter.
 */
public final class TransformDefinitionException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    public TransformDefinitionException(String message) {
        super(message, null, null);
    }

    public TransformDefinitionException(String message, Throwable cause) {
        super(message, cause, null, null);
    }
}
