package io.treexform.core.error;

/**
 * Raised when a {@code matches} reference is resolved after the registration scope it was bound
 * to has been closed. This is a programming error and is never recovered from.
 */
public final class RegistrationLivenessException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String referent;

    public RegistrationLivenessException(String referent) {
        super("Rule registration scope was closed before referent '" + referent + "' was resolved");
        this.referent = referent;
    }

    public String referent() {
        return referent;
    }
}
