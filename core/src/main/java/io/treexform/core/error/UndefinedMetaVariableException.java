package io.treexform.core.error;

/**
 * Thrown when a constraint, transform, fix or message refers to a meta-variable that the rule
 * never captures or computes.
 */
public final class UndefinedMetaVariableException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    private final String variable;
    private final String section;

    public UndefinedMetaVariableException(String variable, String section) {
        super("Undefined meta-variable '" + variable + "' used in " + section, null, null);
        this.variable = variable;
        this.section = section;
    }

    public String variable() {
        return variable;
    }

    /** The rule section that uses the variable, e.g. {@code fix} or {@code constraints}. */
    public String section() {
        return section;
    }
}
