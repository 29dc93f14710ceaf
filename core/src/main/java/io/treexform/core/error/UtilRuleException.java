package io.treexform.core.error;

/** Thrown when a utility rule is undefined, registered twice or refers back to itself. */
public final class UtilRuleException extends RuleLoadException {

    private static final long serialVersionUID = 1L;

    /** Why the utility rule was rejected. */
    public enum Reason {
        UNDEFINED,
        DUPLICATE,
        CYCLIC
    }

    private final Reason reason;
    private final String utilId;

    public UtilRuleException(Reason reason, String utilId) {
        super(describe(reason, utilId), null, null);
        this.reason = reason;
        this.utilId = utilId;
    }

    public Reason reason() {
        return reason;
    }

    /** The id of the utility rule at fault. */
    public String utilId() {
        return utilId;
    }

    private static String describe(Reason reason, String utilId) {
        return switch (reason) {
            case UNDEFINED -> "Rule '" + utilId + "' is not defined";
            case DUPLICATE -> "Duplicate rule id '" + utilId + "' is found";
            case CYCLIC -> "Rule '" + utilId + "' has a cyclic dependency in its `matches` sub-rule";
        };
    }
}
