package io.treexform.core.rule;

import java.util.Locale;

/** How a rule's matches are reported. {@link #OFF} disables the rule. */
public enum Severity {
    HINT,
    INFO,
    WARNING,
    ERROR,
    OFF;

    /**
     * Parses a severity as written in rule documents.
     *
     * @throws IllegalArgumentException for an unknown value
     */
    public static Severity parse(String value) {
        for (Severity severity : values()) {
            if (severity.id().equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity '" + value + "', expected one of: hint, info, warning, error, off");
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
