package io.treexform.core.rule;

import io.treexform.core.error.MatcherCompileException;
import java.util.Locale;

/**
 * A 1-based sibling position in {@code An+B} form. {@code step == 0} means the exact position
 * {@code offset}.
 */
public record NthChildPosition(int step, int offset) {

    /** Exact position {@code index}, which must be at least 1. */
    public static NthChildPosition exact(int index) {
        if (index < 1) {
            throw new MatcherCompileException("nthChild position must be positive: " + index, "nthChild");
        }
        return new NthChildPosition(0, index);
    }

    /**
     * Parses {@code odd}, {@code even}, a positive integer, or a formula such as {@code 2n+1},
     * {@code -n+3} or {@code 3n}.
     *
     * @throws MatcherCompileException if the text is none of those
     */
    public static NthChildPosition parse(String text) {
        String compact = text.replace(" ", "").toLowerCase(Locale.ROOT);
        if (compact.equals("odd")) {
            return new NthChildPosition(2, 1);
        }
        if (compact.equals("even")) {
            return new NthChildPosition(2, 0);
        }
        try {
            int n = compact.indexOf('n');
            if (n < 0) {
                return exact(Integer.parseInt(compact));
            }
            String coefficient = compact.substring(0, n);
            int step;
            if (coefficient.isEmpty() || coefficient.equals("+")) {
                step = 1;
            } else if (coefficient.equals("-")) {
                step = -1;
            } else {
                step = Integer.parseInt(coefficient);
            }
            String rest = compact.substring(n + 1);
            int offset = rest.isEmpty() ? 0 : Integer.parseInt(rest.startsWith("+") ? rest.substring(1) : rest);
            return new NthChildPosition(step, offset);
        } catch (NumberFormatException e) {
            throw new MatcherCompileException("Invalid nthChild position '" + text + "'", e, "nthChild");
        }
    }

    /** Whether 1-based {@code index} is {@code step * k + offset} for some {@code k >= 0}. */
    public boolean matches(int index) {
        if (step == 0) {
            return index == offset;
        }
        int diff = index - offset;
        return diff % step == 0 && diff / step >= 0;
    }
}
