package io.treexform.core.transform;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.rule.RuleRegistration;
import java.util.Objects;
import java.util.Optional;

/**
 * Cuts out characters {@code [startChar, endChar)} of the source text. Negative indices count from
 * the end; out-of-range indices are clamped.
 */
public record Substring(String source, Integer startChar, Integer endChar) implements Trans {

    public Substring {
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public Optional<String> apply(MetaVarEnv env, RuleRegistration registration) {
        return SourceValue.of(env, source).map(this::compute);
    }

    String compute(String text) {
        int[] codePoints = text.codePoints().toArray();
        int length = codePoints.length;
        int start = resolve(startChar, 0, length);
        int end = resolve(endChar, length, length);
        if (start >= end) {
            return "";
        }
        return new String(codePoints, start, end - start);
    }

    private static int resolve(Integer index, int fallback, int length) {
        int value = index == null ? fallback : index;
        if (value >= length) {
            return length;
        }
        if (value >= 0) {
            return value;
        }
        return Math.max(0, length + value);
    }
}
