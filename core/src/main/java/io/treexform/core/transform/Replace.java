package io.treexform.core.transform;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.rule.RuleRegistration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces every match of {@code replace} in the source text with {@code by}.
 *
 * <p>
 * {@code by} may refer to groups as {@code $1}, {@code $name}, {@code ${1}} or {@code ${name}}; the
 * reference takes the longest run of letters, digits and underscores. {@code $$} is a literal
 * dollar. A reference to a group the regex does not have expands to nothing, and a {@code $} that
 * starts no reference is kept as is, so applying a replacement never fails.
 */
public record Replace(String source, Pattern replace, String by) implements Trans {

    public Replace {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(replace, "replace must not be null");
        Objects.requireNonNull(by, "by must not be null");
    }

    @Override
    public Optional<String> apply(MetaVarEnv env, RuleRegistration registration) {
        return SourceValue.of(env, source).map(this::replaceAll);
    }

    /** Replaces every match of the regex in {@code text}. */
    public String replaceAll(String text) {
        Matcher matcher = replace.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        while (matcher.find()) {
            out.append(text, last, matcher.start());
            expand(matcher, out);
            last = matcher.end();
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    private void expand(Matcher matcher, StringBuilder out) {
        int i = 0;
        while (i < by.length()) {
            char c = by.charAt(i);
            if (c != '$' || i + 1 == by.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = by.charAt(i + 1);
            if (next == '$') {
                out.append('$');
                i += 2;
            } else if (next == '{') {
                int close = by.indexOf('}', i + 2);
                if (close < 0 || close == i + 2) {
                    out.append('$');
                    i++;
                } else {
                    out.append(group(matcher, by.substring(i + 2, close)));
                    i = close + 1;
                }
            } else {
                int end = i + 1;
                while (end < by.length() && isNameChar(by.charAt(end))) {
                    end++;
                }
                if (end == i + 1) {
                    out.append('$');
                    i++;
                } else {
                    out.append(group(matcher, by.substring(i + 1, end)));
                    i = end;
                }
            }
        }
    }

    private static String group(Matcher matcher, String name) {
        if (name.chars().allMatch(Character::isDigit)) {
            int index;
            try {
                index = Integer.parseInt(name);
            } catch (NumberFormatException e) {
                return "";
            }
            String value = index <= matcher.groupCount() ? matcher.group(index) : null;
            return value == null ? "" : value;
        }
        try {
            String value = matcher.group(name);
            return value == null ? "" : value;
        } catch (IllegalArgumentException e) {
            // no group with that name
            return "";
        }
    }

    private static boolean isNameChar(char c) {
        return c == '_' || (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
