package io.treexform.core.meta;

import java.util.Objects;
import java.util.Optional;

/**
 * A meta-variable found in a pattern or template.
 *
 * <p>
 * With {@code $} as the meta character:
 * <ul>
 * <li>{@code $NAME} captures one named node ({@link Capture} with {@code named = true})</li>
 * <li>{@code $$NAME} captures one node, named or not ({@link Capture} with {@code named = false})</li>
 * <li>{@code $_} and {@code $_NAME} match one node without capturing ({@link Dropped})</li>
 * <li>{@code $$$NAME} captures zero or more sibling nodes ({@link MultiCapture})</li>
 * <li>{@code $$$} and {@code $$$_NAME} match zero or more siblings without capturing ({@link Multiple})</li>
 * </ul>
 * Names start with an uppercase letter or {@code _} followed by uppercase letters, digits or
 * {@code _}.
 */
public sealed interface MetaVariable {

    /** True for the two ellipsis forms, which match a run of siblings. */
    default boolean isEllipsis() {
        return false;
    }

    /** The captured name, if this variable captures. */
    default Optional<String> name() {
        return Optional.empty();
    }

    /** Single-node capture. {@code named} restricts the match to named nodes. */
    record Capture(String captureName, boolean named) implements MetaVariable {
        public Capture {
            Objects.requireNonNull(captureName, "captureName must not be null");
        }

        @Override
        public Optional<String> name() {
            return Optional.of(captureName);
        }
    }

    /** Single-node wildcard that records nothing. */
    record Dropped(boolean named) implements MetaVariable {}

    /** Anonymous ellipsis. */
    record Multiple() implements MetaVariable {
        @Override
        public boolean isEllipsis() {
            return true;
        }
    }

    /** Capturing ellipsis. */
    record MultiCapture(String captureName) implements MetaVariable {
        public MultiCapture {
            Objects.requireNonNull(captureName, "captureName must not be null");
        }

        @Override
        public boolean isEllipsis() {
            return true;
        }

        @Override
        public Optional<String> name() {
            return Optional.of(captureName);
        }
    }

    /**
     * Interprets {@code text} as a meta-variable.
     *
     * @param text     the full text of a node or token
     * @param metaChar the meta character, usually {@code $}
     * @return the variable, or empty if {@code text} is ordinary code
     */
    static Optional<MetaVariable> parse(String text, char metaChar) {
        String ellipsis = String.valueOf(new char[] {metaChar, metaChar, metaChar});
        if (text.equals(ellipsis)) {
            return Optional.of(new Multiple());
        }
        if (text.startsWith(ellipsis)) {
            String rest = text.substring(3);
            if (!isValidName(rest)) {
                return Optional.empty();
            }
            return Optional.of(rest.startsWith("_") ? new Multiple() : new MultiCapture(rest));
        }
        if (text.isEmpty() || text.charAt(0) != metaChar) {
            return Optional.empty();
        }
        String rest = text.substring(1);
        boolean named = true;
        if (!rest.isEmpty() && rest.charAt(0) == metaChar) {
            rest = rest.substring(1);
            named = false;
        }
        if (!isValidName(rest)) {
            return Optional.empty();
        }
        return Optional.of(rest.startsWith("_") ? new Dropped(named) : new Capture(rest, named));
    }

    private static boolean isValidName(String name) {
        if (name.isEmpty() || !isValidFirstChar(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isValidFirstChar(c) && !(c >= '0' && c <= '9')) {
                return false;
            }
        }
        return true;
    }

    private static boolean isValidFirstChar(char c) {
        return (c >= 'A' && c <= 'Z') || c == '_';
    }
}
