package io.treexform.core.transform;

import java.util.Set;

/** Where a {@code convert} transformation splits its input into words. */
public enum Separator {
    CASE_CHANGE("caseChange", '\0'),
    DASH("dash", '-'),
    DOT("dot", '.'),
    SLASH("slash", '/'),
    SPACE("space", ' '),
    UNDERSCORE("underscore", '_');

    private final String id;
    private final char character;

    Separator(String id, char character) {
        this.id = id;
        this.character = character;
    }

    public String id() {
        return id;
    }

    /**
     * Parses a separator name as written in rule documents.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Separator parse(String value) {
        for (Separator separator : values()) {
            if (separator.id.equals(value)) {
                return separator;
            }
        }
        throw new IllegalArgumentException("Unknown separator '" + value + "'");
    }

    static boolean isSeparator(char c, Set<Separator> separators) {
        for (Separator separator : separators) {
            if (separator != CASE_CHANGE && separator.character == c) {
                return true;
            }
        }
        return false;
    }
}
