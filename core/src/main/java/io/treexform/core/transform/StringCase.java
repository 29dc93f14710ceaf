package io.treexform.core.transform;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Target case of a {@code convert} transformation. */
public enum StringCase {
    LOWER_CASE("lowerCase"),
    UPPER_CASE("upperCase"),
    CAPITALIZE("capitalize"),
    CAMEL_CASE("camelCase"),
    SNAKE_CASE("snakeCase"),
    KEBAB_CASE("kebabCase"),
    PASCAL_CASE("pascalCase");

    private final String id;

    StringCase(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Parses a case name as written in rule documents.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static StringCase parse(String value) {
        for (StringCase stringCase : values()) {
            if (stringCase.id.equals(value)) {
                return stringCase;
            }
        }
        throw new IllegalArgumentException("Unknown case '" + value + "'");
    }

    /**
     * Converts {@code text}. Lower case, upper case and capitalize work on the whole text; the
     * other cases split it into words at {@code separators} first and join the words again.
     *
     * @param text       the text to convert
     * @param separators where words are split, {@code null} for every separator
     * @return the converted text
     */
    public String apply(String text, Set<Separator> separators) {
        return switch (this) {
            case LOWER_CASE -> text.toLowerCase(Locale.ROOT);
            case UPPER_CASE -> text.toUpperCase(Locale.ROOT);
            case CAPITALIZE -> capitalize(text);
            case CAMEL_CASE, PASCAL_CASE, SNAKE_CASE, KEBAB_CASE -> joinWords(text, separators);
        };
    }

    private String joinWords(String text, Set<Separator> separators) {
        List<String> words = split(text, separators == null ? EnumSet.allOf(Separator.class) : separators);
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i).toLowerCase(Locale.ROOT);
            switch (this) {
                case CAMEL_CASE -> out.append(i == 0 ? word : capitalize(word));
                case PASCAL_CASE -> out.append(capitalize(word));
                case SNAKE_CASE -> out.append(i == 0 ? "" : "_").append(word);
                default -> out.append(i == 0 ? "" : "-").append(word);
            }
        }
        return out.toString();
    }

    /**
     * Splits {@code text} into words. Separator characters are dropped. A case change splits
     * {@code fooBar} into {@code foo} and {@code Bar}, and {@code XMLHttp} into {@code XML} and
     * {@code Http}.
     */
    static List<String> split(String text, Set<Separator> separators) {
        boolean caseChange = separators.contains(Separator.CASE_CHANGE);
        List<String> words = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Separator.isSeparator(c, separators)) {
                addWord(words, text, start, i);
                start = i + 1;
            } else if (caseChange && i > start && Character.isUpperCase(c)) {
                char previous = text.charAt(i - 1);
                boolean nextLower = i + 1 < text.length() && Character.isLowerCase(text.charAt(i + 1));
                if (Character.isLowerCase(previous) || Character.isDigit(previous)
                        || (Character.isUpperCase(previous) && nextLower)) {
                    addWord(words, text, start, i);
                    start = i;
                }
            }
            i++;
        }
        addWord(words, text, start, text.length());
        return words;
    }

    private static void addWord(List<String> words, String text, int start, int end) {
        if (end > start) {
            words.add(text.substring(start, end));
        }
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        int first = text.codePointAt(0);
        return new StringBuilder()
                .appendCodePoint(Character.toUpperCase(first))
                .append(text, Character.charCount(first), text.length())
                .toString();
    }
}
