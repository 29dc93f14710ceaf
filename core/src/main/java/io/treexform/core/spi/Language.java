package io.treexform.core.spi;

/**
 * SPI for grammar backends. A language knows how to turn source text into a {@link ParsedTree}, how
 * to re-parse after an edit, and how to translate between node kind / field names and the numeric
 * ids used by its grammar.
 *
 * <p>
 * Implementations MUST be thread-safe: a single instance is shared by every pattern, rule and
 * document of that language. Kind id {@code 0} and field id {@code 0} mean "unknown".
 */
public interface Language {

    /**
     * Returns the language identifier used in rule documents (e.g. {@code "javascript"}).
     *
     * @return a non-null, non-empty identifier
     */
    String id();

    /**
     * Parses source text from scratch.
     *
     * @param source the full source text
     * @return the backend tree, never null (syntax errors are reported as error nodes)
     */
    ParsedTree parse(String source);

    /**
     * Re-parses source text after an edit, reusing the unchanged parts of {@code previous}.
     *
     * @param previous the tree parsed from the text before the edit
     * @param source   the full source text after the edit
     * @param edit     the changed region, in bytes and byte points
     * @return the new backend tree
     */
    ParsedTree reparse(ParsedTree previous, String source, InputEdit edit);

    /** Resolves a named node kind to its id, or {@code 0} if the grammar has no such kind. */
    int kindId(String kindName);

    /** Resolves a kind id to its name, or {@code null} for an out-of-range id. */
    String kindName(int kindId);

    /** Resolves a field name to its id, or {@code 0} if the grammar has no such field. */
    int fieldId(String fieldName);

    /** Resolves a field id to its name, or {@code null} for an unknown id. */
    String fieldName(int fieldId);

    /** The character that introduces meta-variables in patterns and templates. */
    default char metaVarChar() {
        return '$';
    }

    /**
     * The character meta-variables are rewritten to before a pattern is parsed. Languages whose
     * identifiers cannot contain {@link #metaVarChar()} return an identifier character here.
     */
    default char expandoChar() {
        return metaVarChar();
    }

    /**
     * Rewrites pattern text into something the grammar accepts. The default replaces every
     * meta-variable prefix with {@link #expandoChar()} when the two characters differ.
     *
     * @param pattern raw pattern or template text
     * @return text ready to be parsed
     */
    default String preProcessPattern(String pattern) {
        char meta = metaVarChar();
        char expando = expandoChar();
        if (meta == expando) {
            return pattern;
        }
        StringBuilder out = new StringBuilder(pattern.length());
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == meta && i + 1 < pattern.length() && isMetaVarFollower(pattern.charAt(i + 1), meta)) {
                out.append(expando);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static boolean isMetaVarFollower(char c, char meta) {
        return c == meta || c == '_' || (c >= 'A' && c <= 'Z');
    }
}
