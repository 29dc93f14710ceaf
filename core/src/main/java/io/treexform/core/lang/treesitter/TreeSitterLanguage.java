package io.treexform.core.lang.treesitter;

import io.treexform.core.spi.InputEdit;
import io.treexform.core.spi.Language;
import io.treexform.core.spi.ParsedTree;
import java.util.Objects;
import org.treesitter.TSInputEdit;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;

/**
 * {@link Language} backed by a tree-sitter grammar through the {@code org.treesitter} JNI binding.
 *
 * <p>
 * A {@link TSParser} is not thread-safe, so one is created per parse call. The grammar object
 * itself is immutable and shared.
 */
public final class TreeSitterLanguage implements Language {

    /** Symbol tree-sitter assigns to error nodes. */
    static final int ERROR_SYMBOL = 65535;

    private final String id;
    private final TSLanguage grammar;
    private final char expandoChar;

    /**
     * Wraps a tree-sitter grammar.
     *
     * @param id          language identifier used by rule documents
     * @param grammar     the tree-sitter grammar
     * @param expandoChar character meta-variables are rewritten to before parsing
     */
    public TreeSitterLanguage(String id, TSLanguage grammar, char expandoChar) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        this.expandoChar = expandoChar;
    }

    /** JavaScript, whose identifiers accept {@code $} so patterns parse unchanged. */
    public static TreeSitterLanguage javascript() {
        return new TreeSitterLanguage("javascript", new TreeSitterJavascript(), '$');
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ParsedTree parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new TreeSitterParsedTree(newParser().parseString(null, source));
    }

    @Override
    public ParsedTree reparse(ParsedTree previous, String source, InputEdit edit) {
        Objects.requireNonNull(source, "source must not be null");
        if (!(previous instanceof TreeSitterParsedTree parsed)) {
            return parse(source);
        }
        TSTree old = parsed.tree();
        old.edit(new TSInputEdit(
                edit.startByte(),
                edit.oldEndByte(),
                edit.newEndByte(),
                toPoint(edit.start()),
                toPoint(edit.oldEnd()),
                toPoint(edit.newEnd())));
        return new TreeSitterParsedTree(newParser().parseString(old, source));
    }

    @Override
    public int kindId(String kindName) {
        if (kindName == null || kindName.isEmpty()) {
            return 0;
        }
        if ("ERROR".equals(kindName)) {
            return ERROR_SYMBOL;
        }
        return grammar.symbolForName(kindName, true);
    }

    @Override
    public String kindName(int kindId) {
        if (kindId == ERROR_SYMBOL) {
            return "ERROR";
        }
        return grammar.symbolName(kindId);
    }

    @Override
    public int fieldId(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return 0;
        }
        return grammar.fieldIdForName(fieldName);
    }

    @Override
    public String fieldName(int fieldId) {
        return fieldId == 0 ? null : grammar.fieldNameForId(fieldId);
    }

    @Override
    public char expandoChar() {
        return expandoChar;
    }

    @Override
    public String toString() {
        return "TreeSitterLanguage[" + id + "]";
    }

    private TSParser newParser() {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(grammar)) {
            throw new IllegalStateException("Incompatible tree-sitter grammar for language '" + id + "'");
        }
        return parser;
    }

    private static TSPoint toPoint(InputEdit.BytePoint point) {
        return new TSPoint(point.row(), point.column());
    }
}
