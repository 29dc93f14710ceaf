package io.treexform.core.tree;

import io.treexform.core.spi.InputEdit;
import io.treexform.core.spi.Language;
import io.treexform.core.spi.ParsedTree;
import java.util.List;
import java.util.Objects;

/**
 * Source text together with its current syntax tree.
 *
 * <p>
 * The document is only changed through {@link #edit(Edit)} and {@link #applyEdits(List)}, which
 * splice the text, tell the grammar backend which region changed, re-parse incrementally and
 * install a new {@link SyntaxTree} snapshot. Snapshots handed out earlier are never modified.
 *
 * <p>
 * Not thread-safe: a document must not be edited concurrently.
 */
public final class Document {

    private final Language language;
    private SyntaxTree tree;

    private Document(Language language, String text) {
        this.language = language;
        SourceText source = SourceText.of(text);
        this.tree = SyntaxTree.snapshot(language, source, language.parse(text), this, 0);
    }

    /**
     * Parses {@code text} into a new document.
     *
     * @param language the grammar backend
     * @param text     source text
     * @return the document at generation {@code 0}
     */
    public static Document parse(Language language, String text) {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(text, "text must not be null");
        return new Document(language, text);
    }

    public Language language() {
        return language;
    }

    public String text() {
        return tree.source().text();
    }

    /** The latest snapshot. */
    public SyntaxTree tree() {
        return tree;
    }

    public Node root() {
        return tree.root();
    }

    public int generation() {
        return tree.generation();
    }

    /** Applies one edit and re-parses. */
    public void edit(Edit edit) {
        applyEdits(List.of(Objects.requireNonNull(edit, "edit must not be null")));
    }

    /**
     * Applies position-ordered, non-overlapping edits as one change and re-parses once.
     *
     * @param edits edits whose byte positions refer to the current text
     * @throws IllegalArgumentException if the edits overlap, are out of order or out of bounds
     */
    public void applyEdits(List<Edit> edits) {
        Objects.requireNonNull(edits, "edits must not be null");
        if (edits.isEmpty()) {
            return;
        }
        SourceText old = tree.source();
        int cursor = 0;
        StringBuilder text = new StringBuilder(old.text().length());
        for (Edit edit : edits) {
            if (edit.position() < cursor) {
                throw new IllegalArgumentException("Edits overlap or are out of order at byte " + edit.position());
            }
            if (edit.endPosition() > old.byteLength()) {
                throw new IllegalArgumentException(
                        "Edit end " + edit.endPosition() + " exceeds document length " + old.byteLength());
            }
            text.append(old.slice(cursor, edit.position())).append(edit.insertedText());
            cursor = edit.endPosition();
        }
        text.append(old.slice(cursor, old.byteLength()));

        Edit first = edits.get(0);
        Edit last = edits.get(edits.size() - 1);
        SourceText updated = SourceText.of(text.toString());
        int startByte = first.position();
        int oldEndByte = last.endPosition();
        int newEndByte = oldEndByte + updated.byteLength() - old.byteLength();
        InputEdit inputEdit = new InputEdit(
                startByte,
                oldEndByte,
                newEndByte,
                old.bytePoint(startByte),
                old.bytePoint(oldEndByte),
                updated.bytePoint(newEndByte));
        ParsedTree parsed = language.reparse(tree.parsed(), updated.text(), inputEdit);
        tree = SyntaxTree.snapshot(language, updated, parsed, this, tree.generation() + 1);
    }
}
