package io.treexform.core.tree;

import io.treexform.core.spi.Language;
import io.treexform.core.spi.ParsedTree;
import io.treexform.core.spi.RawNode;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;

/**
 * Immutable snapshot of one parse. Nodes are stored in pre-order in parallel arrays, so a node's
 * subtree is the contiguous index range {@code [index, subtreeEnd(index))} and its first child (if
 * any) is {@code index + 1}.
 *
 * <p>
 * A snapshot never changes after it is built. Editing a {@link Document} builds a new snapshot;
 * {@link Node}s obtained from an older one keep reading the text and structure they were found in.
 */
public final class SyntaxTree {

    private final Language language;
    private final SourceText source;
    private final ParsedTree parsed;
    private final Document document;
    private final int generation;

    private final int size;
    private final int[] kindIds;
    private final String[] kinds;
    private final boolean[] named;
    private final boolean[] missing;
    private final boolean[] error;
    private final boolean[] errorInSubtree;
    private final int[] startBytes;
    private final int[] endBytes;
    private final int[] parents;
    private final int[] prevSiblings;
    private final int[] subtreeEnds;
    private final int[] childCounts;
    private final int[] fieldIds;

    private SyntaxTree(Language language, SourceText source, ParsedTree parsed, Document document, int generation) {
        this.language = language;
        this.source = source;
        this.parsed = parsed;
        this.document = document;
        this.generation = generation;

        Builder builder = new Builder(language);
        builder.addTree(parsed.root());
        this.size = builder.size;
        this.kindIds = Arrays.copyOf(builder.kindIds, size);
        this.kinds = Arrays.copyOf(builder.kinds, size);
        this.named = Arrays.copyOf(builder.named, size);
        this.missing = Arrays.copyOf(builder.missing, size);
        this.error = Arrays.copyOf(builder.error, size);
        this.errorInSubtree = Arrays.copyOf(builder.errorInSubtree, size);
        this.startBytes = Arrays.copyOf(builder.startBytes, size);
        this.endBytes = Arrays.copyOf(builder.endBytes, size);
        this.parents = Arrays.copyOf(builder.parents, size);
        this.prevSiblings = Arrays.copyOf(builder.prevSiblings, size);
        this.subtreeEnds = Arrays.copyOf(builder.subtreeEnds, size);
        this.childCounts = Arrays.copyOf(builder.childCounts, size);
        this.fieldIds = Arrays.copyOf(builder.fieldIds, size);
    }

    /**
     * Parses {@code text} and snapshots the result, detached from any {@link Document}.
     *
     * @param language the grammar to parse with
     * @param text     source text
     * @return the snapshot
     */
    public static SyntaxTree parse(Language language, String text) {
        Objects.requireNonNull(language, "language must not be null");
        SourceText source = SourceText.of(text);
        return new SyntaxTree(language, source, language.parse(text), null, 0);
    }

    static SyntaxTree snapshot(
            Language language, SourceText source, ParsedTree parsed, Document document, int generation) {
        return new SyntaxTree(language, source, parsed, document, generation);
    }

    public Language language() {
        return language;
    }

    public SourceText source() {
        return source;
    }

    /** The owning document, or {@code null} for a detached snapshot. */
    public Document document() {
        return document;
    }

    /** Number of edits applied to the owning document before this snapshot was taken. */
    public int generation() {
        return generation;
    }

    public Node root() {
        return new Node(this, 0);
    }

    /** Number of nodes in the snapshot. */
    public int size() {
        return size;
    }

    /** True if the parse contains error or missing nodes anywhere. */
    public boolean hasError() {
        return errorInSubtree[0];
    }

    ParsedTree parsed() {
        return parsed;
    }

    // --- Per-node accessors used by Node ---

    int kindId(int index) {
        return kindIds[index];
    }

    String kind(int index) {
        return kinds[index];
    }

    boolean isNamed(int index) {
        return named[index];
    }

    boolean isMissing(int index) {
        return missing[index];
    }

    boolean isError(int index) {
        return error[index];
    }

    boolean hasErrorInSubtree(int index) {
        return errorInSubtree[index];
    }

    int startByte(int index) {
        return startBytes[index];
    }

    int endByte(int index) {
        return endBytes[index];
    }

    int parent(int index) {
        return parents[index];
    }

    int prevSibling(int index) {
        return prevSiblings[index];
    }

    int nextSibling(int index) {
        int parent = parents[index];
        if (parent < 0) {
            return -1;
        }
        int next = subtreeEnds[index];
        return next < subtreeEnds[parent] ? next : -1;
    }

    int subtreeEnd(int index) {
        return subtreeEnds[index];
    }

    int childCount(int index) {
        return childCounts[index];
    }

    int fieldId(int index) {
        return fieldIds[index];
    }

    /** Collects a backend tree into growable parallel arrays. */
    private static final class Builder {

        private final Language language;
        private int size;
        private int[] kindIds = new int[64];
        private String[] kinds = new String[64];
        private boolean[] named = new boolean[64];
        private boolean[] missing = new boolean[64];
        private boolean[] error = new boolean[64];
        private boolean[] errorInSubtree = new boolean[64];
        private int[] startBytes = new int[64];
        private int[] endBytes = new int[64];
        private int[] parents = new int[64];
        private int[] prevSiblings = new int[64];
        private int[] subtreeEnds = new int[64];
        private int[] childCounts = new int[64];
        private int[] fieldIds = new int[64];

        Builder(Language language) {
            this.language = language;
        }

        /**
         * Adds {@code root} and its subtree in pre-order. Uses an explicit stack, so nesting depth
         * is limited by memory only.
         */
        void addTree(RawNode root) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(open(root, -1, 0, -1));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.nextChild < frame.childCount) {
                    int i = frame.nextChild++;
                    String field = frame.raw.fieldNameForChild(i);
                    int childField = field == null ? 0 : language.fieldId(field);
                    Frame child = open(frame.raw.child(i), frame.index, childField, frame.previousChild);
                    frame.previousChild = child.index;
                    stack.push(child);
                    continue;
                }
                stack.pop();
                subtreeEnds[frame.index] = size;
                errorInSubtree[frame.index] = frame.hasError;
                Frame parent = stack.peek();
                if (parent != null) {
                    parent.hasError |= frame.hasError;
                }
            }
        }

        private Frame open(RawNode raw, int parent, int fieldId, int prevSibling) {
            int index = size++;
            ensureCapacity(size);
            kindIds[index] = raw.kindId();
            kinds[index] = raw.kind();
            named[index] = raw.isNamed();
            missing[index] = raw.isMissing();
            error[index] = raw.isError();
            startBytes[index] = raw.startByte();
            endBytes[index] = raw.endByte();
            parents[index] = parent;
            prevSiblings[index] = prevSibling;
            fieldIds[index] = fieldId;
            int count = raw.childCount();
            childCounts[index] = count;
            return new Frame(raw, index, count, error[index] || missing[index]);
        }

        private void ensureCapacity(int required) {
            if (required <= kindIds.length) {
                return;
            }
            int capacity = Math.max(required, kindIds.length * 2);
            kindIds = Arrays.copyOf(kindIds, capacity);
            kinds = Arrays.copyOf(kinds, capacity);
            named = Arrays.copyOf(named, capacity);
            missing = Arrays.copyOf(missing, capacity);
            error = Arrays.copyOf(error, capacity);
            errorInSubtree = Arrays.copyOf(errorInSubtree, capacity);
            startBytes = Arrays.copyOf(startBytes, capacity);
            endBytes = Arrays.copyOf(endBytes, capacity);
            parents = Arrays.copyOf(parents, capacity);
            prevSiblings = Arrays.copyOf(prevSiblings, capacity);
            subtreeEnds = Arrays.copyOf(subtreeEnds, capacity);
            childCounts = Arrays.copyOf(childCounts, capacity);
            fieldIds = Arrays.copyOf(fieldIds, capacity);
        }
    }

    /** A node whose children are still being added. */
    private static final class Frame {

        final RawNode raw;
        final int index;
        final int childCount;
        int nextChild;
        int previousChild = -1;
        boolean hasError;

        Frame(RawNode raw, int index, int childCount, boolean hasError) {
            this.raw = raw;
            this.index = index;
            this.childCount = childCount;
            this.hasError = hasError;
        }
    }
}
