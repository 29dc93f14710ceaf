package io.treexform.core.tree;

import io.treexform.core.match.Matcher;
import io.treexform.core.match.NodeMatch;
import io.treexform.core.replace.Fixer;
import io.treexform.core.spi.Language;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A handle on one node of a {@link SyntaxTree} snapshot.
 *
 * <p>
 * Nodes are cheap values: two handles are equal when they point at the same index of the same
 * snapshot. A node keeps observing its own snapshot after the owning {@link Document} is edited;
 * {@link #isCurrent()} tells whether that snapshot is still the document's latest.
 */
public final class Node {

    private final SyntaxTree tree;
    private final int index;

    Node(SyntaxTree tree, int index) {
        this.tree = tree;
        this.index = index;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public Language language() {
        return tree.language();
    }

    /** Pre-order index of this node within its snapshot. */
    public int index() {
        return index;
    }

    // --- Kind and flags ---

    public int kindId() {
        return tree.kindId(index);
    }

    public String kind() {
        return tree.kind(index);
    }

    public boolean isNamed() {
        return tree.isNamed(index);
    }

    public boolean isMissing() {
        return tree.isMissing(index);
    }

    public boolean isError() {
        return tree.isError(index);
    }

    /** True if this node or any descendant is an error or missing node. */
    public boolean hasError() {
        return tree.hasErrorInSubtree(index);
    }

    public boolean isLeaf() {
        return tree.childCount(index) == 0;
    }

    public boolean isNamedLeaf() {
        return isNamed() && isLeaf();
    }

    /** Comment nodes are recognised by kind name, which every tree-sitter grammar follows. */
    public boolean isComment() {
        return kind().contains("comment");
    }

    // --- Text and location ---

    public String text() {
        return tree.source().slice(startByte(), endByte());
    }

    public int startByte() {
        return tree.startByte(index);
    }

    public int endByte() {
        return tree.endByte(index);
    }

    public Position start() {
        return tree.source().position(startByte());
    }

    public Position end() {
        return tree.source().position(endByte());
    }

    // --- Navigation ---

    public Optional<Node> parent() {
        int parent = tree.parent(index);
        return parent < 0 ? Optional.empty() : Optional.of(new Node(tree, parent));
    }

    public int childCount() {
        return tree.childCount(index);
    }

    public Node child(int position) {
        if (position < 0 || position >= childCount()) {
            throw new IndexOutOfBoundsException("child " + position + " of " + childCount());
        }
        int child = index + 1;
        for (int i = 0; i < position; i++) {
            child = tree.subtreeEnd(child);
        }
        return new Node(tree, child);
    }

    public List<Node> children() {
        int count = childCount();
        if (count == 0) {
            return List.of();
        }
        List<Node> children = new ArrayList<>(count);
        int child = index + 1;
        for (int i = 0; i < count; i++) {
            children.add(new Node(tree, child));
            child = tree.subtreeEnd(child);
        }
        return children;
    }

    public List<Node> namedChildren() {
        List<Node> named = new ArrayList<>();
        for (Node child : children()) {
            if (child.isNamed()) {
                named.add(child);
            }
        }
        return named;
    }

    public Optional<Node> next() {
        int next = tree.nextSibling(index);
        return next < 0 ? Optional.empty() : Optional.of(new Node(tree, next));
    }

    public Optional<Node> prev() {
        int prev = tree.prevSibling(index);
        return prev < 0 ? Optional.empty() : Optional.of(new Node(tree, prev));
    }

    /** Following siblings, nearest first. */
    public List<Node> nextAll() {
        List<Node> siblings = new ArrayList<>();
        for (int next = tree.nextSibling(index); next >= 0; next = tree.nextSibling(next)) {
            siblings.add(new Node(tree, next));
        }
        return siblings;
    }

    /** Preceding siblings, nearest first. */
    public List<Node> prevAll() {
        List<Node> siblings = new ArrayList<>();
        for (int prev = tree.prevSibling(index); prev >= 0; prev = tree.prevSibling(prev)) {
            siblings.add(new Node(tree, prev));
        }
        return siblings;
    }

    /** Ancestors, nearest first, ending with the root. */
    public List<Node> ancestors() {
        List<Node> ancestors = new ArrayList<>();
        for (int parent = tree.parent(index); parent >= 0; parent = tree.parent(parent)) {
            ancestors.add(new Node(tree, parent));
        }
        return ancestors;
    }

    /** This node and all its descendants in pre-order. */
    public List<Node> dfs() {
        int end = tree.subtreeEnd(index);
        List<Node> nodes = new ArrayList<>(end - index);
        for (int i = index; i < end; i++) {
            nodes.add(new Node(tree, i));
        }
        return nodes;
    }

    /** True if {@code other} lies in this node's subtree (a node contains itself). */
    public boolean contains(Node other) {
        return other.tree == tree && other.index >= index && other.index < tree.subtreeEnd(index);
    }

    /** Id of the field this node occupies in its parent, or {@code 0}. */
    public int fieldId() {
        return tree.fieldId(index);
    }

    public Optional<String> fieldName() {
        int field = fieldId();
        return field == 0 ? Optional.empty() : Optional.ofNullable(language().fieldName(field));
    }

    /** Children stored under the named field, in order. */
    public List<Node> childrenByField(String fieldName) {
        int field = language().fieldId(fieldName);
        if (field == 0) {
            return List.of();
        }
        List<Node> matching = new ArrayList<>();
        for (Node child : children()) {
            if (child.fieldId() == field) {
                matching.add(child);
            }
        }
        return matching;
    }

    public Optional<Node> childByField(String fieldName) {
        List<Node> matching = childrenByField(fieldName);
        return matching.isEmpty() ? Optional.empty() : Optional.of(matching.get(0));
    }

    // --- Matching ---

    /** Matches {@code matcher} against this node only. */
    public Optional<NodeMatch> match(Matcher matcher) {
        return matcher.match(this);
    }

    /** First match of {@code matcher} in this subtree, in pre-order. */
    public Optional<NodeMatch> find(Matcher matcher) {
        BitSet kinds = matcher.potentialKinds();
        int end = tree.subtreeEnd(index);
        for (int i = index; i < end; i++) {
            if (kinds != null && !kinds.get(tree.kindId(i))) {
                continue;
            }
            Optional<NodeMatch> match = matcher.match(new Node(tree, i));
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * All matches of {@code matcher} in this subtree, in pre-order. Nested matches are reported
     * too: a match does not hide the matches inside it.
     */
    public List<NodeMatch> findAll(Matcher matcher) {
        BitSet kinds = matcher.potentialKinds();
        int end = tree.subtreeEnd(index);
        List<NodeMatch> matches = new ArrayList<>();
        for (int i = index; i < end; i++) {
            if (kinds != null && !kinds.get(tree.kindId(i))) {
                continue;
            }
            matcher.match(new Node(tree, i)).ifPresent(matches::add);
        }
        return matches.isEmpty() ? Collections.emptyList() : matches;
    }

    /**
     * Edits that apply {@code fixer} to every match of {@code matcher} in this subtree. Matches are
     * found in pre-order and do not overlap: once a node matches, its subtree and anything its
     * edit covers are skipped.
     *
     * @return edits ordered by position
     */
    public List<Edit> replaceAll(Matcher matcher, Fixer fixer) {
        BitSet kinds = matcher.potentialKinds();
        int end = tree.subtreeEnd(index);
        List<Edit> edits = new ArrayList<>();
        int covered = -1;
        int i = index;
        while (i < end) {
            if ((kinds == null || kinds.get(tree.kindId(i))) && tree.startByte(i) >= covered) {
                Optional<NodeMatch> match = matcher.match(new Node(tree, i));
                if (match.isPresent()) {
                    Edit edit = fixer.edit(match.get());
                    edits.add(edit);
                    covered = edit.endPosition();
                    i = tree.subtreeEnd(i);
                    continue;
                }
            }
            i++;
        }
        return edits;
    }

    // --- Snapshot liveness ---

    /** True while the owning document has not been re-parsed since this node was obtained. */
    public boolean isCurrent() {
        Document document = tree.document();
        return document == null || document.tree() == tree;
    }

    public int generation() {
        return tree.generation();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return tree == other.tree && index == other.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(tree), index);
    }

    @Override
    public String toString() {
        return kind() + "@" + startByte() + ".." + endByte();
    }
}
