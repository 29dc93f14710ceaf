package io.treexform.core.lang.treesitter;

import io.treexform.core.spi.ParsedTree;
import io.treexform.core.spi.RawNode;
import org.treesitter.TSTree;

/** Holds a {@link TSTree} so it can be handed back to the parser as an incremental hint. */
final class TreeSitterParsedTree implements ParsedTree {

    private final TSTree tree;

    TreeSitterParsedTree(TSTree tree) {
        this.tree = tree;
    }

    TSTree tree() {
        return tree;
    }

    @Override
    public RawNode root() {
        return new TreeSitterRawNode(tree.getRootNode());
    }
}
