package io.treexform.core.lang.treesitter;

import io.treexform.core.spi.RawNode;
import org.treesitter.TSNode;

final class TreeSitterRawNode implements RawNode {

    private final TSNode node;

    TreeSitterRawNode(TSNode node) {
        this.node = node;
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public int kindId() {
        return node.getSymbol();
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    public boolean isMissing() {
        return node.isMissing();
    }

    @Override
    public boolean isError() {
        return node.getSymbol() == TreeSitterLanguage.ERROR_SYMBOL;
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public int childCount() {
        return node.getChildCount();
    }

    @Override
    public RawNode child(int index) {
        return new TreeSitterRawNode(node.getChild(index));
    }

    @Override
    public String fieldNameForChild(int index) {
        return node.getFieldNameForChild(index);
    }
}
