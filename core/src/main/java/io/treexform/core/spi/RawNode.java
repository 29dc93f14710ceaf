package io.treexform.core.spi;

/**
 * Read-only view of one backend syntax node. Offsets are UTF-8 byte offsets into the parsed text.
 * Raw nodes are only read while a tree snapshot is being built and are never retained.
 */
public interface RawNode {

    String kind();

    int kindId();

    boolean isNamed();

    /** True for zero-width placeholders the parser inserted to recover from an error. */
    boolean isMissing();

    /** True for nodes that wrap unparsable text. */
    boolean isError();

    int startByte();

    int endByte();

    int childCount();

    RawNode child(int index);

    /** The field under which the child at {@code index} is stored, or {@code null}. */
    String fieldNameForChild(int index);
}
