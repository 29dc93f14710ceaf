package io.treexform.core.spi;

/**
 * Describes a text change to a backend so it can re-parse incrementally. Byte offsets and byte
 * points (row, byte column) refer to the text before the edit for {@code start} and {@code oldEnd}
 * and to the text after it for {@code newEnd}.
 */
public record InputEdit(
        int startByte, int oldEndByte, int newEndByte, BytePoint start, BytePoint oldEnd, BytePoint newEnd) {

    /** A zero-based row and byte column. */
    public record BytePoint(int row, int column) {}
}
