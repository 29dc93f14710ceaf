package io.treexform.core.tree;

import java.util.Objects;

/**
 * A text replacement: delete {@code deletedLength} bytes at byte offset {@code position} and insert
 * {@code insertedText} in their place.
 */
public record Edit(int position, int deletedLength, String insertedText) {

    public Edit {
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
        if (deletedLength < 0) {
            throw new IllegalArgumentException("deletedLength must not be negative: " + deletedLength);
        }
        Objects.requireNonNull(insertedText, "insertedText must not be null");
    }

    /** Byte offset just past the deleted region. */
    public int endPosition() {
        return position + deletedLength;
    }
}
