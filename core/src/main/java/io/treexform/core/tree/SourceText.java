package io.treexform.core.tree;

import io.treexform.core.spi.InputEdit;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable source text with a line index. Converts UTF-8 byte offsets, which is what the parser
 * reports, into lines, character columns and {@link String} indices.
 */
public final class SourceText {

    private final String text;
    private final byte[] bytes;
    private final int[] lineStartBytes;
    private final int[] lineStartChars;

    private SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        this.lineStartBytes = new int[lines];
        this.lineStartChars = new int[lines];
        int line = 1;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                lineStartBytes[line++] = i + 1;
            }
        }
        line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStartChars[line++] = i + 1;
            }
        }
    }

    public static SourceText of(String text) {
        return new SourceText(Objects.requireNonNull(text, "text must not be null"));
    }

    /** Number of UTF-8 bytes {@code text} encodes to. */
    public static int utf8Length(String text) {
        int length = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                length += 1;
            } else if (c < 0x800) {
                length += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < text.length()) {
                length += 4;
                i++;
            } else {
                length += 3;
            }
        }
        return length;
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return bytes.length;
    }

    /** Decodes the bytes in {@code [startByte, endByte)}. */
    public String slice(int startByte, int endByte) {
        checkRange(startByte, endByte);
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** Line, character column and byte offset of a byte offset. */
    public Position position(int byteOffset) {
        checkRange(byteOffset, byteOffset);
        int line = lineOf(byteOffset);
        int lineStart = lineStartBytes[line];
        String prefix = new String(bytes, lineStart, byteOffset - lineStart, StandardCharsets.UTF_8);
        return new Position(line, prefix.codePointCount(0, prefix.length()), byteOffset);
    }

    /** Row and byte column of a byte offset, the coordinates incremental parsing expects. */
    public InputEdit.BytePoint bytePoint(int byteOffset) {
        checkRange(byteOffset, byteOffset);
        int line = lineOf(byteOffset);
        return new InputEdit.BytePoint(line, byteOffset - lineStartBytes[line]);
    }

    /** Index into {@link #text()} of the character that starts at {@code byteOffset}. */
    public int charIndex(int byteOffset) {
        checkRange(byteOffset, byteOffset);
        int line = lineOf(byteOffset);
        int lineStart = lineStartBytes[line];
        return lineStartChars[line]
                + new String(bytes, lineStart, byteOffset - lineStart, StandardCharsets.UTF_8).length();
    }

    private int lineOf(int byteOffset) {
        int found = Arrays.binarySearch(lineStartBytes, byteOffset);
        return found >= 0 ? found : -found - 2;
    }

    private void checkRange(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || endByte > bytes.length) {
            throw new IndexOutOfBoundsException(
                    "Byte range [" + startByte + ", " + endByte + ") is outside text of length " + bytes.length);
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
