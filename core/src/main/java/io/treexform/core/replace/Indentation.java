package io.treexform.core.replace;

import io.treexform.core.tree.Node;
import io.treexform.core.tree.SourceText;

/**
 * Space-based indentation arithmetic used when captured code is moved into a template.
 *
 * <p>
 * A multi-line fragment is stored without the indentation of the place it came from, and gets
 * the indentation of the place it goes to. Only the lines after the first are shifted: the first
 * line starts wherever the insertion point is. Tabs are not counted as indentation.
 */
public final class Indentation {

    /** How far back {@link #indentAt(CharSequence, int)} looks for the start of a line. */
    public static final int MAX_LOOK_BACK = 512;

    private Indentation() {}

    /**
     * The indentation of the line containing {@code index}: the number of spaces between the
     * preceding newline and the first non-space character. Zero if no newline is found within
     * {@link #MAX_LOOK_BACK} characters and the text does not start within that window.
     */
    public static int indentAt(CharSequence text, int index) {
        return indentAt(text, index, MAX_LOOK_BACK);
    }

    public static int indentAt(CharSequence text, int index, int lookBack) {
        int from = Math.max(0, index - lookBack);
        int indent = 0;
        for (int i = index - 1; i >= from; i--) {
            char c = text.charAt(i);
            if (c == '\n') {
                return indent;
            }
            indent = c == ' ' ? indent + 1 : 0;
        }
        return from == 0 ? indent : 0;
    }

    /** Indentation of the line {@code node} starts on. */
    public static int indentOf(Node node) {
        SourceText source = node.tree().source();
        return indentAt(source.text(), source.charIndex(node.startByte()));
    }

    /**
     * Moves a fragment from {@code originalIndent} to {@code targetIndent}. A single-line fragment
     * is returned unchanged. When the indentation shrinks, up to the difference in leading spaces is
     * removed from every line; when it grows, spaces are added to every line but the first.
     */
    public static String indentLines(String text, int originalIndent, int targetIndent) {
        if (text.indexOf('\n') < 0 || originalIndent == targetIndent) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length());
        if (originalIndent > targetIndent) {
            String strip = " ".repeat(originalIndent - targetIndent);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    out.append('\n');
                }
                String line = lines[i];
                out.append(line.startsWith(strip) ? line.substring(strip.length()) : line);
            }
        } else {
            String pad = " ".repeat(targetIndent - originalIndent);
            out.append(lines[0]);
            for (int i = 1; i < lines.length; i++) {
                out.append('\n').append(pad).append(lines[i]);
            }
        }
        return out.toString();
    }
}
