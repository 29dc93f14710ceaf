package io.treexform.core.replace;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Indentation")
class IndentationTest {

    /** Extracts {@code source[start..]} without trailing whitespace and moves it to column zero. */
    private static String deindent(String source, int offset) {
        int start = offset;
        while (start < source.length() && Character.isWhitespace(source.charAt(start))) {
            start++;
        }
        int end = source.length();
        while (end > 0 && Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }
        return Indentation.indentLines(source.substring(start, end), Indentation.indentAt(source, start), 0);
    }

    private static String insertAt(String target, int start, String inserted) {
        return Indentation.indentLines(inserted, 0, Indentation.indentAt(target, start));
    }

    @Nested
    @DisplayName("indentAt")
    class IndentAt {

        @Test
        void countsSpacesAfterNewline() {
            assertThat(Indentation.indentAt("a\n    b", 6)).isEqualTo(4);
        }

        @Test
        void startOfTextCountsAsLineStart() {
            assertThat(Indentation.indentAt("   x", 3)).isEqualTo(3);
        }

        @Test
        void resetsOnNonSpace() {
            assertThat(Indentation.indentAt("  a = ", 6)).isEqualTo(2);
            assertThat(Indentation.indentAt("a = ", 4)).isZero();
        }

        @Test
        void tabsAreNotIndentation() {
            assertThat(Indentation.indentAt("\n\t\tx", 3)).isZero();
        }

        @Test
        void lineLongerThanLookBackHasNoIndent() {
            String text = "\n" + " ".repeat(Indentation.MAX_LOOK_BACK + 10) + "x";
            assertThat(Indentation.indentAt(text, text.length() - 1)).isZero();
        }
    }

    @Nested
    @DisplayName("de-indent of extracted code")
    class Deindent {

        @Test
        void simple() {
            assertThat(deindent("\n  def test():\n    pass", 0)).isEqualTo("def test():\n  pass");
        }

        @Test
        void firstLineWithoutNewline() {
            assertThat(deindent("  def test():\n    pass", 0)).isEqualTo("def test():\n  pass");
        }

        @Test
        void textBeforeStartOnSameLine() {
            assertThat(deindent("\na = lambda:\n  pass", 4)).isEqualTo("lambda:\n  pass");
            assertThat(deindent("\n  a = lambda:\n    pass", 6)).isEqualTo("lambda:\n  pass");
        }

        @Test
        void nested() {
            assertThat(deindent("\ndef outer():\n  def test():\n    pass", 13)).isEqualTo("def test():\n  pass");
        }

        @Test
        void alreadyAtColumnZero() {
            assertThat(deindent("\ndef test():\n  pass\n", 0)).isEqualTo("def test():\n  pass");
        }

        @Test
        void malformedLinesAreKept() {
            assertThat(deindent("\n  def test():\npass\n", 0)).isEqualTo("def test():\npass");
        }

        @Test
        void longLineIsNotDeindented() {
            String source = " ".repeat(Indentation.MAX_LOOK_BACK + 1) + "abc\n  def";
            assertThat(deindent(source, 0)).isEqualTo("abc\n  def");
        }
    }

    @Nested
    @DisplayName("re-indent at insertion point")
    class Reindent {

        @Test
        void emptyTarget() {
            assertThat(insertAt("", 0, "def abc(): pass")).isEqualTo("def abc(): pass");
            assertThat(insertAt("", 0, "def abc():\n  pass")).isEqualTo("def abc():\n  pass");
        }

        @Test
        void indentedTarget() {
            assertThat(insertAt("  ", 2, "def abc(): pass")).isEqualTo("def abc(): pass");
            assertThat(insertAt("  ", 2, "def abc():\n  pass")).isEqualTo("def abc():\n    pass");
            assertThat(insertAt("    ", 2, "def abc():\n  pass")).isEqualTo("def abc():\n    pass");
            assertThat(insertAt("    ", 4, "def abc():\n  pass")).isEqualTo("def abc():\n      pass");
        }

        @Test
        void leadingText() {
            assertThat(insertAt("a = ", 4, "def abc():\n  pass")).isEqualTo("def abc():\n  pass");
            assertThat(insertAt("  a = ", 6, "def abc():\n  pass")).isEqualTo("def abc():\n    pass");
        }

        @Test
        void firstLineIsNeverShifted() {
            assertThat(Indentation.indentLines("a\nb", 0, 3)).isEqualTo("a\n   b");
        }
    }
}
