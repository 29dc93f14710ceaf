package io.treexform.core.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.treexform.core.error.PatternParseException;
import io.treexform.core.lang.treesitter.TreeSitterLanguage;
import io.treexform.core.spi.Language;
import io.treexform.core.tree.Document;
import io.treexform.core.tree.Node;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Pattern} compilation and structural matching. */
@DisplayName("Pattern")
class PatternTest {

    private static final Language JS = TreeSitterLanguage.javascript();

    private static List<NodeMatch> findAll(String pattern, String source) {
        return Document.parse(JS, source).root().findAll(Pattern.compile(JS, pattern));
    }

    private static List<String> texts(List<Node> nodes) {
        return nodes.stream().map(Node::text).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("compilation")
    class Compilation {

        @Test
        void peelsSingleChildWrappers() {
            Pattern pattern = Pattern.compile(JS, "foo(1)");

            assertThat(pattern.root()).isInstanceOf(PatternNode.Internal.class);
            assertThat(JS.kindName(((PatternNode.Internal) pattern.root()).kindId())).isEqualTo("call_expression");
        }

        @Test
        void collectsDefinedVariables() {
            Pattern pattern = Pattern.compile(JS, "$OBJ.$METHOD($$$ARGS, $_)");

            assertThat(pattern.definedVariables()).containsExactlyInAnyOrder("OBJ", "METHOD", "ARGS");
        }

        @Test
        void potentialKindsIsTheRootKind() {
            Pattern pattern = Pattern.compile(JS, "foo(1)");

            assertThat(pattern.potentialKinds().cardinality()).isEqualTo(1);
            assertThat(pattern.potentialKinds().get(JS.kindId("call_expression"))).isTrue();
        }

        @Test
        void rejectsEmptyPattern() {
            assertThatThrownBy(() -> Pattern.compile(JS, "  "))
                    .isInstanceOf(PatternParseException.class)
                    .hasMessageContaining("must not be empty");
        }

        @Test
        void rejectsMultipleTopLevelNodes() {
            assertThatThrownBy(() -> Pattern.compile(JS, "a; b"))
                    .isInstanceOf(PatternParseException.class)
                    .hasMessageContaining("more than one top-level node");
        }

        @Test
        void contextAndSelectorPickTheInnerNode() {
            Pattern pattern = Pattern.compile(JS, "class A { $F = $V }", "field_definition", MatchStrictness.SMART);

            List<NodeMatch> matches = Document.parse(JS, "class B { x = 1; y = 2 }").root().findAll(pattern);

            assertThat(matches).extracting(m -> m.env().text("F").orElseThrow()).containsExactly("x", "y");
        }

        @Test
        void unknownSelectorIsRejected() {
            assertThatThrownBy(() -> Pattern.compile(JS, "a", "no_such_kind", MatchStrictness.SMART))
                    .isInstanceOf(PatternParseException.class)
                    .hasMessageContaining("no_such_kind");
        }
    }

    @Nested
    @DisplayName("meta-variables")
    class MetaVariables {

        @Test
        void singleCaptureBindsNode() {
            List<NodeMatch> matches = findAll("console.log($MSG)", "console.log('hi'); console.warn('no');");

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).env().text("MSG")).hasValue("'hi'");
        }

        @Test
        void ellipsisCapturesNamedNodesOnly() {
            List<NodeMatch> matches = findAll("f($$$ARGS)", "f(1, 2, 3)");

            assertThat(matches).hasSize(1);
            assertThat(texts(matches.get(0).env().getMulti("ARGS"))).containsExactly("1", "2", "3");
            assertThat(matches.get(0).env().text("ARGS")).hasValue("1, 2, 3");
        }

        @Test
        void ellipsisMayBeEmpty() {
            List<NodeMatch> matches = findAll("f($$$ARGS)", "f()");

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).env().getMulti("ARGS")).isEmpty();
            assertThat(matches.get(0).env().text("ARGS")).hasValue("");
        }

        @Test
        void ellipsisBeforeFixedArgument() {
            List<NodeMatch> matches = findAll("f($$$FIRST, $LAST)", "f(1, 2, 3)");

            assertThat(matches).hasSize(1);
            assertThat(texts(matches.get(0).env().getMulti("FIRST"))).containsExactly("1", "2");
            assertThat(matches.get(0).env().text("LAST")).hasValue("3");
        }

        @Test
        void repeatedVariableRequiresEqualText() {
            assertThat(findAll("$A + $A", "x + x")).hasSize(1);
            assertThat(findAll("$A + $A", "x + y")).isEmpty();
        }

        @Test
        void anonymousVariableDoesNotBind() {
            List<NodeMatch> matches = findAll("$_ + $_", "x + y");

            assertThat(matches).hasSize(1);
            assertThat(matches.get(0).env().isEmpty()).isTrue();
        }

        @Test
        void nestedMatchesAreAllReported() {
            List<NodeMatch> matches = findAll("Some($A)", "Some(Some(1))");

            assertThat(matches).extracting(NodeMatch::text).containsExactly("Some(Some(1))", "Some(1)");
        }
    }

    @Nested
    @DisplayName("strictness")
    class Strictness {

        @Test
        void smartIgnoresTrailingCandidateTokens() {
            Node root = Document.parse(JS, "let a = 1;").root();

            assertThat(root.findAll(Pattern.compile(JS, "let $X = 1", MatchStrictness.SMART))).hasSize(1);
        }

        @Test
        void cstAndSmartKeepNamedPatternNodes() {
            Node root = Document.parse(JS, "foo(a, b)").root();

            assertThat(root.findAll(Pattern.compile(JS, "foo(a)", MatchStrictness.CST))).isEmpty();
            assertThat(root.findAll(Pattern.compile(JS, "foo(a)", MatchStrictness.SMART))).isEmpty();
        }

        @Test
        void relaxedSkipsComments() {
            Node root = Document.parse(JS, "foo(/* note */ a)").root();

            assertThat(root.findAll(Pattern.compile(JS, "foo(a)", MatchStrictness.SMART))).isEmpty();
            assertThat(root.findAll(Pattern.compile(JS, "foo(a)", MatchStrictness.RELAXED))).hasSize(1);
        }

        @Test
        void signatureIgnoresIdentifierText() {
            Node root = Document.parse(JS, "bar(b)").root();

            assertThat(root.findAll(Pattern.compile(JS, "foo(a)", MatchStrictness.AST))).isEmpty();
            assertThat(root.findAll(Pattern.compile(JS, "foo(a)", MatchStrictness.SIGNATURE))).hasSize(1);
        }

        @Test
        void parseUsesLowerCaseNames() {
            assertThat(MatchStrictness.parse("relaxed")).isEqualTo(MatchStrictness.RELAXED);
            assertThat(MatchStrictness.SIGNATURE.id()).isEqualTo("signature");
        }
    }

    @Test
    @DisplayName("exhausted ellipsis budget is a non-match, not an error")
    void budgetExhaustionIsNoMatch() {
        Pattern pattern = Pattern.compile(JS, "f($$$A, 1, $$$B, 2, $$$C, 3)").withMaxEllipsisSteps(3);

        assertThat(Document.parse(JS, "f(0, 1, 0, 2, 0, 3)").root().findAll(pattern)).isEmpty();
        assertThat(Document.parse(JS, "f(0, 1, 0, 2, 0, 3)").root().findAll(pattern.withMaxEllipsisSteps(10_000)))
                .hasSize(1);
    }
}
