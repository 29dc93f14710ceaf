package io.treexform.core.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.treexform.core.error.TransformDefinitionException;
import io.treexform.core.error.UndefinedMetaVariableException;
import io.treexform.core.lang.LanguageRegistry;
import io.treexform.core.lang.treesitter.TreeSitterLanguage;
import io.treexform.core.match.NodeMatch;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.rule.GlobalRules;
import io.treexform.core.rule.RuleConfig;
import io.treexform.core.rule.RuleRegistration;
import io.treexform.core.spec.RuleConfigParser;
import io.treexform.core.tree.Document;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for transform evaluation: substring, replace, convert, rewrite and their ordering. */
@DisplayName("Transform")
class TransformTest {

    private static final RuleConfigParser PARSER = new RuleConfigParser(LanguageRegistry.withBundledLanguages());

    private static MetaVarEnv firstMatchEnv(String yaml, String source) {
        RuleConfig rule = PARSER.parse("id: t\nlanguage: javascript\n" + yaml, "inline", new GlobalRules());
        List<NodeMatch> matches = rule.findAll(Document.parse(rule.language(), source).root());
        assertThat(matches).isNotEmpty();
        return matches.get(0).env();
    }

    @Nested
    @DisplayName("string operations")
    class StringOperations {

        @Test
        void replaceRewritesEveryRegexMatch() {
            MetaVarEnv env = firstMatchEnv("""
                    rule:
                      pattern: let a = $N
                    transform:
                      R:
                        replace:
                          source: $N
                          replace: '\\d'
                          by: b
                    """, "let a = 123");

            assertThat(env.getTransformed("R")).hasValue("bbb");
        }

        @Test
        void replaceSupportsCaptureGroups() {
            MetaVarEnv env = firstMatchEnv("""
                    rule:
                      pattern: $F()
                    transform:
                      R: replace($F, replace='get(\\w+)', by='set$1')
                    """, "getName()");

            assertThat(env.getTransformed("R")).hasValue("setName");
        }

        @Test
        void replaceKeepsLoneDollarLiteral() {
            MetaVarEnv env = firstMatchEnv("""
                    rule:
                      pattern: let a = $N
                    transform:
                      R:
                        replace:
                          source: $N
                          replace: '1'
                          by: '$'
                    """, "let a = 1");

            assertThat(env.getTransformed("R")).hasValue("$");
        }

        @Test
        void replaceExpandsMissingGroupToNothing() {
            MetaVarEnv env = firstMatchEnv("""
                    rule:
                      pattern: let a = $N
                    transform:
                      R:
                        replace:
                          source: $N
                          replace: '1'
                          by: 'x$9${missing}'
                    """, "let a = 1");

            assertThat(env.getTransformed("R")).hasValue("x");
        }

        @Test
        void replaceSupportsNamedAndBracedGroups() {
            Replace replace = new Replace(
                    "A", Pattern.compile("(?<word>[a-z]+)(\\d)"), "${2}$word$$");

            assertThat(replace.replaceAll("ab1 cd2")).isEqualTo("1ab$ 2cd$");
        }

        @Test
        void substringUsesSignedIndices() {
            MetaVarEnv env = firstMatchEnv("""
                    rule:
                      pattern: let a = $N
                    transform:
                      S: substring($N, startChar=1, endChar=-1)
                    """, "let a = 123");

            assertThat(env.getTransformed("S")).hasValue("2");
        }

        @Test
        void substringClampsAndEmptiesInvertedRange() {
            Substring wide = new Substring("A", -10, 100);
            Substring inverted = new Substring("A", 3, 1);

            assertThat(wide.compute("hello")).isEqualTo("hello");
            assertThat(inverted.compute("hello")).isEmpty();
            assertThat(new Substring("A", null, -2).compute("hello")).isEqualTo("hel");
        }

        @Test
        void convertChangesCase() {
            MetaVarEnv env = firstMatchEnv("""
                    rule:
                      pattern: let $NAME = $V
                    transform:
                      SNAKE:
                        convert:
                          source: $NAME
                          toCase: snakeCase
                      KEBAB: convert($NAME, toCase=kebabCase, separatedBy=[caseChange])
                    """, "let fooBar = 1");

            assertThat(env.getTransformed("SNAKE")).hasValue("foo_bar");
            assertThat(env.getTransformed("KEBAB")).hasValue("foo-bar");
        }
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        void dependentTransformRunsAfterItsSource() {
            MetaVarEnv env = firstMatchEnv("""
                    rule:
                      pattern: let $NAME = $V
                    transform:
                      UPPER: convert($TRIMMED, toCase=upperCase)
                      TRIMMED: substring($NAME, startChar=1)
                    """, "let value = 1");

            assertThat(env.getTransformed("TRIMMED")).hasValue("alue");
            assertThat(env.getTransformed("UPPER")).hasValue("ALUE");
        }

        @Test
        void keysAreInEvaluationOrder() {
            Map<String, Trans> transforms = new LinkedHashMap<>();
            transforms.put("C", new Substring("B", null, null));
            transforms.put("B", new Substring("A", null, null));

            Transform transform = Transform.of(transforms);

            assertThat(transform.keys()).containsExactly("B", "C");
            assertThat(transform.usedVariables()).containsExactly("A");
        }

        @Test
        void cyclicTransformsAreRejected() {
            Map<String, Trans> transforms = new LinkedHashMap<>();
            transforms.put("A", new Substring("B", null, null));
            transforms.put("B", new Substring("A", null, null));

            assertThatThrownBy(() -> Transform.of(transforms))
                    .isInstanceOf(TransformDefinitionException.class)
                    .hasMessageContaining("cyclic dependency");
        }

        @Test
        void unboundSourceYieldsEmptyString() {
            Map<String, Trans> transforms = new LinkedHashMap<>();
            transforms.put("OUT", new Substring("MISSING", 1, null));
            MetaVarEnv env = new MetaVarEnv();

            Transform.of(transforms).apply(env, new RuleRegistration());

            assertThat(env.getTransformed("OUT")).hasValue("");
        }
    }

    @Nested
    @DisplayName("definition errors")
    class DefinitionErrors {

        @Test
        void sourceMustBeMetaVariable() {
            assertThatThrownBy(() -> Transform.parseSource(TreeSitterLanguage.javascript(), "A"))
                    .isInstanceOf(TransformDefinitionException.class);
            assertThat(Transform.parseSource(TreeSitterLanguage.javascript(), "$$$ARGS")).isEqualTo("ARGS");
        }

        @Test
        void transformMustNotRedefineCapture() {
            assertThatThrownBy(() -> firstMatchEnv("""
                            rule:
                              pattern: f($A)
                            transform:
                              A: substring($A, startChar=1)
                            """, "f(1)"))
                    .isInstanceOf(TransformDefinitionException.class)
                    .hasMessageContaining("already defined");
        }

        @Test
        void transformSourceMustBeDefined() {
            assertThatThrownBy(() -> firstMatchEnv("""
                            rule:
                              pattern: f($A)
                            transform:
                              B: substring($Z, startChar=1)
                            """, "f(1)"))
                    .isInstanceOfSatisfying(
                            UndefinedMetaVariableException.class, e -> assertThat(e.section()).isEqualTo("transform"));
        }

        @Test
        void unknownCaseIsRejected() {
            assertThatThrownBy(() -> firstMatchEnv("""
                            rule:
                              pattern: f($A)
                            transform:
                              B: convert($A, toCase=shoutCase)
                            """, "f(1)"))
                    .isInstanceOf(TransformDefinitionException.class);
        }
    }

    @Nested
    @DisplayName("rewrite")
    class RewriteTransform {

        private static final String DOUBLE_ALL = """
                rule:
                  pattern: '[$$$ITEMS]'
                rewriters:
                  - id: double
                    rule:
                      kind: number
                      pattern: $X
                    fix: $X * 2
                transform:
                  %s
                fix: '[$NEW]'
                """;

        @Test
        void rewritesEachNodeAndJoins() {
            MetaVarEnv env = firstMatchEnv(
                    DOUBLE_ALL.formatted("NEW: rewrite($$$ITEMS, rewriters=[double], joinBy=', ')"), "[1, 2]");

            assertThat(env.getTransformed("NEW")).hasValue("1 * 2, 2 * 2");
        }

        @Test
        void withoutJoinBySplicesIntoSource() {
            MetaVarEnv env = firstMatchEnv(DOUBLE_ALL.formatted("NEW: rewrite($$$ITEMS, rewriters=[double])"), "[1, a, 2]");

            assertThat(env.getTransformed("NEW")).hasValue("1 * 2, a, 2 * 2");
        }

        @Test
        void rewriterDescendsUntilFirstMatch() {
            MetaVarEnv env = firstMatchEnv(DOUBLE_ALL.formatted("NEW: rewrite($$$ITEMS, rewriters=[double])"), "[f(1), 2]");

            assertThat(env.getTransformed("NEW")).hasValue("f(1 * 2), 2 * 2");
        }

        @Test
        void fixUsesRewrittenValue() {
            RuleConfig rule = PARSER.parse(
                    "id: t\nlanguage: javascript\n"
                            + DOUBLE_ALL.formatted("NEW: rewrite($$$ITEMS, rewriters=[double], joinBy=', ')"),
                    "inline",
                    new GlobalRules());
            Document document = Document.parse(rule.language(), "x = [1, 2];");

            document.applyEdits(rule.core().fixAll(document));

            assertThat(document.text()).isEqualTo("x = [1 * 2, 2 * 2];");
        }
    }
}
