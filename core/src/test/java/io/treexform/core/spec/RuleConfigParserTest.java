package io.treexform.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.treexform.core.config.EngineConfig;
import io.treexform.core.error.FixerException;
import io.treexform.core.error.RuleLoadException;
import io.treexform.core.error.RuleParseException;
import io.treexform.core.error.TransformDefinitionException;
import io.treexform.core.error.UndefinedMetaVariableException;
import io.treexform.core.lang.LanguageRegistry;
import io.treexform.core.match.MatchStrictness;
import io.treexform.core.match.NodeMatch;
import io.treexform.core.rule.GlobalRules;
import io.treexform.core.rule.PatternRule;
import io.treexform.core.rule.RuleConfig;
import io.treexform.core.rule.Severity;
import io.treexform.core.tree.Document;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link RuleConfigParser}: document structure, validation and compiled output. */
@DisplayName("RuleConfigParser")
class RuleConfigParserTest {

    private final RuleConfigParser parser = new RuleConfigParser(LanguageRegistry.withBundledLanguages());

    @TempDir
    Path tempDir;

    private RuleConfig parse(String yaml) {
        return parser.parse(yaml, "inline.yaml", new GlobalRules());
    }

    @Nested
    @DisplayName("valid documents")
    class Valid {

        @Test
        void readsMetadataFields() {
            RuleConfig rule = parse("""
                    id: no-console
                    language: javascript
                    severity: warning
                    message: Avoid console.$METHOD
                    note: Use the logger instead.
                    url: https://example.com/no-console
                    metadata:
                      owner: platform
                    rule:
                      pattern: console.$METHOD($$$)
                    """);

            assertThat(rule.id()).isEqualTo("no-console");
            assertThat(rule.language().id()).isEqualTo("javascript");
            assertThat(rule.severity()).isEqualTo(Severity.WARNING);
            assertThat(rule.note()).isEqualTo("Use the logger instead.");
            assertThat(rule.url()).isEqualTo("https://example.com/no-console");
            assertThat(rule.metadata().get("owner").asText()).isEqualTo("platform");
            assertThat(rule.core().fixers()).isEmpty();
        }

        @Test
        void severityDefaultsToHint() {
            RuleConfig rule = parse("id: r\nlanguage: javascript\nrule:\n  kind: number\n");

            assertThat(rule.severity()).isEqualTo(Severity.HINT);
            assertThat(rule.message()).isEmpty();
            assertThat(rule.isEnabled()).isTrue();
        }

        @Test
        void offRulesAreDisabled() {
            RuleConfig rule = parse("id: r\nlanguage: javascript\nseverity: 'off'\nrule:\n  kind: number\n");

            assertThat(rule.isEnabled()).isFalse();
        }

        @Test
        void messageIsInterpolated() {
            RuleConfig rule = parse("""
                    id: no-console
                    language: javascript
                    message: Avoid console.$METHOD with $$$ARGS
                    rule:
                      pattern: console.$METHOD($$$ARGS)
                    """);
            Document document = Document.parse(rule.language(), "console.log(a, b)");

            NodeMatch match = rule.findAll(document.root()).get(0);

            assertThat(rule.message(match)).isEqualTo("Avoid console.log with a, b");
        }

        @Test
        void patternObjectFormCarriesStrictness() {
            RuleConfig rule = parse("""
                    id: r
                    language: javascript
                    rule:
                      pattern:
                        context: 'class A { $F = $V }'
                        selector: field_definition
                        strictness: relaxed
                    """);

            assertThat(rule.core().rule()).isInstanceOf(PatternRule.class);
            assertThat(((PatternRule) rule.core().rule()).pattern().strictness()).isEqualTo(MatchStrictness.RELAXED);
        }

        @Test
        void defaultStrictnessComesFromEngineConfig() {
            RuleConfigParser astParser = new RuleConfigParser(
                    LanguageRegistry.withBundledLanguages(),
                    EngineConfig.builder().defaultStrictness(MatchStrictness.AST).build());

            RuleConfig rule = astParser.parse(
                    "id: r\nlanguage: javascript\nrule:\n  pattern: foo($A)\n", "inline", new GlobalRules());

            assertThat(((PatternRule) rule.core().rule()).pattern().strictness()).isEqualTo(MatchStrictness.AST);
        }

        @Test
        void fixFormsAreAccepted() {
            RuleConfig string = parse("id: r\nlanguage: javascript\nrule:\n  pattern: foo($A)\nfix: bar($A)\n");
            RuleConfig object = parse("""
                    id: r
                    language: javascript
                    rule:
                      pattern: foo($A)
                    fix:
                      template: bar($A)
                      expandEnd:
                        regex: ','
                    """);
            RuleConfig list = parse("""
                    id: r
                    language: javascript
                    rule:
                      pattern: foo($A)
                    fix:
                      - template: bar($A)
                        title: Rename to bar
                      - template: baz($A)
                        title: Rename to baz
                    """);

            assertThat(string.core().fixers()).hasSize(1);
            assertThat(object.core().fixer().orElseThrow().expandEnd()).isPresent();
            assertThat(list.core().fixers()).extracting(f -> f.title().orElseThrow())
                    .containsExactly("Rename to bar", "Rename to baz");
        }

        @Test
        void parsesFromFile() throws IOException {
            Path file = tempDir.resolve("rule.yaml");
            Files.writeString(file, "id: from-file\nlanguage: javascript\nrule:\n  kind: identifier\n");

            RuleConfig rule = parser.parse(file, new GlobalRules());

            assertThat(rule.id()).isEqualTo("from-file");
        }

        @Test
        void parseUtilRegistersGlobal() {
            GlobalRules globals = new GlobalRules();

            String id = parser.parseUtil("id: is-num\nlanguage: javascript\nrule:\n  kind: number\n", "util", globals);

            assertThat(id).isEqualTo("is-num");
            assertThat(globals.contains("is-num")).isTrue();
        }
    }

    @Nested
    @DisplayName("invalid documents")
    class Invalid {

        @Test
        void missingRuleFailsSchemaValidation() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: javascript\n"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("does not match schema");
        }

        @Test
        void invalidSeverityFailsSchemaValidation() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: javascript\nseverity: fatal\nrule:\n  kind: number\n"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("does not match schema");
        }

        @Test
        void unknownRootKeyIsRejected() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: javascript\nrule:\n  kind: number\nfixx: a\n"))
                    .isInstanceOfSatisfying(RuleParseException.class, e -> {
                        assertThat(e.getMessage()).contains("Unknown key in 'rule document': [fixx]");
                        assertThat(e.ruleId()).isEqualTo("r");
                        assertThat(e.source()).isEqualTo("inline.yaml");
                    });
        }

        @Test
        void unknownRuleKeyIsRejected() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: javascript\nrule:\n  kind: number\n  stopby: end\n"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("Unknown key in 'rule': [stopby]");
        }

        @Test
        void unknownLanguageIsRejected() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: cobol\nrule:\n  kind: number\n"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("Unknown language 'cobol'");
        }

        @Test
        void malformedYamlIsRejected() {
            assertThatThrownBy(() -> parse("id: [unclosed\n"))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        void missingFileIsRejected() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml"), new GlobalRules()))
                    .isInstanceOf(RuleParseException.class)
                    .hasMessageContaining("Failed to read or parse YAML");
        }

        @Test
        void messageVariableMustBeDefined() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: javascript\nmessage: uses $X\nrule:\n  pattern: f($A)\n"))
                    .isInstanceOfSatisfying(UndefinedMetaVariableException.class, e -> {
                        assertThat(e.variable()).isEqualTo("X");
                        assertThat(e.section()).isEqualTo("message");
                    });
        }

        @Test
        void fixVariableMustBeDefined() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: javascript\nrule:\n  pattern: f($A)\nfix: g($B)\n"))
                    .isInstanceOfSatisfying(
                            UndefinedMetaVariableException.class, e -> assertThat(e.section()).isEqualTo("fix"));
        }

        @Test
        void fixListEntriesNeedTitles() {
            assertThatThrownBy(() -> parse("""
                            id: r
                            language: javascript
                            rule:
                              pattern: foo($A)
                            fix:
                              - template: bar($A)
                            """))
                    .isInstanceOf(FixerException.class)
                    .hasMessageContaining("must have a title");
        }

        @Test
        void fixTemplateWithSyntaxErrorIsRejected() {
            assertThatThrownBy(() -> parse("id: r\nlanguage: javascript\nrule:\n  pattern: foo($A)\nfix: 'bar($A) }'\n"))
                    .isInstanceOf(FixerException.class)
                    .hasMessageContaining("syntax error");
        }

        @Test
        void rewriterMustExist() {
            assertThatThrownBy(() -> parse("""
                            id: r
                            language: javascript
                            rule:
                              pattern: foo($A)
                            transform:
                              B:
                                rewrite:
                                  source: $A
                                  rewriters: [missing]
                            fix: foo($B)
                            """))
                    .isInstanceOf(TransformDefinitionException.class)
                    .hasMessageContaining("Rewriter 'missing' is not defined");
        }

        @Test
        void rewriterNeedsExactlyOneFix() {
            assertThatThrownBy(() -> parse("""
                            id: r
                            language: javascript
                            rule:
                              kind: number
                            rewriters:
                              - id: nofix
                                rule:
                                  kind: number
                            """))
                    .isInstanceOf(FixerException.class)
                    .hasMessageContaining("Rewriter 'nofix' must have exactly one fix");
        }

        @Test
        void everyLoadErrorIsARuleLoadException() {
            List<String> documents = List.of(
                    "id: r\nlanguage: javascript\nrule:\n  pattern: ''\n",
                    "id: r\nlanguage: javascript\nrule:\n  regex: '('\n",
                    "id: r\nlanguage: javascript\nrule:\n  kind: number\n  nthChild: zero\n",
                    "id: r\nlanguage: javascript\nrule:\n  kind: number\ntransform:\n  X: reverse($A)\n");

            for (String document : documents) {
                assertThatThrownBy(() -> parse(document)).isInstanceOf(RuleLoadException.class);
            }
        }
    }
}
