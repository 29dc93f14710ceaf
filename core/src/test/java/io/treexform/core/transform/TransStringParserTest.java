package io.treexform.core.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.treexform.core.error.TransformDefinitionException;
import org.junit.jupiter.api.Test;

class TransStringParserTest {

    @Test
    void substringWithSignedIndices() {
        JsonNode body = TransStringParser.parse("substring($A, startChar=1, endChar=-1)").get("substring");

        assertThat(body.get("source").asText()).isEqualTo("$A");
        assertThat(body.get("startChar").asInt()).isEqualTo(1);
        assertThat(body.get("endChar").asInt()).isEqualTo(-1);
    }

    @Test
    void quotedValuesMayContainCommasAndParentheses() {
        JsonNode body = TransStringParser.parse("replace($A, replace='(a|b)', by=', ')").get("replace");

        assertThat(body.get("replace").asText()).isEqualTo("(a|b)");
        assertThat(body.get("by").asText()).isEqualTo(", ");
    }

    @Test
    void sequencesAreYamlFlowLists() {
        JsonNode body = TransStringParser.parse("convert($N, toCase=snakeCase, separatedBy=[dash, dot])")
                .get("convert");

        assertThat(body.get("toCase").asText()).isEqualTo("snakeCase");
        assertThat(body.get("separatedBy")).hasSize(2);
        assertThat(body.get("separatedBy").get(1).asText()).isEqualTo("dot");
    }

    @Test
    void rejectsUnknownFunction() {
        assertThatThrownBy(() -> TransStringParser.parse("reverse($A)"))
                .isInstanceOf(TransformDefinitionException.class)
                .hasMessageContaining("'reverse' is not a valid transformation");
    }

    @Test
    void rejectsMalformedStrings() {
        assertThatThrownBy(() -> TransStringParser.parse("substring($A"))
                .isInstanceOf(TransformDefinitionException.class);
        assertThatThrownBy(() -> TransStringParser.parse("substring()"))
                .isInstanceOf(TransformDefinitionException.class);
        assertThatThrownBy(() -> TransStringParser.parse("substring($A, startChar)"))
                .isInstanceOf(TransformDefinitionException.class);
        assertThatThrownBy(() -> TransStringParser.parse("replace($A, by='x)"))
                .isInstanceOf(TransformDefinitionException.class);
    }
}
