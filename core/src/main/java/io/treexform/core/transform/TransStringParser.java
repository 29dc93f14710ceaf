package io.treexform.core.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.treexform.core.error.TransformDefinitionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses the string form of a transformation into its object form.
 *
 * <p>
 * {@code substring($A, startChar=1, endChar=-1)} becomes
 * {@code {substring: {source: $A, startChar: 1, endChar: -1}}}. The first argument is the source
 * variable, the others are {@code key=value} pairs whose values are read as YAML flow scalars or
 * sequences, so {@code separatedBy=[dash, dot]} and {@code by='x'} both work.
 */
public final class TransStringParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final Set<String> FUNCTIONS = Set.of("substring", "replace", "convert", "rewrite");

    private TransStringParser() {}

    /**
     * Parses one transformation string.
     *
     * @param text e.g. {@code convert($NAME, toCase=snakeCase)}
     * @return an object node with a single key naming the transformation
     * @throws TransformDefinitionException if the string is malformed
     */
    public static ObjectNode parse(String text) {
        String trimmed = text.trim();
        int open = trimmed.indexOf('(');
        if (open <= 0 || !trimmed.endsWith(")")) {
            throw new TransformDefinitionException("Transform string '" + text + "' has a syntax error");
        }
        String function = trimmed.substring(0, open).trim();
        if (!FUNCTIONS.contains(function)) {
            throw new TransformDefinitionException("'" + function + "' is not a valid transformation");
        }
        List<String> arguments = splitArguments(trimmed.substring(open + 1, trimmed.length() - 1), text);
        if (arguments.isEmpty() || arguments.get(0).isEmpty()) {
            throw new TransformDefinitionException("Transform string '" + text + "' is missing its source");
        }
        ObjectNode body = YAML_MAPPER.createObjectNode();
        body.put("source", arguments.get(0));
        for (String argument : arguments.subList(1, arguments.size())) {
            int equals = argument.indexOf('=');
            if (equals <= 0) {
                throw new TransformDefinitionException("'" + argument + "' is not a valid argument");
            }
            String key = argument.substring(0, equals).trim();
            body.set(key, readValue(argument.substring(equals + 1).trim(), argument));
        }
        ObjectNode result = YAML_MAPPER.createObjectNode();
        result.set(function, body);
        return result;
    }

    private static JsonNode readValue(String value, String argument) {
        try {
            JsonNode node = YAML_MAPPER.readTree(value);
            if (node == null || node.isMissingNode()) {
                throw new TransformDefinitionException("'" + argument + "' is not a valid argument");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new TransformDefinitionException("Invalid value in argument '" + argument + "'", e);
        }
    }

    /** Splits at top-level commas, ignoring commas inside quotes or brackets. */
    private static List<String> splitArguments(String inner, String text) {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote == '"' && i + 1 < inner.length()) {
                    current.append(c).append(inner.charAt(++i));
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                arguments.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (quote != 0 || depth != 0) {
            throw new TransformDefinitionException("Transform string '" + text + "' has a syntax error");
        }
        String last = current.toString().trim();
        if (!last.isEmpty() || !arguments.isEmpty()) {
            arguments.add(last);
        }
        return arguments;
    }
}
