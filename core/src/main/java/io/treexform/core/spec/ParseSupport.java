package io.treexform.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import io.treexform.core.error.RuleParseException;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/** Field access and strict key checking shared by the rule document parsers. */
final class ParseSupport {

    private ParseSupport() {}

    /**
     * Rejects keys of {@code node} that are not in {@code knownKeys}, so that typos such as
     * {@code stopby} fail at load time instead of being ignored.
     *
     * @param node      the YAML object to check
     * @param knownKeys keys recognized in this block
     * @param blockName block name for the error message
     * @param ruleId    rule id for error context
     * @param source    source path for error context
     * @throws RuleParseException if an unknown key is present
     */
    static void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String ruleId, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new RuleParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + ", recognized keys are: " + new TreeSet<>(knownKeys),
                    ruleId,
                    source);
        }
    }

    static String requireString(JsonNode root, String field, String ruleId, String source) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isTextual()) {
            throw new RuleParseException("Missing or invalid required field: '" + field + "'", ruleId, source);
        }
        return node.asText();
    }

    static String optionalString(JsonNode root, String field, String ruleId, String source) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new RuleParseException("Field '" + field + "' must be a string", ruleId, source);
        }
        return node.asText();
    }

    static String idSafe(JsonNode root) {
        JsonNode idNode = root == null ? null : root.get("id");
        return idNode != null && idNode.isTextual() ? idNode.asText() : null;
    }
}
