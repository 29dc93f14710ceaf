package io.treexform.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import io.treexform.core.match.NodeMatch;
import io.treexform.core.spi.Language;
import io.treexform.core.tree.Node;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A loaded rule document: identity, reporting metadata and the compiled {@link RuleCore}.
 *
 * @param id       unique rule id
 * @param language the language the rule applies to
 * @param severity how matches are reported
 * @param message  message template, may reference meta-variables as {@code $NAME}
 * @param note     optional longer explanation
 * @param url      optional documentation link
 * @param metadata optional free-form metadata
 * @param core     the compiled matcher
 */
public record RuleConfig(
        String id,
        Language language,
        Severity severity,
        String message,
        String note,
        String url,
        JsonNode metadata,
        RuleCore core) {

    private static final Pattern MESSAGE_VARIABLE = Pattern.compile("\\$(?:\\$\\$)?([A-Z_][A-Z0-9_]*)");

    public RuleConfig {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(core, "core must not be null");
        message = message == null ? "" : message;
    }

    /** False for rules switched {@link Severity#OFF}. */
    public boolean isEnabled() {
        return severity != Severity.OFF;
    }

    /** All matches of this rule in the subtree of {@code root}, in pre-order. */
    public List<NodeMatch> findAll(Node root) {
        return root.findAll(core);
    }

    /** The message with every {@code $NAME} replaced by the text bound in {@code match}. */
    public String message(NodeMatch match) {
        Matcher matcher = MESSAGE_VARIABLE.matcher(message);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = match.env().text(matcher.group(1)).orElse(matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /** Variables referenced by {@code message}. */
    public static Set<String> messageVariables(String message) {
        Set<String> names = new LinkedHashSet<>();
        if (message != null) {
            Matcher matcher = MESSAGE_VARIABLE.matcher(message);
            while (matcher.find()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }
}
