package io.treexform.core.engine;

import io.treexform.core.match.NodeMatch;
import io.treexform.core.rule.Severity;
import java.util.Objects;

/**
 * One finding of a scan.
 *
 * @param ruleId   id of the rule that matched
 * @param severity severity of that rule
 * @param message  the rule message with meta-variables filled in
 * @param match    the matched node and its bindings
 */
public record RuleMatch(String ruleId, Severity severity, String message, NodeMatch match) {

    public RuleMatch {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(match, "match must not be null");
    }
}
