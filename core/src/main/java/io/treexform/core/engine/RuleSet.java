package io.treexform.core.engine;

import io.treexform.core.rule.GlobalRules;
import io.treexform.core.rule.RuleConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the loaded rules and the global utilities they were compiled against.
 *
 * <p>
 * This is the unit of atomic swap in {@link RuleEngine#reload(List, List)}. Scans that captured an
 * older snapshot finish with it; later scans see the new one.
 *
 * <p>
 * Thread-safe: the rule map is unmodifiable. The {@link GlobalRules} is shared with the rules
 * compiled against it and only grows while loading.
 */
public final class RuleSet {

    private final GlobalRules globals;
    private final Map<String, RuleConfig> rules;

    RuleSet(GlobalRules globals, Map<String, RuleConfig> rules) {
        this.globals = globals;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /** A snapshot with no rules and no utilities. */
    public static RuleSet empty() {
        return new RuleSet(new GlobalRules(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public GlobalRules globals() {
        return globals;
    }

    /** The rule with {@code id}, or {@code null}. */
    public RuleConfig getRule(String id) {
        return rules.get(id);
    }

    /** Rules in load order. */
    public List<RuleConfig> rules() {
        return new ArrayList<>(rules.values());
    }

    public int ruleCount() {
        return rules.size();
    }

    public int utilCount() {
        return globals.size();
    }

    /** A copy of this snapshot with {@code rule} added or replacing the rule with the same id. */
    RuleSet withRule(RuleConfig rule) {
        Map<String, RuleConfig> updated = new LinkedHashMap<>(rules);
        updated.put(rule.id(), rule);
        return new RuleSet(globals, updated);
    }

    /**
     * Builder for a {@link RuleSet}. Utilities are registered in the builder's own
     * {@link GlobalRules}, so rules compiled against {@link #globals()} see them.
     */
    public static final class Builder {

        private final GlobalRules globals = new GlobalRules();
        private final Map<String, RuleConfig> rules = new LinkedHashMap<>();

        Builder() {}

        public GlobalRules globals() {
            return globals;
        }

        public Builder addRule(RuleConfig rule) {
            rules.put(rule.id(), rule);
            return this;
        }

        public RuleSet build() {
            return new RuleSet(globals, rules);
        }
    }
}
