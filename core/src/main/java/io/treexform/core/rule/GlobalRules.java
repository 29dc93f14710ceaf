package io.treexform.core.rule;

import io.treexform.core.error.UtilRuleException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Utility rules shared by every rule of an engine, keyed by id.
 *
 * <p>
 * Written while rule files are loaded and read concurrently afterwards. Insertion rejects
 * duplicates and rules that would make a {@code matches} cycle, so the registered rules never
 * form one.
 */
public final class GlobalRules {

    private final Map<String, RuleCore> rules = new ConcurrentHashMap<>();

    /**
     * Registers a global utility rule.
     *
     * @param id   the utility id
     * @param core the compiled utility
     * @throws UtilRuleException if the id is taken or the rule reaches itself
     */
    public void insert(String id, RuleCore core) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(core, "core must not be null");
        if (rules.containsKey(id)) {
            throw new UtilRuleException(UtilRuleException.Reason.DUPLICATE, id);
        }
        if (core.rule().refersTo(id)) {
            throw new UtilRuleException(UtilRuleException.Reason.CYCLIC, id);
        }
        rules.put(id, core);
    }

    public Optional<RuleCore> get(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    public boolean contains(String id) {
        return rules.containsKey(id);
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public int size() {
        return rules.size();
    }
}
