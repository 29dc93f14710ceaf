package io.treexform.core.rule;

import io.treexform.core.error.RegistrationLivenessException;
import io.treexform.core.error.UtilRuleException;
import io.treexform.core.match.Matcher;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The scope {@code matches} references and rewrite transforms resolve against.
 *
 * <p>
 * A registration holds three dictionaries: local utility rules that belong to one rule, the
 * engine-wide {@link GlobalRules}, and rewriters that a rule and its sub-rules share. Local ids
 * shadow global ones.
 *
 * <p>
 * A registration is closed when the rule that owns it fails to build. Resolving a reference
 * through a closed registration raises {@link RegistrationLivenessException}.
 */
public final class RuleRegistration {

    private final Map<String, Rule> locals = new ConcurrentHashMap<>();
    private final GlobalRules globals;
    private final Map<String, RuleCore> rewriters;
    private volatile boolean closed;

    /** A registration with its own, empty set of global rules. */
    public RuleRegistration() {
        this(new GlobalRules());
    }

    public RuleRegistration(GlobalRules globals) {
        this(globals, new ConcurrentHashMap<>());
    }

    private RuleRegistration(GlobalRules globals, Map<String, RuleCore> rewriters) {
        this.globals = Objects.requireNonNull(globals, "globals must not be null");
        this.rewriters = rewriters;
    }

    /**
     * A scope for a rewriter: it shares globals and rewriters with this one but has its own local
     * utilities.
     */
    public RuleRegistration newScope() {
        return new RuleRegistration(globals, rewriters);
    }

    public GlobalRules globals() {
        return globals;
    }

    /**
     * Registers a local utility rule.
     *
     * @throws UtilRuleException if the id is taken or the rule reaches itself
     */
    public void insertLocal(String id, Rule rule) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        if (locals.containsKey(id)) {
            throw new UtilRuleException(UtilRuleException.Reason.DUPLICATE, id);
        }
        if (rule.refersTo(id)) {
            throw new UtilRuleException(UtilRuleException.Reason.CYCLIC, id);
        }
        locals.put(id, rule);
    }

    /**
     * Registers a rewriter.
     *
     * @throws UtilRuleException if the id is taken
     */
    public void insertRewriter(String id, RuleCore core) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(core, "core must not be null");
        if (rewriters.putIfAbsent(id, core) != null) {
            throw new UtilRuleException(UtilRuleException.Reason.DUPLICATE, id);
        }
    }

    public Optional<RuleCore> rewriter(String id) {
        return Optional.ofNullable(rewriters.get(id));
    }

    public Map<String, RuleCore> rewriters() {
        return Collections.unmodifiableMap(rewriters);
    }

    public Map<String, Rule> locals() {
        return Collections.unmodifiableMap(locals);
    }

    /** Whether {@code id} names a local or global utility. */
    public boolean isDefined(String id) {
        return locals.containsKey(id) || globals.contains(id);
    }

    /**
     * Resolves a utility id to the matcher it names.
     *
     * @throws RegistrationLivenessException if this registration has been closed
     */
    public Optional<Matcher> resolve(String id) {
        ensureOpen(id);
        Rule local = locals.get(id);
        if (local != null) {
            return Optional.of(local);
        }
        return globals.get(id).map(Matcher.class::cast);
    }

    /** Like {@link #resolve(String)} but yields the rule tree itself for global utilities. */
    public Optional<Rule> resolveRule(String id) {
        ensureOpen(id);
        Rule local = locals.get(id);
        if (local != null) {
            return Optional.of(local);
        }
        return globals.get(id).map(RuleCore::rule);
    }

    /** Variables the local utilities can bind. */
    public Set<String> localVariables() {
        Set<String> names = new LinkedHashSet<>();
        locals.values().forEach(rule -> names.addAll(rule.definedVariables()));
        return names;
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen(String id) {
        if (closed) {
            throw new RegistrationLivenessException(id);
        }
    }
}
