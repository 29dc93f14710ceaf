package io.treexform.core.rule;

import io.treexform.core.error.RuleParseException;
import io.treexform.core.error.TransformDefinitionException;
import io.treexform.core.error.UndefinedMetaVariableException;
import io.treexform.core.error.UtilRuleException;
import io.treexform.core.match.Matcher;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.replace.Fixer;
import io.treexform.core.transform.Transform;
import io.treexform.core.tree.Document;
import io.treexform.core.tree.Edit;
import io.treexform.core.tree.Node;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A compiled rule ready to match: the rule tree, constraints on captured variables, a transform
 * and the fixes.
 *
 * <p>
 * Matching runs the rule, then checks that every constrained single capture matches its
 * constraint, then computes the transformed variables. The environment is only updated when all
 * three succeed.
 *
 * <p>
 * Instances are immutable and thread-safe; use {@link #builder(Rule, RuleRegistration)} to create
 * one.
 */
public final class RuleCore implements Matcher {

    private final Rule rule;
    private final Map<String, Rule> constraints;
    private final Transform transform;
    private final List<Fixer> fixers;
    private final BitSet kinds;
    private final RuleRegistration registration;

    private RuleCore(Builder builder) {
        this.rule = builder.rule;
        this.constraints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.constraints));
        this.transform = builder.transform;
        this.fixers = List.copyOf(builder.fixers);
        this.kinds = rule.potentialKinds();
        this.registration = builder.registration;
    }

    public static Builder builder(Rule rule, RuleRegistration registration) {
        return new Builder(rule, registration);
    }

    public Rule rule() {
        return rule;
    }

    public Map<String, Rule> constraints() {
        return constraints;
    }

    public Optional<Transform> transform() {
        return Optional.ofNullable(transform);
    }

    public List<Fixer> fixers() {
        return fixers;
    }

    /** The first fix, which is the one applied automatically. */
    public Optional<Fixer> fixer() {
        return fixers.isEmpty() ? Optional.empty() : Optional.of(fixers.get(0));
    }

    public RuleRegistration registration() {
        return registration;
    }

    /** Variables bound after a successful match: captures of the rule and transformed names. */
    public Set<String> definedVariables() {
        Set<String> names = new LinkedHashSet<>(rule.definedVariables());
        names.addAll(registration.localVariables());
        if (transform != null) {
            names.addAll(transform.keys());
        }
        return names;
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        MetaVarEnv local = env.copy();
        if (!rule.matchNode(node, local)) {
            return false;
        }
        if (!constraintsHold(local)) {
            return false;
        }
        if (transform != null) {
            transform.apply(local, registration);
        }
        env.absorb(local);
        return true;
    }

    private boolean constraintsHold(MetaVarEnv env) {
        for (Map.Entry<String, Rule> entry : constraints.entrySet()) {
            Optional<Node> captured = env.get(entry.getKey());
            if (captured.isPresent() && !entry.getValue().matchNode(captured.get(), env.copy())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public BitSet potentialKinds() {
        return kinds;
    }

    /** Edits applying {@code fixer} to every non-overlapping match in {@code document}. */
    public List<Edit> replaceAll(Document document, Fixer fixer) {
        return document.root().replaceAll(this, fixer);
    }

    /** Edits applying this rule's own fix, or none if the rule has no fix. */
    public List<Edit> fixAll(Document document) {
        return fixer().map(fix -> replaceAll(document, fix)).orElse(List.of());
    }

    @Override
    public String toString() {
        return "RuleCore[" + rule + "]";
    }

    /**
     * Builder that checks a rule core for consistency: every {@code matches} reference is defined,
     * the rule selects nodes by itself, and every variable used by constraints, transforms and
     * fixes is defined. A failed build closes the registration the rule was compiled against.
     */
    public static final class Builder {

        private final Rule rule;
        private final RuleRegistration registration;
        private final Map<String, Rule> constraints = new LinkedHashMap<>();
        private Transform transform;
        private final List<Fixer> fixers = new ArrayList<>();

        private Builder(Rule rule, RuleRegistration registration) {
            this.rule = Objects.requireNonNull(rule, "rule must not be null");
            this.registration = Objects.requireNonNull(registration, "registration must not be null");
        }

        public Builder constraint(String variable, Rule constraint) {
            constraints.put(variable, constraint);
            return this;
        }

        public Builder constraints(Map<String, Rule> all) {
            constraints.putAll(all);
            return this;
        }

        public Builder transform(Transform value) {
            this.transform = value;
            return this;
        }

        public Builder fixer(Fixer fixer) {
            fixers.add(fixer);
            return this;
        }

        public Builder fixers(List<Fixer> all) {
            fixers.addAll(all);
            return this;
        }

        /**
         * Checks and builds the rule core.
         *
         * @throws UtilRuleException              for a reference to an undefined utility
         * @throws RuleParseException             if the rule does not select nodes by itself
         * @throws TransformDefinitionException   if a transform redefines a captured variable
         * @throws UndefinedMetaVariableException if a variable is used but never defined
         */
        public RuleCore build() {
            try {
                verifyReferents();
                if (!rule.isPositive()) {
                    throw new RuleParseException(
                            "Rule must specify a set of AST kinds to match. Try adding a `kind` or `pattern` rule",
                            null,
                            null);
                }
                Set<String> defined = new LinkedHashSet<>(rule.definedVariables());
                defined.addAll(registration.localVariables());
                if (transform != null) {
                    for (String key : transform.keys()) {
                        if (defined.contains(key)) {
                            throw new TransformDefinitionException("Transform variable '" + key + "' is already defined");
                        }
                    }
                }
                for (String variable : constraints.keySet()) {
                    if (!defined.contains(variable)) {
                        throw new UndefinedMetaVariableException(variable, "constraints");
                    }
                }
                if (transform != null) {
                    for (String variable : transform.usedVariables()) {
                        if (!defined.contains(variable)) {
                            throw new UndefinedMetaVariableException(variable, "transform");
                        }
                    }
                    defined.addAll(transform.keys());
                }
                for (Fixer fixer : fixers) {
                    for (String variable : fixer.usedVariables()) {
                        if (!defined.contains(variable)) {
                            throw new UndefinedMetaVariableException(variable, "fix");
                        }
                    }
                }
                return new RuleCore(this);
            } catch (RuntimeException e) {
                registration.close();
                throw e;
            }
        }

        private void verifyReferents() {
            Set<String> ids = new LinkedHashSet<>();
            rule.collectReferents(ids);
            constraints.values().forEach(constraint -> constraint.collectReferents(ids));
            registration.locals().values().forEach(local -> local.collectReferents(ids));
            fixers.forEach(fixer -> fixer.collectReferents(ids));
            for (String id : ids) {
                if (!registration.isDefined(id)) {
                    throw new UtilRuleException(UtilRuleException.Reason.UNDEFINED, id);
                }
            }
        }
    }
}
