package io.treexform.core.rule;

import io.treexform.core.match.Matcher;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.BitSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Refers to a utility rule by id. The referent is looked up when the rule is used, first among the
 * local utilities of {@code registration} and then among its global ones, so utilities may be
 * registered in any order.
 */
public record MatchesRule(String ruleId, RuleRegistration registration) implements Rule {

    public MatchesRule {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(registration, "registration must not be null");
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        Optional<Matcher> referent = registration.resolve(ruleId);
        return referent.isPresent() && referent.get().matchNode(node, env);
    }

    @Override
    public BitSet potentialKinds() {
        return registration.resolve(ruleId).map(Matcher::potentialKinds).orElse(null);
    }

    @Override
    public boolean isPositive() {
        return registration.resolveRule(ruleId).map(Rule::isPositive).orElse(true);
    }

    @Override
    public void collectReferents(Set<String> ids) {
        ids.add(ruleId);
    }

    @Override
    public boolean refersTo(String id) {
        if (ruleId.equals(id)) {
            return true;
        }
        return registration.resolveRule(ruleId).map(rule -> rule.refersTo(id)).orElse(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchesRule other)) {
            return false;
        }
        return ruleId.equals(other.ruleId) && registration == other.registration;
    }

    @Override
    public int hashCode() {
        return ruleId.hashCode();
    }

    @Override
    public String toString() {
        return "MatchesRule[" + ruleId + "]";
    }
}
