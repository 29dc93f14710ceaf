package io.treexform.core.transform;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.rule.RuleRegistration;
import java.util.Optional;

/**
 * One transformation in a {@code transform} section. Each one reads a single source
 * meta-variable and computes a string.
 */
public sealed interface Trans permits Substring, Replace, Convert, Rewrite {

    /** Name of the source meta-variable, without the meta character. */
    String source();

    /**
     * Computes the transformed value.
     *
     * @param env          bindings of the current match, earlier transforms included
     * @param registration where rewriters are looked up
     * @return the value, or empty if the source variable is unbound
     */
    Optional<String> apply(MetaVarEnv env, RuleRegistration registration);
}
