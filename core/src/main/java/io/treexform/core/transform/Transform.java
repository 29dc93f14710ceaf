package io.treexform.core.transform;

import io.treexform.core.error.TransformDefinitionException;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.meta.MetaVariable;
import io.treexform.core.rule.RuleRegistration;
import io.treexform.core.spi.Language;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code transform} section of a rule: new variables computed from captured ones after a
 * match.
 *
 * <p>
 * A transform may read a variable computed by another transform, so they run in dependency
 * order. The order is fixed when the section is built; a cycle is rejected there.
 */
public final class Transform {

    private final Map<String, Trans> ordered;

    private Transform(Map<String, Trans> ordered) {
        this.ordered = ordered;
    }

    /**
     * Orders {@code transforms} so that every transform runs after the one it reads from.
     *
     * @param transforms new variable name to transformation
     * @return the ordered transform
     * @throws TransformDefinitionException if the transforms depend on each other in a cycle
     */
    public static Transform of(Map<String, Trans> transforms) {
        Map<String, Trans> ordered = new LinkedHashMap<>();
        Set<String> visiting = new HashSet<>();
        for (String key : transforms.keySet()) {
            visit(key, transforms, ordered, visiting);
        }
        return new Transform(Collections.unmodifiableMap(ordered));
    }

    private static void visit(String key, Map<String, Trans> all, Map<String, Trans> ordered, Set<String> visiting) {
        if (ordered.containsKey(key)) {
            return;
        }
        if (!visiting.add(key)) {
            throw new TransformDefinitionException("Transform variable '" + key + "' has a cyclic dependency");
        }
        Trans trans = all.get(key);
        if (all.containsKey(trans.source())) {
            visit(trans.source(), all, ordered, visiting);
        }
        visiting.remove(key);
        ordered.put(key, trans);
    }

    /**
     * Reads the source of a transformation, e.g. {@code $A} or {@code $$$ARGS}.
     *
     * @return the variable name without meta characters
     * @throws TransformDefinitionException if {@code source} is not a capturing meta-variable
     */
    public static String parseSource(Language language, String source) {
        String processed = language.preProcessPattern(source);
        Optional<MetaVariable> variable = MetaVariable.parse(processed, language.expandoChar());
        if (variable.isEmpty() || variable.get().name().isEmpty()) {
            throw new TransformDefinitionException("Transform source '" + source + "' must be a $-prefixed meta-variable");
        }
        return variable.get().name().get();
    }

    /** Variable names this transform defines, in evaluation order. */
    public List<String> keys() {
        return new ArrayList<>(ordered.keySet());
    }

    public Map<String, Trans> transformations() {
        return ordered;
    }

    /** Source variables that must come from the match rather than from another transform. */
    public Set<String> usedVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (Trans trans : ordered.values()) {
            if (!ordered.containsKey(trans.source())) {
                names.add(trans.source());
            }
        }
        return names;
    }

    public Set<String> usedRewriters() {
        Set<String> ids = new LinkedHashSet<>();
        for (Trans trans : ordered.values()) {
            if (trans instanceof Rewrite rewrite) {
                ids.addAll(rewrite.rewriters());
            }
        }
        return ids;
    }

    /**
     * Computes every transformed variable into {@code env}. A transform whose source is unbound
     * yields the empty string.
     */
    public void apply(MetaVarEnv env, RuleRegistration registration) {
        for (Map.Entry<String, Trans> entry : ordered.entrySet()) {
            String value = entry.getValue().apply(env, registration).orElse("");
            env.insertTransformed(entry.getKey(), value);
        }
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }
}
