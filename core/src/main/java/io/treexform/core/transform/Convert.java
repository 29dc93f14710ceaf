package io.treexform.core.transform;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.rule.RuleRegistration;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Converts the source text to another {@link StringCase}. */
public record Convert(String source, StringCase toCase, List<Separator> separatedBy) implements Trans {

    public Convert {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(toCase, "toCase must not be null");
        separatedBy = separatedBy == null ? null : List.copyOf(separatedBy);
    }

    @Override
    public Optional<String> apply(MetaVarEnv env, RuleRegistration registration) {
        Set<Separator> separators = separatedBy == null || separatedBy.isEmpty() ? null : EnumSet.copyOf(separatedBy);
        return SourceValue.of(env, source).map(text -> toCase.apply(text, separators));
    }
}
