package io.treexform.core.config;

import io.treexform.core.match.MatchStrictness;
import io.treexform.core.match.Pattern;
import java.util.Objects;

/**
 * Engine-wide settings. Use {@link #builder()} or {@link EngineConfigLoader} to create one.
 *
 * @param defaultStrictness strictness of patterns that do not set their own
 * @param maxEllipsisSteps  backtracking budget of one pattern match against one node
 * @param pruning           skip nodes whose kind a rule can never match during scans
 */
public record EngineConfig(MatchStrictness defaultStrictness, int maxEllipsisSteps, boolean pruning) {

    /** Smart strictness, the default ellipsis budget and pruning on. */
    public static final EngineConfig DEFAULT = builder().build();

    public EngineConfig {
        Objects.requireNonNull(defaultStrictness, "defaultStrictness must not be null");
        if (maxEllipsisSteps <= 0) {
            throw new IllegalArgumentException("maxEllipsisSteps must be positive: " + maxEllipsisSteps);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EngineConfig}; every field has a default. */
    public static final class Builder {
        private MatchStrictness defaultStrictness = MatchStrictness.SMART;
        private int maxEllipsisSteps = Pattern.DEFAULT_MAX_ELLIPSIS_STEPS;
        private boolean pruning = true;

        Builder() {}

        public Builder defaultStrictness(MatchStrictness defaultStrictness) {
            this.defaultStrictness = defaultStrictness;
            return this;
        }

        public Builder maxEllipsisSteps(int maxEllipsisSteps) {
            this.maxEllipsisSteps = maxEllipsisSteps;
            return this;
        }

        public Builder pruning(boolean pruning) {
            this.pruning = pruning;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(defaultStrictness, maxEllipsisSteps, pruning);
        }
    }
}
