package io.treexform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.treexform.core.match.MatchStrictness;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * matching:
 *   strictness: smart
 *   max-ellipsis-steps: 65536
 * scan:
 *   pruning: true
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults of {@link EngineConfig.Builder}. {@code TREEXFORM_STRICTNESS},
 * {@code TREEXFORM_MAX_ELLIPSIS_STEPS} and {@code TREEXFORM_PRUNING} override the file. A variable
 * counts as set only if its trimmed value is non-empty.
 */
public final class EngineConfigLoader {

    static final String ENV_STRICTNESS = "TREEXFORM_STRICTNESS";
    static final String ENV_MAX_ELLIPSIS_STEPS = "TREEXFORM_MAX_ELLIPSIS_STEPS";
    static final String ENV_PRUNING = "TREEXFORM_PRUNING";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds an invalid value
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying variables from {@code envLookup}.
     *
     * @param configPath path to the YAML file
     * @param envLookup  maps a variable name to its value, or {@code null} if undefined
     * @throws ConfigLoadException if the file is missing, unreadable or holds an invalid value
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Configuration from the environment alone, on top of the defaults. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        JsonNode matching = root.path("matching");
        if (matching.has("strictness")) {
            builder.defaultStrictness(strictness(matching.get("strictness").asText()));
        }
        if (matching.has("max-ellipsis-steps")) {
            builder.maxEllipsisSteps(matching.get("max-ellipsis-steps").asInt());
        }
        JsonNode scan = root.path("scan");
        if (scan.has("pruning")) {
            builder.pruning(scan.get("pruning").asBoolean());
        }

        envString(envLookup, ENV_STRICTNESS, value -> builder.defaultStrictness(strictness(value)));
        envInt(envLookup, ENV_MAX_ELLIPSIS_STEPS, builder::maxEllipsisSteps);
        envBool(envLookup, ENV_PRUNING, builder::pruning);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static MatchStrictness strictness(String value) {
        try {
            return MatchStrictness.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid strictness: " + value, e);
        }
    }

    /** True if the variable is defined and not blank. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Invalid integer in " + envVar + ": " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
