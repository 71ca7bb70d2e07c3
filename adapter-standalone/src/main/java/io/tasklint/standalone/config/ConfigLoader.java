package io.tasklint.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link LintConfig} from an optional YAML file with an environment
 * variable overlay.
 *
 * <p>
 * YAML layout:
 * <pre>{@code
 * logging:
 *   format: text
 *   level: INFO
 * output:
 *   format: json
 * fail-fast: false
 * }</pre>
 *
 * <p>
 * Environment variables {@code LOG_FORMAT}, {@code LOG_LEVEL},
 * {@code OUTPUT_FORMAT} and {@code FAIL_FAST} take precedence over YAML
 * values. A variable counts as set only when it is defined and its trimmed
 * value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an unsupported
     *                             value
     */
    public static LintConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@code envLookup}.
     * A {@code null} result from the lookup means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an unsupported
     *                             value
     */
    public static LintConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode()) {
            return fromEnvironment(envLookup);
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration must be a YAML mapping: " + configPath);
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * Builds configuration from defaults and environment variables only, for runs without a
     * configuration file.
     */
    public static LintConfig fromEnvironment(Function<String, String> envLookup) {
        LintConfig.Builder builder = LintConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Returns the path following {@code --config}, if present.
     *
     * @param args command-line arguments
     * @throws IllegalArgumentException if {@code --config} is the last argument
     */
    public static Optional<Path> resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        return Optional.empty();
    }

    private static LintConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        LintConfig.Builder builder = LintConfig.builder();

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode output = root.path("output");
        if (output.has("format")) builder.outputFormat(output.get("format").asText());

        if (root.has("fail-fast")) builder.failFast(root.get("fail-fast").asBoolean());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(LintConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "OUTPUT_FORMAT", builder::outputFormat);
        envBool(envLookup, "FAIL_FAST", builder::failFast);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
