package io.tasklint.standalone.config;

import java.util.Locale;
import java.util.Set;

/**
 * Configuration of the command-line linter.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances;
 * {@link Builder#build()} rejects unsupported formats.
 *
 * @param loggingFormat {@code json} or {@code text}
 * @param loggingLevel  root log level
 * @param outputFormat  report format: {@code text} or {@code json}
 * @param failFast      stop at the first task that does not pass
 */
public record LintConfig(String loggingFormat, String loggingLevel, String outputFormat, boolean failFast) {

    static final Set<String> FORMATS = Set.of("json", "text");

    public static Builder builder() {
        return new Builder();
    }

    /** Configuration with every default applied. */
    public static LintConfig defaults() {
        return builder().build();
    }

    /** Returns {@code true} if the report should be rendered as JSON. */
    public boolean jsonOutput() {
        return "json".equals(outputFormat);
    }

    /** Builder for {@link LintConfig}. */
    public static final class Builder {
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private String outputFormat = "text";
        private boolean failFast;

        Builder() {}

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public LintConfig build() {
            return new LintConfig(
                    requireFormat("logging.format", loggingFormat),
                    loggingLevel.toUpperCase(Locale.ROOT),
                    requireFormat("output.format", outputFormat),
                    failFast);
        }

        private static String requireFormat(String key, String value) {
            String normalized = value.toLowerCase(Locale.ROOT);
            if (!FORMATS.contains(normalized)) {
                throw new ConfigLoadException(
                        "Unsupported " + key + " '" + value + "': expected one of " + FORMATS.stream()
                                .sorted()
                                .toList());
            }
            return normalized;
        }
    }
}
