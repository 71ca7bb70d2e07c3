package io.tasklint.standalone.config;

/**
 * Thrown when linter configuration cannot be loaded: missing file, invalid
 * YAML, or an unsupported value. The message is meant for the command line.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
