package io.tasklint.core.model;

/**
 * A single environment variable of a step.
 *
 * @param name  variable name
 * @param value variable value, may contain placeholders
 */
public record EnvVar(String name, String value) {

    public EnvVar {
        name = name != null ? name : "";
        value = value != null ? value : "";
    }
}
