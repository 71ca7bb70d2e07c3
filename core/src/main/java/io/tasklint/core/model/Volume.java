package io.tasklint.core.model;

/**
 * A volume declared at task level and available to every step.
 *
 * @param name volume name, unique within the task
 */
public record Volume(String name) {

    public Volume {
        name = name != null ? name : "";
    }
}
