package io.tasklint.core.model;

import java.util.List;

/**
 * The {@code resources} block: input and output resource declarations.
 *
 * @param inputs  resources consumed by the task
 * @param outputs resources produced by the task
 */
public record TaskResources(List<TaskResource> inputs, List<TaskResource> outputs) {

    public TaskResources {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
