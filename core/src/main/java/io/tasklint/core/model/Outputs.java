package io.tasklint.core.model;

import java.util.List;

/**
 * Deprecated {@code outputs} block, superseded by {@code resources.outputs}.
 *
 * @param resources output resources
 */
public record Outputs(List<TaskResource> resources) {

    public Outputs {
        resources = resources != null ? List.copyOf(resources) : List.of();
    }
}
