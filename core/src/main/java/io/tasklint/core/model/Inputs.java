package io.tasklint.core.model;

import java.util.List;

/**
 * Deprecated {@code inputs} block. Superseded by {@code params} and {@code resources.inputs};
 * still accepted as long as the replacement is not populated at the same time.
 *
 * @param resources input resources
 * @param params    input parameters
 */
public record Inputs(List<TaskResource> resources, List<ParamSpec> params) {

    public Inputs {
        resources = resources != null ? List.copyOf(resources) : List.of();
        params = params != null ? List.copyOf(params) : List.of();
    }
}
