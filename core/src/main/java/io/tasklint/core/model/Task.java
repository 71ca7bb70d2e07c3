package io.tasklint.core.model;

import java.util.Objects;

/**
 * A task document: metadata plus its {@link TaskSpec}. Immutable, thread-safe.
 *
 * @param metadata object metadata, never null
 * @param spec     the task specification, never null
 */
public record Task(ObjectMeta metadata, TaskSpec spec) {

    public Task {
        metadata = metadata != null ? metadata : ObjectMeta.empty();
        Objects.requireNonNull(spec, "spec must not be null");
    }
}
