package io.tasklint.core.validation;

import io.tasklint.core.error.FieldError;
import io.tasklint.core.model.ObjectMeta;
import java.util.Optional;

/**
 * Validates object metadata (names, namespaces, labels). The rules live with whoever hosts the
 * validator; {@link #ACCEPT_ALL} is used when none is supplied.
 */
@FunctionalInterface
public interface ObjectMetaValidator {

    /** Accepts any metadata. */
    ObjectMetaValidator ACCEPT_ALL = meta -> Optional.empty();

    /**
     * @param metadata the metadata of the task being validated, never null
     * @return the first problem, with paths relative to {@code metadata}; empty if valid
     */
    Optional<FieldError> validate(ObjectMeta metadata);
}
