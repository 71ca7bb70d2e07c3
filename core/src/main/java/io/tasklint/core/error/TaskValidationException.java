package io.tasklint.core.error;

import java.util.Objects;

/** Thrown by {@code TaskValidator.requireValid} when a task fails validation. */
public final class TaskValidationException extends TaskLintException {

    private static final long serialVersionUID = 1L;

    private final transient FieldError fieldError;

    public TaskValidationException(FieldError fieldError, String taskName) {
        super(Objects.requireNonNull(fieldError, "fieldError must not be null").toString(), taskName, Phase.VALIDATION);
        this.fieldError = fieldError;
    }

    /** The structured error the validator returned. */
    public FieldError fieldError() {
        return fieldError;
    }
}
