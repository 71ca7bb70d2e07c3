package io.tasklint.core.validation;

import io.tasklint.core.error.FieldError;
import java.util.Objects;

/**
 * Verdict of one validation pass. Either valid, or invalid with exactly one {@link FieldError}
 * and the stage that produced it.
 *
 * @param error       the first failure, or null when valid
 * @param failedStage the stage that failed, or null when valid
 */
public record ValidationResult(FieldError error, ValidationStage failedStage) {

    private static final ValidationResult VALID = new ValidationResult(null, null);

    public ValidationResult {
        if ((error == null) != (failedStage == null)) {
            throw new IllegalArgumentException("error and failedStage must both be set or both be null");
        }
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(FieldError error, ValidationStage stage) {
        return new ValidationResult(
                Objects.requireNonNull(error, "error must not be null"),
                Objects.requireNonNull(stage, "stage must not be null"));
    }

    public boolean isValid() {
        return error == null;
    }
}
