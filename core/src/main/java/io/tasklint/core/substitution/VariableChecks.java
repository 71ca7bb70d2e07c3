package io.tasklint.core.substitution;

import io.tasklint.core.error.ErrorKind;
import io.tasklint.core.error.FieldError;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reference checks over a single field value, bound to one placeholder scope and one location.
 *
 * <p>
 * Every check returns the error for the first offending reference, naming the
 * field as {@code <containerPath>.<field>}; an empty result means the value is
 * acceptable.
 *
 * @param scanner       finds the placeholders of the scope being checked
 * @param locationName  kind of object holding the field, used in messages (e.g. {@code step})
 * @param containerPath path of the container the fields belong to (e.g. {@code taskspec.steps})
 */
public record VariableChecks(ReferenceScanner scanner, String locationName, String containerPath) {

    public VariableChecks {
        Objects.requireNonNull(scanner, "scanner must not be null");
        Objects.requireNonNull(locationName, "locationName must not be null");
        Objects.requireNonNull(containerPath, "containerPath must not be null");
    }

    /** Checks for step fields under {@code taskspec.steps}. */
    public static VariableChecks forSteps(ReferenceScanner scanner) {
        return new VariableChecks(scanner, "step", "taskspec.steps");
    }

    /** Reports the first reference to a variable that is not in {@code declared}. */
    public Optional<FieldError> findUndeclared(String field, String value, Set<String> declared) {
        for (VariableReference ref : scanner.scan(value)) {
            if (!declared.contains(ref.variable())) {
                return Optional.of(error(
                        ErrorKind.UNRESOLVED_VARIABLE_REFERENCE,
                        "non-existent variable in " + FieldError.quote(value) + " for " + locationName + " "
                                + field,
                        field));
            }
        }
        return Optional.empty();
    }

    /** Reports any reference to a variable in {@code arrayNames}, whatever its position. */
    public Optional<FieldError> findProhibitedArrayUse(String field, String value, Set<String> arrayNames) {
        for (VariableReference ref : scanner.scan(value)) {
            if (arrayNames.contains(ref.variable())) {
                return Optional.of(error(
                        ErrorKind.ILLEGAL_ARRAY_SPLICE,
                        "variable type invalid in " + FieldError.quote(value) + " for " + locationName + " "
                                + field,
                        field));
            }
        }
        return Optional.empty();
    }

    /**
     * Reports a reference to a variable in {@code arrayNames} when the value holds anything besides
     * its first placeholder.
     */
    public Optional<FieldError> findNonIsolatedArrayUse(String field, String value, Set<String> arrayNames) {
        List<VariableReference> refs = scanner.scan(value);
        if (refs.isEmpty()) {
            return Optional.empty();
        }
        boolean isolated = scanner.firstExpression(value).map(value::equals).orElse(false);
        for (VariableReference ref : refs) {
            if (arrayNames.contains(ref.variable()) && !isolated) {
                return Optional.of(error(
                        ErrorKind.ILLEGAL_ARRAY_SPLICE,
                        "variable is not properly isolated in " + FieldError.quote(value) + " for " + locationName + " "
                                + field,
                        field));
            }
        }
        return Optional.empty();
    }

    private FieldError error(ErrorKind kind, String message, String field) {
        return FieldError.of(kind, message, containerPath + "." + field);
    }
}
