package io.tasklint.standalone.lint;

import io.tasklint.core.error.FieldError;
import io.tasklint.core.error.TaskParseException;
import io.tasklint.core.validation.ValidationResult;
import io.tasklint.core.validation.ValidationStage;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of linting one task file.
 *
 * @param file     the file that was linted
 * @param taskName {@code metadata.name} of the task, or null when absent or unparseable
 * @param status   overall verdict
 * @param stage    validation stage that failed, null unless {@code status} is INVALID
 * @param message  failure description, {@code ""} when valid
 * @param paths    offending field paths, empty unless {@code status} is INVALID
 */
public record LintResult(
        Path file, String taskName, Status status, ValidationStage stage, String message, List<String> paths) {

    /** Overall verdict for one file. */
    public enum Status {
        /** Parsed and passed every check. */
        VALID,
        /** Parsed but rejected by the validator. */
        INVALID,
        /** Could not be read or parsed. */
        UNPARSEABLE
    }

    public LintResult {
        message = message != null ? message : "";
        paths = paths != null ? List.copyOf(paths) : List.of();
    }

    static LintResult of(Path file, String taskName, ValidationResult result) {
        if (result.isValid()) {
            return new LintResult(file, taskName, Status.VALID, null, "", List.of());
        }
        FieldError error = result.error();
        return new LintResult(file, taskName, Status.INVALID, result.failedStage(), error.toString(), error.paths());
    }

    static LintResult unparseable(Path file, TaskParseException e) {
        return new LintResult(file, e.taskName(), Status.UNPARSEABLE, null, e.getMessage(), List.of());
    }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
