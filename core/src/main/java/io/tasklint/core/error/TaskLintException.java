package io.tasklint.core.error;

/**
 * Abstract base for all task-lint exceptions. Never thrown directly; use {@link
 * TaskParseException} or {@link TaskValidationException}.
 */
public abstract class TaskLintException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        VALIDATION
    }

    private final String taskName;
    private final Phase phase;

    protected TaskLintException(String message, String taskName, Phase phase) {
        super(message);
        this.taskName = taskName;
        this.phase = phase;
    }

    protected TaskLintException(String message, Throwable cause, String taskName, Phase phase) {
        super(message, cause);
        this.taskName = taskName;
        this.phase = phase;
    }

    /** The task that triggered the error, or {@code null} if not yet identified. */
    public String taskName() {
        return taskName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }
}
