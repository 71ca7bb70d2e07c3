package io.tasklint.core.error;

/**
 * Thrown when a task document cannot be read: invalid YAML, a structure that does not match the
 * task schema, or unknown keys. Carries the file or resource the document came from.
 */
public final class TaskParseException extends TaskLintException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public TaskParseException(String message, String taskName, String source) {
        super(message, taskName, Phase.PARSE);
        this.source = source;
    }

    public TaskParseException(String message, Throwable cause, String taskName, String source) {
        super(message, cause, taskName, Phase.PARSE);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
