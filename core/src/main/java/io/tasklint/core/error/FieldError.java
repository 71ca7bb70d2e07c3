package io.tasklint.core.error;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured validation failure: what is wrong, where, and optionally how to fix it.
 *
 * <p>
 * Paths are dot/bracket-indexed field paths such as
 * {@code taskspec.steps.volumeMount[2].MountPath}. The empty path denotes the
 * object being validated itself; {@link #viaField(String)} turns it into the
 * prefix.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param kind    error classification
 * @param message human-readable description
 * @param paths   one or more field paths, never empty
 * @param details optional remediation hint, {@code ""} when absent
 */
public record FieldError(ErrorKind kind, String message, List<String> paths, String details) {

    /** The path of the object being validated itself. */
    public static final String CURRENT_FIELD = "";

    public FieldError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        paths = paths != null ? List.copyOf(paths) : List.of(CURRENT_FIELD);
        details = details != null ? details : "";
    }

    public static FieldError of(ErrorKind kind, String message, String... paths) {
        return new FieldError(kind, message, List.of(paths), "");
    }

    /** A required field is missing. */
    public static FieldError missingField(String... paths) {
        return of(ErrorKind.MISSING_REQUIRED_FIELD, "missing field(s)", paths);
    }

    /** {@code value} is not acceptable at {@code path}. */
    public static FieldError invalidValue(ErrorKind kind, Object value, String path) {
        return of(kind, "invalid value: " + value, path);
    }

    /** More than one of a set of mutually exclusive fields is populated. */
    public static FieldError multipleOneOf(ErrorKind kind, String... paths) {
        return of(kind, "expected exactly one, got both", paths);
    }

    /**
     * Double-quotes {@code value} for use in a message, escaping backslashes, quotes, newlines and
     * tabs.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /** Returns a copy carrying the given remediation hint. */
    public FieldError withDetails(String hint) {
        return new FieldError(kind, message, paths, hint);
    }

    /**
     * Returns a copy with every path nested under {@code prefix}. The current field becomes the
     * prefix itself.
     */
    public FieldError viaField(String prefix) {
        List<String> nested = paths.stream()
                .map(p -> p.isEmpty() ? prefix : prefix + "." + p)
                .collect(Collectors.toList());
        return new FieldError(kind, message, nested, details);
    }

    /** Returns the first path; the one that names the offending field. */
    public String path() {
        return paths.get(0);
    }

    /** Renders {@code message: path1, path2} followed by the details on a new line, if any. */
    @Override
    public String toString() {
        String rendered = message + ": " + String.join(", ", paths);
        return details.isEmpty() ? rendered : rendered + "\n" + details;
    }
}
