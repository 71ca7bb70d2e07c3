package io.tasklint.core.validation;

import java.util.regex.Pattern;

/** RFC 1123 label syntax, as used for step names. */
final class DnsLabel {

    static final int MAX_LENGTH = 63;
    static final String FORMAT = "[a-z0-9]([-a-z0-9]*[a-z0-9])?";
    private static final Pattern PATTERN = Pattern.compile(FORMAT);

    /** Remediation hint attached to step name errors. */
    static final String STEP_NAME_DETAILS = "Task step name must be a valid DNS Label, For more info refer to "
            + "https://kubernetes.io/docs/concepts/overview/working-with-objects/names/#names";

    private DnsLabel() {
        // utility class
    }

    static boolean isValid(String value) {
        return value.length() <= MAX_LENGTH && PATTERN.matcher(value).matches();
    }
}
