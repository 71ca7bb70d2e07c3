package io.tasklint.core.substitution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code $(<scope>.<name>)} placeholders inside arbitrary text.
 *
 * <p>
 * The scope is a regular expression fragment (for example
 * {@code (?:inputs|outputs)\.params}); the name is
 * {@code [_a-zA-Z][_a-zA-Z0-9.-]*}. Anything that does not form a complete
 * placeholder, such as an unbalanced {@code $(params.x}, is plain text.
 *
 * <p>
 * Thread-safe: the compiled pattern is immutable and every scan uses its own
 * {@link Matcher}.
 */
public final class ReferenceScanner {

    /** Name grammar of a variable path. */
    static final String NAME_PATTERN = "[_a-zA-Z][_a-zA-Z0-9.-]*";

    /** {@code $(params.<name>)}. */
    public static final ReferenceScanner PARAMS = new ReferenceScanner("params");

    /** {@code $(inputs.params.<name>)} and {@code $(outputs.params.<name>)}. */
    public static final ReferenceScanner LEGACY_PARAMS = new ReferenceScanner("(?:inputs|outputs)\\.params");

    /** {@code $(resources.inputs.<name>)} and {@code $(resources.outputs.<name>)}. */
    public static final ReferenceScanner RESOURCES = new ReferenceScanner("resources\\.(?:inputs|outputs)");

    /** {@code $(inputs.resources.<name>)} and {@code $(outputs.resources.<name>)}. */
    public static final ReferenceScanner LEGACY_RESOURCES = new ReferenceScanner("(?:inputs|outputs)\\.resources");

    private final String scope;
    private final Pattern pattern;

    /**
     * Creates a scanner for the given scope.
     *
     * @param scope regular expression fragment matching the scope part of a placeholder
     * @throws java.util.regex.PatternSyntaxException if the scope is not a valid expression
     */
    public ReferenceScanner(String scope) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.pattern = Pattern.compile("\\$\\((?:" + scope + ")\\.(" + NAME_PATTERN + ")\\)");
    }

    /**
     * Returns every placeholder in {@code value}, in order of appearance.
     *
     * @param value the field value, may be null
     * @return immutable list of references, empty if there are none
     */
    public List<VariableReference> scan(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        List<VariableReference> refs = new ArrayList<>();
        Matcher m = pattern.matcher(value);
        while (m.find()) {
            boolean whole = m.start() == 0 && m.end() == value.length();
            refs.add(new VariableReference(m.group(), m.group(1), m.start(), m.end(), whole));
        }
        return Collections.unmodifiableList(refs);
    }

    /**
     * Returns the text of the first placeholder in {@code value}.
     *
     * @param value the field value, may be null
     * @return the first placeholder, or empty if there is none
     */
    public Optional<String> firstExpression(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(value);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    @Override
    public String toString() {
        return "ReferenceScanner[" + scope + "]";
    }
}
