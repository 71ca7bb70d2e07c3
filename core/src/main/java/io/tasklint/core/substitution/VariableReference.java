package io.tasklint.core.substitution;

/**
 * One placeholder found in a field value.
 *
 * @param expression the full placeholder text, e.g. {@code $(params.flags)}
 * @param path       the dotted path after the scope, e.g. {@code flags} or {@code repo.url}
 * @param start      index of {@code $} in the field value
 * @param end        index one past the closing parenthesis
 * @param wholeField {@code true} if the placeholder is the entire field value
 */
public record VariableReference(String expression, String path, int start, int end, boolean wholeField) {

    /**
     * The referenced variable: the path up to its first dot. {@code repo.url} refers to the variable
     * {@code repo}.
     */
    public String variable() {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }
}
