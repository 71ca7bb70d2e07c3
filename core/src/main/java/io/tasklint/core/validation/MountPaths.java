package io.tasklint.core.validation;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Lexical cleaning of slash-separated container paths.
 *
 * <p>
 * Paths here name locations inside a container, not on the host, so
 * {@link java.nio.file.Path} is not used: the result must not depend on the
 * platform the validator runs on.
 */
final class MountPaths {

    private MountPaths() {
        // utility class
    }

    /**
     * Returns the shortest path equivalent to {@code path}: repeated slashes collapse, {@code .}
     * elements are dropped, {@code ..} removes the preceding element (and is dropped at the root),
     * and the trailing slash goes. An empty path cleans to {@code .}.
     */
    static String clean(String path) {
        if (path == null || path.isEmpty()) {
            return ".";
        }
        boolean rooted = path.charAt(0) == '/';
        Deque<String> elements = new ArrayDeque<>();
        for (String element : path.split("/")) {
            if (element.isEmpty() || element.equals(".")) {
                continue;
            }
            if (element.equals("..")) {
                if (!elements.isEmpty() && !elements.peekLast().equals("..")) {
                    elements.removeLast();
                } else if (!rooted) {
                    elements.addLast("..");
                }
                continue;
            }
            elements.addLast(element);
        }
        String joined = String.join("/", elements);
        if (rooted) {
            return "/" + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }
}
