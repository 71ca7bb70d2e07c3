package io.tasklint.standalone.lint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Results of one linter run, in the order the files were visited.
 *
 * <p>
 * Text rendering prints one line per file ({@code path: OK} or
 * {@code path: <error>}). JSON rendering produces a single object:
 * <pre>{@code
 * {
 * "valid": 1,
 * "invalid": 1,
 * "results": [
 *   { "file": "a.yaml", "task": "build", "status": "VALID" },
 *   { "file": "b.yaml", "task": "test", "status": "INVALID", "stage": "VARIABLES",
 *     "message": "...", "paths": ["taskspec.steps.arg[0]"] }
 * ]
 * }
 * }</pre>
 */
public record LintReport(List<LintResult> results) {

    /** All tasks passed. */
    public static final int EXIT_OK = 0;

    /** At least one task was invalid or could not be parsed. */
    public static final int EXIT_INVALID = 1;

    /** Bad arguments or configuration. */
    public static final int EXIT_USAGE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public LintReport {
        results = List.copyOf(results);
    }

    public long validCount() {
        return results.stream().filter(LintResult::isValid).count();
    }

    public long invalidCount() {
        return results.size() - validCount();
    }

    public int exitCode() {
        return invalidCount() == 0 ? EXIT_OK : EXIT_INVALID;
    }

    public String renderText() {
        StringBuilder sb = new StringBuilder();
        for (LintResult r : results) {
            sb.append(r.file()).append(": ");
            sb.append(r.isValid() ? "OK" : r.message());
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    public String renderJson() {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("valid", validCount());
        root.put("invalid", invalidCount());
        ArrayNode array = root.putArray("results");
        for (LintResult r : results) {
            ObjectNode node = array.addObject();
            node.put("file", r.file().toString());
            if (r.taskName() != null) {
                node.put("task", r.taskName());
            }
            node.put("status", r.status().name());
            if (r.stage() != null) {
                node.put("stage", r.stage().name());
            }
            if (!r.isValid()) {
                node.put("message", r.message());
            }
            if (!r.paths().isEmpty()) {
                ArrayNode paths = node.putArray("paths");
                r.paths().forEach(paths::add);
            }
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render lint report", e);
        }
    }
}
