package io.tasklint.standalone.lint;

import io.tasklint.core.error.TaskParseException;
import io.tasklint.core.model.Task;
import io.tasklint.core.spec.TaskParser;
import io.tasklint.core.validation.TaskValidator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses and validates task files.
 *
 * <p>
 * Directory arguments are expanded to the {@code *.yaml} and {@code *.yml}
 * files below them, sorted by path. With fail-fast enabled the run stops at
 * the first file that does not pass.
 */
public final class TaskLinter {

    private static final Logger LOG = LoggerFactory.getLogger(TaskLinter.class);

    private final TaskParser parser;
    private final TaskValidator validator;
    private final boolean failFast;

    public TaskLinter(TaskParser parser, TaskValidator validator, boolean failFast) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.failFast = failFast;
    }

    /**
     * Lints every task file named by {@code targets}.
     *
     * @param targets files or directories
     * @return one result per visited file
     * @throws UncheckedIOException if a directory cannot be listed
     */
    public LintReport lint(List<Path> targets) {
        List<LintResult> results = new ArrayList<>();
        for (Path file : expand(targets)) {
            LintResult result = lintFile(file);
            results.add(result);
            if (failFast && !result.isValid()) {
                LOG.info("Stopping after {} (fail-fast)", file);
                break;
            }
        }
        LintReport report = new LintReport(results);
        LOG.info("Linted {} task file(s): {} valid, {} invalid",
                results.size(), report.validCount(), report.invalidCount());
        return report;
    }

    /** Parses and validates a single file. */
    public LintResult lintFile(Path file) {
        Task task;
        try {
            task = parser.parse(file);
        } catch (TaskParseException e) {
            LOG.debug("Could not parse {}: {}", file, e.getMessage());
            return LintResult.unparseable(file, e);
        }
        LintResult result = LintResult.of(file, task.metadata().name(), validator.validate(task));
        LOG.debug("{}: {}", file, result.status());
        return result;
    }

    /** Expands directories into their YAML files; plain paths are kept as given. */
    static List<Path> expand(List<Path> targets) {
        List<Path> files = new ArrayList<>();
        for (Path target : targets) {
            if (!Files.isDirectory(target)) {
                files.add(target);
                continue;
            }
            try (Stream<Path> walk = Files.walk(target)) {
                files.addAll(walk.filter(Files::isRegularFile)
                        .filter(TaskLinter::isYaml)
                        .sorted()
                        .collect(Collectors.toList()));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list task directory: " + target, e);
            }
        }
        return files;
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
