package io.tasklint.standalone;

import io.tasklint.core.spec.TaskParser;
import io.tasklint.core.validation.TaskValidator;
import io.tasklint.standalone.config.ConfigLoadException;
import io.tasklint.standalone.config.ConfigLoader;
import io.tasklint.standalone.config.LintConfig;
import io.tasklint.standalone.lint.LintReport;
import io.tasklint.standalone.lint.TaskLinter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the command-line task linter.
 *
 * <pre>{@code
 * task-lint [--config lint.yaml] <file-or-directory>...
 * }</pre>
 *
 * <p>
 * Exit status: 0 when every task is valid, 1 when any task is invalid or
 * unparseable, 2 on a usage or configuration error.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    static final String USAGE = "usage: task-lint [--config <file>] <task-file-or-directory>...";

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args, System::getenv, System.out, System.err));
    }

    /**
     * Runs the linter and returns the exit status instead of exiting.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup
     * @param out       receives the report
     * @param err       receives usage and configuration errors
     * @return the exit status
     */
    static int run(String[] args, Function<String, String> envLookup, PrintStream out, PrintStream err) {
        LintConfig config;
        List<Path> targets;
        try {
            Optional<Path> configPath = ConfigLoader.resolveConfigPath(args);
            config = configPath.isPresent()
                    ? ConfigLoader.load(configPath.get(), envLookup)
                    : ConfigLoader.fromEnvironment(envLookup);
            targets = taskArguments(args);
        } catch (IllegalArgumentException | ConfigLoadException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return LintReport.EXIT_USAGE;
        }
        if (targets.isEmpty()) {
            err.println(USAGE);
            return LintReport.EXIT_USAGE;
        }

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.debug("Loaded configuration: {}", config);

        TaskLinter linter = new TaskLinter(new TaskParser(), new TaskValidator(), config.failFast());
        LintReport report;
        try {
            report = linter.lint(targets);
        } catch (UncheckedIOException e) {
            LOG.error("Lint run failed: {}", e.getMessage(), e);
            return LintReport.EXIT_USAGE;
        }
        out.print(config.jsonOutput() ? report.renderJson() : report.renderText());
        out.flush();
        return report.exitCode();
    }

    /** Arguments other than {@code --config <file>}. */
    static List<Path> taskArguments(String[] args) {
        List<Path> targets = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                i++;
                continue;
            }
            if (args[i].startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
            targets.add(Path.of(args[i]));
        }
        return targets;
    }
}
