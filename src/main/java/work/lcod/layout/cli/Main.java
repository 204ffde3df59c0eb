package work.lcod.layout.cli;

import java.util.Optional;
import picocli.CommandLine;
import work.lcod.layout.api.LogLevel;

/**
 * Entry point for the {@code java -jar} distribution.
 *
 * <p>The log level is applied from the raw arguments before the command is created: slf4j-simple
 * fixes its default level when the first logger is created, and the runner and layout classes
 * create theirs as soon as they are loaded.
 */
public final class Main {
    static final String LOG_LEVEL_OPTION = "--log-level";

    private Main() {}

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /** Runs the command without exiting the JVM and returns its exit code. */
    public static int execute(String... args) {
        applyLogLevel(args);
        return commandLine().execute(args);
    }

    static CommandLine commandLine() {
        return new CommandLine(new LayoutCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    /**
     * Applies a {@code --log-level} given in {@code args}. Unknown levels are left to the command,
     * which rejects them.
     */
    static Optional<LogLevel> applyLogLevel(String... args) {
        for (int i = 0; i < args.length; i++) {
            String raw = null;
            if (args[i].startsWith(LOG_LEVEL_OPTION + "=")) {
                raw = args[i].substring(LOG_LEVEL_OPTION.length() + 1);
            } else if (args[i].equals(LOG_LEVEL_OPTION) && i + 1 < args.length) {
                raw = args[i + 1];
            }
            if (raw != null) {
                var level = LogLevel.find(raw);
                level.ifPresent(LogLevel::apply);
                return level;
            }
        }
        return Optional.empty();
    }
}
