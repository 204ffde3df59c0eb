package work.lcod.layout.cli;

import java.io.PrintWriter;
import picocli.CommandLine;
import work.lcod.layout.engine.SourceException;

/**
 * Keeps CLI failures short: one line per diagnostic for layout errors, the root cause message
 * for everything else. Set {@code -Dlcod.debug=true} for stack traces.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        PrintWriter err = commandLine.getErr();
        var scheme = commandLine.getColorScheme();
        if (ex instanceof SourceException source) {
            source.diagnostics().forEach(diagnostic -> err.println(scheme.errorText(diagnostic.display())));
        } else {
            err.println(scheme.errorText(rootMessage(ex)));
        }
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(err);
        }
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
