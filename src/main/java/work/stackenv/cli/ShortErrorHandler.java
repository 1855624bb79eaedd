package work.stackenv.cli;

import java.io.PrintWriter;
import picocli.CommandLine;
import work.stackenv.api.LogLevel;

/**
 * Prints {@code ==> Error: <message>} for a failed command; wrapped IO failures also name their cause. Stack traces
 * only with {@code -Dstackenv.debug=true} or {@code --log-level debug}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "stackenv.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        PrintWriter err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText("==> Error: " + describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY) || verbose(commandLine)) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    private static boolean verbose(CommandLine commandLine) {
        Object root = commandLine.getCommandSpec().root().userObject();
        return root instanceof StackenvCommand command && command.logLevel().admits(LogLevel.DEBUG);
    }

    static String describe(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        Throwable cause = ex.getCause();
        if (ex instanceof IllegalStateException && cause != null && cause.getMessage() != null
            && !message.contains(cause.getMessage())) {
            message = message + ": " + cause.getMessage();
        }
        return message;
    }
}
