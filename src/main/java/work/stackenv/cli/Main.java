package work.stackenv.cli;

import java.util.Map;
import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = commandLine(System.getenv()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(Map<String, String> environment) {
        return new CommandLine(new StackenvCommand(environment))
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
