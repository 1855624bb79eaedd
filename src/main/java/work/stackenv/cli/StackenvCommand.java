package work.stackenv.cli;

import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.stackenv.api.LogLevel;
import work.stackenv.api.StackenvConfiguration;

@CommandLine.Command(
    name = "stackenv",
    description = "Manage reproducible software build environments.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { EnvCommand.class }
)
final class StackenvCommand implements Runnable {
    static final String ENV_VARIABLE = "STACKENV_ENV";

    private final Map<String, String> environment;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--root",
        description = "Stackenv root directory (default: $STACKENV_ROOT or ~/.stackenv).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path root;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off; default: warn).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private LogLevel appliedLevel = LogLevel.DEFAULT;

    StackenvCommand(Map<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Layout derived from {@code --root}, then {@code STACKENV_ROOT}, then {@code ~/.stackenv}. Also applies the
     * requested log level.
     */
    StackenvConfiguration configuration() {
        LogLevel level = LogLevel.from(logLevelRaw);
        applyLogLevel(level);
        appliedLevel = level;
        Path resolvedRoot = root != null ? root : StackenvConfiguration.defaultRoot(environment);
        return StackenvConfiguration.builder(resolvedRoot).logLevel(level).build();
    }

    /**
     * Level applied by the last {@link #configuration()} call.
     */
    LogLevel logLevel() {
        return appliedLevel;
    }

    String variable(String name) {
        return environment.get(name);
    }

    private static void applyLogLevel(LogLevel level) {
        if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger rootLogger) {
            rootLogger.setLevel(Level.toLevel(level.name(), Level.WARN));
        }
    }
}
