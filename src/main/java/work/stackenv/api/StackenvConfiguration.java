package work.stackenv.api;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable file-system layout and runtime settings shared by every command.
 */
public record StackenvConfiguration(
    Path root,
    Path environmentsDirectory,
    Path repositoryDirectory,
    Path installDirectory,
    Path stageDirectory,
    Path lockDirectory,
    Path siteConfigDirectory,
    Path userConfigDirectory,
    LogLevel logLevel
) {
    public static final String ROOT_VARIABLE = "STACKENV_ROOT";

    public StackenvConfiguration {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(environmentsDirectory, "environmentsDirectory");
        Objects.requireNonNull(repositoryDirectory, "repositoryDirectory");
        Objects.requireNonNull(installDirectory, "installDirectory");
        Objects.requireNonNull(stageDirectory, "stageDirectory");
        Objects.requireNonNull(lockDirectory, "lockDirectory");
        Objects.requireNonNull(siteConfigDirectory, "siteConfigDirectory");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    /**
     * Layout rooted at {@code root}; the user scope is {@code ~/.stackenv/config}.
     */
    public static Builder builder(Path root) {
        return new Builder(root);
    }

    /**
     * Root taken from {@code STACKENV_ROOT} when set, {@code ~/.stackenv} otherwise.
     */
    public static Path defaultRoot(Map<String, String> environment) {
        String fromEnv = environment.get(ROOT_VARIABLE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Path.of(fromEnv);
        }
        return Path.of(System.getProperty("user.home"), ".stackenv");
    }

    public static final class Builder {
        private final Path root;
        private Path environmentsDirectory;
        private Path repositoryDirectory;
        private Path installDirectory;
        private Path stageDirectory;
        private Path lockDirectory;
        private Path siteConfigDirectory;
        private Path userConfigDirectory;
        private LogLevel logLevel = LogLevel.WARN;

        private Builder(Path root) {
            this.root = root.toAbsolutePath().normalize();
            this.environmentsDirectory = this.root.resolve("environments");
            this.repositoryDirectory = this.root.resolve("repo");
            this.installDirectory = this.root.resolve("opt");
            this.stageDirectory = this.root.resolve("stage");
            this.lockDirectory = this.root.resolve("locks");
            this.siteConfigDirectory = this.root.resolve("etc");
            this.userConfigDirectory = Path.of(System.getProperty("user.home"), ".stackenv", "config");
        }

        public Builder environmentsDirectory(Path environmentsDirectory) {
            this.environmentsDirectory = environmentsDirectory;
            return this;
        }

        public Builder repositoryDirectory(Path repositoryDirectory) {
            this.repositoryDirectory = repositoryDirectory;
            return this;
        }

        public Builder installDirectory(Path installDirectory) {
            this.installDirectory = installDirectory;
            return this;
        }

        public Builder stageDirectory(Path stageDirectory) {
            this.stageDirectory = stageDirectory;
            return this;
        }

        public Builder lockDirectory(Path lockDirectory) {
            this.lockDirectory = lockDirectory;
            return this;
        }

        public Builder siteConfigDirectory(Path siteConfigDirectory) {
            this.siteConfigDirectory = siteConfigDirectory;
            return this;
        }

        /**
         * {@code null} disables the user scope.
         */
        public Builder userConfigDirectory(Path userConfigDirectory) {
            this.userConfigDirectory = userConfigDirectory;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public StackenvConfiguration build() {
            return new StackenvConfiguration(
                root,
                environmentsDirectory,
                repositoryDirectory,
                installDirectory,
                stageDirectory,
                lockDirectory,
                siteConfigDirectory,
                userConfigDirectory,
                logLevel
            );
        }
    }
}
