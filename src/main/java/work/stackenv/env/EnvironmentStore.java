package work.stackenv.env;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stackenv.api.StackenvConfiguration;
import work.stackenv.config.ConfigScopeStack;
import work.stackenv.config.PathConfigScope;
import work.stackenv.install.InstallClaimTable;
import work.stackenv.repo.PackageRepository;
import work.stackenv.repo.TomlPackageRepository;

/**
 * Named environments kept as directories under the configured environments directory.
 */
public final class EnvironmentStore {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentStore.class);
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    private final Path environmentsDirectory;
    private final PackageRepository repository;
    private final ConfigScopeStack baseConfig;
    private final InstallClaimTable claims;

    /**
     * Store using the built-in repository and the defaults, site and user configuration scopes.
     */
    public EnvironmentStore(StackenvConfiguration configuration) {
        this(
            configuration,
            new TomlPackageRepository(configuration.repositoryDirectory()),
            baseConfig(configuration)
        );
    }

    public EnvironmentStore(StackenvConfiguration configuration, PackageRepository repository, ConfigScopeStack baseConfig) {
        this.environmentsDirectory = configuration.environmentsDirectory();
        this.repository = repository;
        this.baseConfig = baseConfig;
        this.claims = new InstallClaimTable(configuration.lockDirectory());
    }

    static ConfigScopeStack baseConfig(StackenvConfiguration configuration) {
        var stack = ConfigScopeStack.withDefaults();
        if (Files.exists(configuration.siteConfigDirectory())) {
            stack.push(new PathConfigScope("site", configuration.siteConfigDirectory()));
        }
        Path user = configuration.userConfigDirectory();
        if (user != null && Files.exists(user)) {
            stack.push(new PathConfigScope("user", user));
        }
        return stack;
    }

    public Path pathOf(String name) {
        return environmentsDirectory.resolve(name);
    }

    public boolean exists(String name) {
        return VALID_NAME.matcher(name).matches()
            && Files.isRegularFile(pathOf(name).resolve(Environment.MANIFEST_NAME));
    }

    /**
     * Creates an environment, optionally from manifest text. The manifest is validated before anything is
     * written; errors name it {@code ./stackenv.yaml}.
     */
    public Environment create(String name, String manifestText) {
        return create(name, manifestText, "./" + Environment.MANIFEST_NAME);
    }

    /**
     * Same as {@link #create(String, String)}, with schema errors reported against {@code displayPath}, the manifest
     * path as the user gave it.
     */
    public Environment create(String name, String manifestText, String displayPath) {
        if (!VALID_NAME.matcher(name).matches()) {
            throw new EnvironmentException("Invalid environment name '" + name + "'");
        }
        if (exists(name)) {
            throw new EnvironmentException("Environment '" + name + "' already exists");
        }
        Manifest manifest = manifestText == null
            ? Manifest.empty()
            : Manifest.parse(manifestText, displayPath);
        Path dir = pathOf(name);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(Environment.MANIFEST_NAME), manifestText == null ? manifest.toYaml() : manifestText);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create environment directory " + dir, ex);
        }
        log.info("Created environment {} in {}", name, dir);
        return read(name);
    }

    public Environment read(String name) {
        if (!exists(name)) {
            throw new UnknownEnvironmentException(name);
        }
        Path dir = pathOf(name);
        Manifest manifest = Manifest.read(dir.resolve(Environment.MANIFEST_NAME));
        return new Environment(name, dir, manifest, repository, baseConfig, claims);
    }

    /**
     * Names of all environments, sorted.
     */
    public List<String> list() {
        if (!Files.isDirectory(environmentsDirectory)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(environmentsDirectory)) {
            return new ArrayList<>(children
                .map(child -> child.getFileName().toString())
                .filter(this::exists)
                .sorted()
                .toList());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to list environments in " + environmentsDirectory, ex);
        }
    }

    public void destroy(String name) {
        if (!exists(name)) {
            throw new UnknownEnvironmentException(name);
        }
        Path dir = pathOf(name);
        try {
            deleteRecursively(dir);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to remove environment directory " + dir, ex);
        }
        log.info("Destroyed environment {}", name);
    }

    private static void deleteRecursively(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
