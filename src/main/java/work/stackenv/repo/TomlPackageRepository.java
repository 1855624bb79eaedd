package work.stackenv.repo;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.stackenv.config.ConfigFormatException;
import work.stackenv.spec.Spec;
import work.stackenv.spec.SpecParseException;
import work.stackenv.spec.Version;

/**
 * Repository laid out on disk as {@code repo.toml} plus {@code packages/<name>/package.toml}.
 *
 * <pre>
 * name = "mpileaks"
 * versions = ["2.3", "2.2"]
 * preferred = "2.2"
 * provides = ["mpi"]
 * [variants.debug]
 * default = false
 * [[dependencies]]
 * spec = "callpath"
 * when = "+debug"
 * </pre>
 */
public final class TomlPackageRepository implements PackageRepository {
    public static final String REPO_MANIFEST = "repo.toml";
    public static final String PACKAGE_MANIFEST = "package.toml";
    private static final Logger log = LoggerFactory.getLogger(TomlPackageRepository.class);

    private final Path root;
    private final String namespace;
    private volatile Map<String, PackageRecipe> recipes;

    public TomlPackageRepository(Path root) {
        this(root, null);
    }

    /**
     * @param namespaceOverride namespace to publish recipes under instead of the one in {@code repo.toml}
     */
    public TomlPackageRepository(Path root, String namespaceOverride) {
        this.root = root.toAbsolutePath().normalize();
        this.namespace = namespaceOverride != null ? namespaceOverride : readNamespace(this.root);
    }

    public Path root() {
        return root;
    }

    public String namespace() {
        return namespace;
    }

    @Override
    public PackageRecipe get(String name) {
        PackageRecipe recipe = recipes().get(name);
        if (recipe == null) {
            throw new PackageNotFoundException(name, "Package '" + name + "' not found in repository " + namespace);
        }
        return recipe;
    }

    @Override
    public PackageRecipe get(String name, String requestedNamespace) {
        if (!namespace.equals(requestedNamespace)) {
            throw new PackageNotFoundException(name, "Repository " + namespace + " does not serve namespace " + requestedNamespace);
        }
        return get(name);
    }

    @Override
    public boolean exists(String name) {
        return recipes().containsKey(name);
    }

    @Override
    public List<String> providersFor(String virtual) {
        List<String> providers = new ArrayList<>();
        for (PackageRecipe recipe : recipes().values()) {
            if (recipe.provides(virtual)) {
                providers.add(recipe.name());
            }
        }
        return providers;
    }

    public Set<String> packageNames() {
        return recipes().keySet();
    }

    private Map<String, PackageRecipe> recipes() {
        Map<String, PackageRecipe> current = recipes;
        if (current == null) {
            synchronized (this) {
                current = recipes;
                if (current == null) {
                    current = scan();
                    recipes = current;
                }
            }
        }
        return current;
    }

    private Map<String, PackageRecipe> scan() {
        Map<String, PackageRecipe> loaded = new TreeMap<>();
        Path packagesDir = root.resolve("packages");
        if (!Files.isDirectory(packagesDir)) {
            log.debug("Repository {} has no packages directory at {}", namespace, packagesDir);
            return Map.of();
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(packagesDir)) {
            for (Path pkgDir : stream) {
                Path manifest = pkgDir.resolve(PACKAGE_MANIFEST);
                if (Files.isRegularFile(manifest)) {
                    PackageRecipe recipe = loadRecipe(manifest, pkgDir.getFileName().toString());
                    loaded.put(recipe.name(), recipe);
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to list packages in " + packagesDir, ex);
        }
        log.debug("Loaded {} recipes from repository {}", loaded.size(), namespace);
        return Collections.unmodifiableMap(loaded);
    }

    private PackageRecipe loadRecipe(Path manifest, String directoryName) {
        TomlParseResult toml = parseToml(manifest);
        String display = manifest.toString();
        try {
            String name = toml.getString("name");
            if (name == null || name.isBlank()) {
                name = directoryName;
            }
            List<Version> versions = new ArrayList<>();
            for (String raw : readStringArray(toml.getArray("versions"))) {
                versions.add(Version.parse(raw));
            }
            String preferredRaw = toml.getString("preferred");
            Version preferred = preferredRaw == null ? null : Version.parse(preferredRaw);

            Map<String, VariantDefinition> variants = new LinkedHashMap<>();
            TomlTable variantTable = toml.getTable("variants");
            if (variantTable != null) {
                for (String key : variantTable.keySet()) {
                    variants.put(key, readVariant(key, variantTable.getTable(key)));
                }
            }

            List<PackageRecipe.DependencyDeclaration> deps = new ArrayList<>();
            TomlArray depArray = toml.getArray("dependencies");
            if (depArray != null) {
                for (int i = 0; i < depArray.size(); i++) {
                    TomlTable dep = depArray.getTable(i);
                    String when = dep.getString("when");
                    deps.add(new PackageRecipe.DependencyDeclaration(
                        Spec.parse(dep.getString("spec")),
                        when == null || when.isBlank() ? null : Spec.parse(when)
                    ));
                }
            }

            return new PackageRecipe(
                name,
                namespace,
                toml.getString("description"),
                versions,
                preferred,
                variants,
                deps,
                readStringArray(toml.getArray("provides"))
            );
        } catch (IllegalArgumentException | SpecParseException | TomlInvalidTypeException ex) {
            throw new ConfigFormatException(display, -1, "invalid package recipe: " + ex.getMessage(), ex);
        }
    }

    private static VariantDefinition readVariant(String key, TomlTable table) {
        if (table == null) {
            throw new IllegalArgumentException("variant '" + key + "' must be a table");
        }
        Object rawDefault = table.get("default");
        if (rawDefault == null) {
            throw new IllegalArgumentException("variant '" + key + "' needs a default");
        }
        Set<String> allowed = new LinkedHashSet<>();
        TomlArray values = table.getArray("values");
        if (values != null) {
            for (int i = 0; i < values.size(); i++) {
                allowed.add(String.valueOf(values.get(i)));
            }
        }
        return new VariantDefinition(key, String.valueOf(rawDefault), allowed, table.getString("description"));
    }

    private static TomlParseResult parseToml(Path path) {
        try {
            TomlParseResult result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                TomlParseError first = result.errors().get(0);
                throw new ConfigFormatException(path.toString(), first.position().line(), first.getMessage());
            }
            return result;
        } catch (IOException ex) {
            throw new ConfigFormatException(path.toString(), -1, "unable to read: " + ex.getMessage(), ex);
        }
    }

    private static String readNamespace(Path root) {
        Path manifest = root.resolve(REPO_MANIFEST);
        if (Files.isRegularFile(manifest)) {
            TomlParseResult toml = parseToml(manifest);
            String declared = toml.getString("repository.namespace");
            if (declared != null && !declared.isBlank()) {
                return declared;
            }
        }
        Path fileName = root.getFileName();
        return fileName == null ? "builtin" : fileName.toString();
    }

    private static List<String> readStringArray(TomlArray array) {
        if (array == null || array.isEmpty()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String value = array.getString(i);
            if (value != null && !value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }
}
