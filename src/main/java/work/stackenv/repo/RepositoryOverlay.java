package work.stackenv.repo;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Environment-local recipes layered over a shared repository. Local recipes are published under the
 * {@code env.<environment>} namespace, so shadowing a package here never changes what other environments see.
 */
public final class RepositoryOverlay implements PackageRepository {
    private final String namespace;
    private final PackageRepository local;
    private final PackageRepository base;

    public RepositoryOverlay(String environmentName, Path localRepoDir, PackageRepository base) {
        this.namespace = namespaceFor(environmentName);
        this.local = new TomlPackageRepository(localRepoDir, namespace);
        this.base = Objects.requireNonNull(base, "base");
    }

    public static String namespaceFor(String environmentName) {
        return "env." + environmentName;
    }

    public String namespace() {
        return namespace;
    }

    public PackageRepository base() {
        return base;
    }

    @Override
    public PackageRecipe get(String name) {
        if (local.exists(name)) {
            return local.get(name);
        }
        return base.get(name);
    }

    @Override
    public PackageRecipe get(String name, String requestedNamespace) {
        if (namespace.equals(requestedNamespace)) {
            return local.get(name);
        }
        return base.get(name, requestedNamespace);
    }

    @Override
    public boolean exists(String name) {
        return local.exists(name) || base.exists(name);
    }

    @Override
    public List<String> providersFor(String virtual) {
        TreeSet<String> providers = new TreeSet<>(base.providersFor(virtual));
        providers.addAll(local.providersFor(virtual));
        return List.copyOf(providers);
    }
}
