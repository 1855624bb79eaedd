package work.stackenv.env;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stackenv.concretize.ConcretizationRequest;
import work.stackenv.concretize.ConcretizationResult;
import work.stackenv.concretize.Concretizer;
import work.stackenv.config.ConfigScope;
import work.stackenv.config.ConfigScopeStack;
import work.stackenv.config.PackagePreferences;
import work.stackenv.config.PathConfigScope;
import work.stackenv.install.BuildCollaborator;
import work.stackenv.install.InstallClaimTable;
import work.stackenv.install.InstallReport;
import work.stackenv.install.Installer;
import work.stackenv.install.StageCollaborator;
import work.stackenv.repo.PackageNotFoundException;
import work.stackenv.repo.PackageRepository;
import work.stackenv.repo.RepositoryOverlay;
import work.stackenv.spec.CompilerSpec;
import work.stackenv.spec.Spec;
import work.stackenv.spec.Version;
import work.stackenv.spec.VersionConstraint;

/**
 * A named set of abstract root specs together with the concrete DAG they last resolved to.
 *
 * <p>{@code userSpecs} is what the user asked for. {@code concretizedUserSpecs} and {@code concretizedOrder} are the
 * roots and root hashes of the last concretization, aligned by position. {@code specsByHash} holds the closure of
 * those roots; after {@link #remove} it may still hold nodes nothing refers to until the next {@link #concretize}.
 *
 * <p>Instances are not thread-safe; callers hold exclusive access while mutating one.
 */
public final class Environment {
    public static final String MANIFEST_NAME = "stackenv.yaml";
    public static final String LOCKFILE_NAME = "stackenv.lock";
    public static final String LOADS_NAME = "loads";
    public static final String REPO_DIRECTORY = "repo";
    static final String INLINE_SCOPE_PREFIX = "env:";
    static final String INCLUDE_SCOPE_PREFIX = "include:";

    private static final Logger log = LoggerFactory.getLogger(Environment.class);

    private final String name;
    private final Path path;
    private final ConfigScopeStack config;
    private final PackagePreferences preferences;
    private final RepositoryOverlay repository;
    private final InstallClaimTable claims;
    private Manifest manifest;

    private final List<Spec> userSpecs = new ArrayList<>();
    private final List<Spec> concretizedUserSpecs = new ArrayList<>();
    private final List<String> concretizedOrder = new ArrayList<>();
    private final Map<String, Spec> specsByHash = new LinkedHashMap<>();

    Environment(
        String name,
        Path path,
        Manifest manifest,
        PackageRepository baseRepository,
        ConfigScopeStack baseConfig,
        InstallClaimTable claims
    ) {
        this.name = name;
        this.path = path.toAbsolutePath().normalize();
        this.manifest = manifest;
        this.claims = claims;
        this.config = baseConfig.copy();
        for (String include : manifest.includes()) {
            config.push(new PathConfigScope(INCLUDE_SCOPE_PREFIX + include, this.path.resolve(include), include));
        }
        config.push(manifest.scope(INLINE_SCOPE_PREFIX + name));
        this.preferences = new PackagePreferences(config);
        this.repository = new RepositoryOverlay(name, this.path.resolve(REPO_DIRECTORY), baseRepository);
        for (String raw : manifest.specs()) {
            userSpecs.add(Spec.parse(raw));
        }
        Path lockfile = this.path.resolve(LOCKFILE_NAME);
        if (Files.isRegularFile(lockfile)) {
            try {
                loadLockfile(Lockfile.fromJson(Files.readString(lockfile), lockfile.toString()));
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to read lockfile " + lockfile, ex);
            }
        }
    }

    public String name() {
        return name;
    }

    public Path path() {
        return path;
    }

    public ConfigScopeStack config() {
        return config;
    }

    public PackagePreferences preferences() {
        return preferences;
    }

    public RepositoryOverlay repo() {
        return repository;
    }

    public List<Spec> userSpecs() {
        return Collections.unmodifiableList(userSpecs);
    }

    public List<Spec> concretizedUserSpecs() {
        return Collections.unmodifiableList(concretizedUserSpecs);
    }

    public List<String> concretizedOrder() {
        return Collections.unmodifiableList(concretizedOrder);
    }

    public Map<String, Spec> specsByHash() {
        return Collections.unmodifiableMap(specsByHash);
    }

    /**
     * Concrete roots of the last concretization, in order.
     */
    public List<Spec> environmentSpecs() {
        List<Spec> roots = new ArrayList<>();
        for (String hash : concretizedOrder) {
            Spec root = specsByHash.get(hash);
            if (root == null) {
                throw new IllegalStateException("Root " + hash + " of environment " + name + " is missing from its closure");
            }
            roots.add(root);
        }
        return roots;
    }

    /**
     * Every node reachable from the concretized roots, dependencies first.
     */
    public List<Spec> closure() {
        Map<String, Spec> ordered = new LinkedHashMap<>();
        for (Spec root : environmentSpecs()) {
            for (Spec node : root.traverse()) {
                ordered.putIfAbsent(node.dagHash(), node);
            }
        }
        return new ArrayList<>(ordered.values());
    }

    public boolean isConcretized() {
        return concretizedUserSpecs.equals(userSpecs);
    }

    public Spec add(String spec) {
        return add(Spec.parse(spec));
    }

    /**
     * Appends an abstract root. A root with the same package name must not already be present.
     */
    public Spec add(Spec spec) {
        if (spec.name() == null) {
            throw new EnvironmentException("Cannot add anonymous spec '" + spec + "' to environment " + name);
        }
        for (Spec existing : userSpecs) {
            if (existing.name().equals(spec.name())) {
                throw new EnvironmentException(
                    "Environment " + name + " already contains '" + existing + "'; remove it before adding '" + spec + "'"
                );
            }
        }
        if (!repository.exists(spec.name()) && !repository.isVirtual(spec.name())) {
            throw new PackageNotFoundException(spec.name(), "No package named '" + spec.name() + "' is available");
        }
        userSpecs.add(spec);
        log.debug("Added {} to environment {}", spec, name);
        return spec;
    }

    public Spec remove(String spec) {
        return remove(Spec.parse(spec));
    }

    /**
     * Removes the root equal to {@code query}, or else the root with the same package name. The removed root's
     * nodes stay in {@link #specsByHash()} until the next concretization.
     */
    public Spec remove(Spec query) {
        int index = userSpecs.indexOf(query);
        if (index < 0) {
            for (int i = 0; i < userSpecs.size(); i++) {
                if (userSpecs.get(i).name().equals(query.name())) {
                    index = i;
                    break;
                }
            }
        }
        if (index < 0) {
            throw new EnvironmentException("Environment " + name + " has no spec matching '" + query + "'");
        }
        Spec removed = userSpecs.remove(index);
        for (int i = 0; i < concretizedUserSpecs.size(); i++) {
            if (concretizedUserSpecs.get(i).name().equals(removed.name())) {
                concretizedUserSpecs.remove(i);
                concretizedOrder.remove(i);
                break;
            }
        }
        log.debug("Removed {} from environment {}", removed, name);
        return removed;
    }

    /**
     * Resolves every root, reusing the previous nodes wherever they still satisfy the constraints, and replaces the
     * closure with the one reachable from the new roots.
     *
     * @return concrete roots, aligned with {@link #userSpecs()}
     */
    public List<Spec> concretize() {
        return apply(ConcretizationRequest.of(userSpecs).reusing(priorNodes()));
    }

    /**
     * Re-resolves the named package to the best candidate under the current preferences. Every other node is reused
     * when possible, so only the package and its dependents change hash.
     *
     * <p>Root version constraints on the package that exclude the upgraded version are rewritten to that version, so
     * later concretizations keep the upgrade.
     */
    public List<Spec> upgradeDependency(String packageName) {
        if (closure().stream().noneMatch(node -> node.name().equals(packageName))) {
            throw new EnvironmentException("Environment " + name + " has no concretized package named '" + packageName + "'");
        }
        List<Spec> roots = apply(
            ConcretizationRequest.of(userSpecs)
                .reusing(priorNodes())
                .relaxing(Set.of(packageName))
        );
        Version upgraded = closure().stream()
            .filter(node -> node.name().equals(packageName))
            .findFirst()
            .map(Spec::version)
            .orElseThrow(() -> new IllegalStateException(packageName + " left the closure of environment " + name));
        for (int i = 0; i < userSpecs.size(); i++) {
            Spec rewritten = keepUpgrade(userSpecs.get(i), packageName, upgraded);
            if (rewritten != userSpecs.get(i)) {
                log.info("Environment {}: {} now reads {}", name, userSpecs.get(i), rewritten);
                userSpecs.set(i, rewritten);
                concretizedUserSpecs.set(i, rewritten);
            }
        }
        return roots;
    }

    private static Spec keepUpgrade(Spec root, String packageName, Version upgraded) {
        Spec result = root;
        if (root.name().equals(packageName) && !root.versions().contains(upgraded)) {
            result = result.withVersions(VersionConstraint.exactly(upgraded));
        }
        Spec dependency = root.dependencies().get(packageName);
        if (dependency != null && !dependency.versions().contains(upgraded)) {
            result = result.withDependencyVersions(packageName, VersionConstraint.exactly(upgraded));
        }
        return result;
    }

    /**
     * Resolves every root from scratch under the current configuration, optionally forcing one compiler on every
     * node that does not ask for another one.
     */
    public List<Spec> resetOsAndCompiler(CompilerSpec compiler) {
        return apply(ConcretizationRequest.of(userSpecs).forcingCompiler(compiler));
    }

    private List<Spec> apply(ConcretizationRequest request) {
        ConcretizationResult result = new Concretizer(repository, preferences).concretize(request);
        concretizedUserSpecs.clear();
        concretizedUserSpecs.addAll(request.roots());
        concretizedOrder.clear();
        result.roots().forEach(root -> concretizedOrder.add(root.dagHash()));
        int before = specsByHash.size();
        specsByHash.clear();
        specsByHash.putAll(result.specsByHash());
        log.info("Concretized {} roots of environment {} into {} nodes (was {})",
            concretizedOrder.size(), name, specsByHash.size(), before);
        return result.roots();
    }

    private Map<String, Spec> priorNodes() {
        Map<String, Spec> prior = new LinkedHashMap<>();
        for (Spec node : closure()) {
            prior.putIfAbsent(node.name(), node);
        }
        return prior;
    }

    /**
     * Adds a configuration scope above every include but below the manifest's own settings, which always win.
     * Preferences are recomputed on next use.
     */
    public void pushConfigScope(ConfigScope scope) {
        config.pushBelow(INLINE_SCOPE_PREFIX + name, scope);
        preferences.invalidate();
    }

    /**
     * One line per root: {@code [+]} installed, {@code [-]} not installed, or {@code (not concretized)}.
     */
    public void status(PrintWriter out, BuildCollaborator builds) {
        out.println("==> Environment " + name + " (" + path + ")");
        if (userSpecs.isEmpty()) {
            out.println("    (no specs)");
            return;
        }
        for (Spec user : userSpecs) {
            int index = concretizedUserSpecs.indexOf(user);
            if (index < 0) {
                out.println("    " + user + " (not concretized)");
                continue;
            }
            Spec concrete = specsByHash.get(concretizedOrder.get(index));
            String mark = builds.isInstalled(concrete) ? "[+]" : "[-]";
            out.println(" " + mark + " " + user);
            for (Spec node : concrete.traverse()) {
                String nodeMark = builds.isInstalled(node) ? "[+]" : "[-]";
                out.println("        " + nodeMark + " " + node.shortHash() + "  " + node.format());
            }
        }
    }

    /**
     * Installs the closure, concretizing first when the roots changed since the last concretization.
     */
    public InstallReport install(BuildCollaborator builds) {
        if (!isConcretized()) {
            concretize();
        }
        InstallReport report = new Installer(builds, claims, preferences.buildJobs()).install(environmentSpecs());
        if (!report.success()) {
            log.warn("Environment {}: {} builds failed, {} skipped", name, report.failures().size(), report.skipped().size());
        }
        return report;
    }

    /**
     * Uninstalls every installed node of the closure, dependents before their dependencies.
     *
     * @return the nodes removed
     */
    public List<Spec> uninstall(BuildCollaborator builds) {
        List<Spec> nodes = closure();
        Collections.reverse(nodes);
        List<Spec> removed = new ArrayList<>();
        for (Spec node : nodes) {
            if (!builds.isInstalled(node)) {
                continue;
            }
            try (InstallClaimTable.Claim ignored = claims.claim(node.dagHash())) {
                builds.uninstall(node);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to uninstall " + node.format() + "/" + node.shortHash(), ex);
            }
            removed.add(node);
        }
        return removed;
    }

    public List<Path> stage(StageCollaborator stager) {
        List<Path> staged = new ArrayList<>();
        for (Spec node : closure()) {
            try {
                staged.add(stager.stage(node));
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to stage " + node.format() + "/" + node.shortHash(), ex);
            }
        }
        return staged;
    }

    /**
     * Writes {@code <env>/loads} with one {@code module load} line per installed node, dependencies first.
     */
    public Path writeLoads(BuildCollaborator builds) {
        List<String> lines = new ArrayList<>();
        for (Spec node : closure()) {
            if (builds.isInstalled(node)) {
                lines.add("module load " + moduleName(node));
            }
        }
        Path loads = path.resolve(LOADS_NAME);
        try {
            Files.write(loads, lines);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write " + loads, ex);
        }
        return loads;
    }

    static String moduleName(Spec node) {
        return node.name() + "-" + node.version() + "-" + node.compiler().name() + "-" + node.compiler().version()
            + "-" + node.shortHash();
    }

    public Lockfile toLockfile() {
        List<Lockfile.Root> roots = new ArrayList<>();
        for (int i = 0; i < concretizedOrder.size(); i++) {
            roots.add(new Lockfile.Root(concretizedOrder.get(i), concretizedUserSpecs.get(i)));
        }
        return new Lockfile(roots, specsByHash);
    }

    /**
     * Replaces the concretization state with the lockfile's. Nodes are ordered dependencies first.
     */
    public void loadLockfile(Lockfile lockfile) {
        concretizedUserSpecs.clear();
        concretizedOrder.clear();
        specsByHash.clear();
        for (Lockfile.Root root : lockfile.roots()) {
            concretizedUserSpecs.add(root.spec());
            concretizedOrder.add(root.hash());
            for (Spec node : lockfile.specsByHash().get(root.hash()).traverse()) {
                specsByHash.putIfAbsent(node.dagHash(), node);
            }
        }
        lockfile.specsByHash().forEach(specsByHash::putIfAbsent);
    }

    /**
     * Writes the manifest and, once the environment has been concretized, the lockfile.
     */
    public void write() {
        List<String> specs = new ArrayList<>();
        userSpecs.forEach(spec -> specs.add(spec.toString()));
        manifest = manifest.withSpecs(specs);
        Path manifestPath = path.resolve(MANIFEST_NAME);
        Path lockPath = path.resolve(LOCKFILE_NAME);
        try {
            Files.createDirectories(path);
            Files.writeString(manifestPath, manifest.toYaml());
            if (!concretizedOrder.isEmpty() || Files.exists(lockPath)) {
                Files.writeString(lockPath, toLockfile().toJson());
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write environment " + name + " to " + path, ex);
        }
        log.debug("Wrote environment {} to {}", name, path);
    }

    @Override
    public String toString() {
        return "Environment[" + name + "]";
    }
}
