package work.stackenv.concretize;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stackenv.config.PackagePreferences;
import work.stackenv.repo.PackageNotFoundException;
import work.stackenv.repo.PackageRecipe;
import work.stackenv.repo.PackageRepository;
import work.stackenv.shared.WorkerPools;
import work.stackenv.spec.Architecture;
import work.stackenv.spec.Spec;

/**
 * Turns abstract root specs into concrete DAGs.
 *
 * <p>Roots whose potential dependency closures share no package name are independent: they are split into
 * groups and each group is resolved on its own worker. Nodes of identical content coming from different groups are
 * merged by hash, so the result holds every distinct node once.
 */
public final class Concretizer {
    private static final Logger log = LoggerFactory.getLogger(Concretizer.class);

    private final PackageRepository repository;
    private final PackagePreferences preferences;
    private final Architecture hostArchitecture;

    public Concretizer(PackageRepository repository, PackagePreferences preferences) {
        this(repository, preferences, Architecture.host());
    }

    public Concretizer(PackageRepository repository, PackagePreferences preferences, Architecture hostArchitecture) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.hostArchitecture = Objects.requireNonNull(hostArchitecture, "hostArchitecture");
    }

    /**
     * Concretizes a single spec with no reuse.
     */
    public Spec concretize(Spec root) {
        return concretize(ConcretizationRequest.of(List.of(root))).roots().get(0);
    }

    public ConcretizationResult concretize(ConcretizationRequest request) {
        List<Spec> roots = request.roots();
        for (Spec root : roots) {
            if (root.name() == null) {
                throw new ConcretizationException("Cannot concretize anonymous spec '" + root + "'");
            }
        }
        if (roots.isEmpty()) {
            return new ConcretizationResult(List.of(), Map.of());
        }

        List<List<Integer>> groups = partition(roots);
        Spec[] concreteRoots = new Spec[roots.size()];
        ConcurrentMap<String, Spec> arena = new ConcurrentHashMap<>();
        int jobs = Math.min(preferences.concretizeJobs(), groups.size());
        log.debug("Concretizing {} roots in {} independent groups with {} workers", roots.size(), groups.size(), jobs);

        if (jobs <= 1) {
            groups.forEach(group -> resolveGroup(group, request, concreteRoots, arena));
        } else {
            ExecutorService executor = WorkerPools.bounded("concretize", jobs);
            try {
                CompletableFuture<?>[] futures = groups.stream()
                    .map(group -> CompletableFuture.runAsync(
                        () -> resolveGroup(group, request, concreteRoots, arena),
                        executor
                    ))
                    .toArray(CompletableFuture[]::new);
                CompletableFuture.allOf(futures).join();
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw ex;
            } finally {
                executor.shutdownNow();
            }
        }

        Map<String, Spec> specsByHash = new LinkedHashMap<>();
        for (Spec root : concreteRoots) {
            for (Spec node : root.traverse()) {
                specsByHash.putIfAbsent(node.dagHash(), arena.getOrDefault(node.dagHash(), node));
            }
        }
        return new ConcretizationResult(Arrays.asList(concreteRoots), specsByHash);
    }

    private void resolveGroup(
        List<Integer> group,
        ConcretizationRequest request,
        Spec[] concreteRoots,
        ConcurrentMap<String, Spec> arena
    ) {
        List<Spec> groupRoots = group.stream().map(request.roots()::get).toList();
        List<Spec> resolved = new ComponentResolver(groupRoots, request, repository, preferences, hostArchitecture)
            .resolve();
        for (int i = 0; i < group.size(); i++) {
            Spec root = resolved.get(i);
            for (Spec node : root.traverse()) {
                arena.putIfAbsent(node.dagHash(), node);
            }
            concreteRoots[group.get(i)] = root;
        }
    }

    /**
     * Groups root indices so that roots which could share a package land in the same group. Groups are ordered by
     * their first root.
     */
    List<List<Integer>> partition(List<Spec> roots) {
        int[] parent = new int[roots.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        Map<String, Integer> owner = new HashMap<>();
        for (int i = 0; i < roots.size(); i++) {
            for (String name : potentialNames(roots.get(i))) {
                Integer previous = owner.putIfAbsent(name, i);
                if (previous != null) {
                    union(parent, previous, i);
                }
            }
        }
        Map<Integer, List<Integer>> groups = new TreeMap<>();
        for (int i = 0; i < roots.size(); i++) {
            groups.computeIfAbsent(find(parent, i), key -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(groups.values());
    }

    /**
     * Every package name the root could pull in, whatever versions or variants end up chosen.
     */
    private Set<String> potentialNames(Spec root) {
        Set<String> names = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root.name());
        queue.addAll(root.dependencies().keySet());
        while (!queue.isEmpty()) {
            String name = queue.poll();
            if (!names.add(name)) {
                continue;
            }
            if (repository.exists(name)) {
                PackageRecipe recipe = repository.get(name);
                for (PackageRecipe.DependencyDeclaration declaration : recipe.dependencies()) {
                    queue.add(declaration.name());
                }
            } else {
                List<String> providers = repository.providersFor(name);
                if (providers.isEmpty()) {
                    throw new PackageNotFoundException(name, "Unknown package or virtual '" + name + "'");
                }
                queue.addAll(providers);
            }
        }
        return names;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }
}
