package work.stackenv.concretize;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stackenv.config.PackagePreferences;
import work.stackenv.repo.PackageNotFoundException;
import work.stackenv.repo.PackageRecipe;
import work.stackenv.repo.PackageRepository;
import work.stackenv.repo.VariantDefinition;
import work.stackenv.spec.Architecture;
import work.stackenv.spec.CompilerSpec;
import work.stackenv.spec.Spec;
import work.stackenv.spec.Version;
import work.stackenv.spec.VersionConstraint;

/**
 * Resolves one group of roots whose dependency closures may overlap. Every package name resolves to a single node
 * shared by all roots of the group.
 *
 * <p>Each round walks the DAG from the roots using the previous round's choices, collects every constraint with its
 * origin, then re-chooses every reachable package from the complete constraint set. Rounds repeat until the choices
 * stop changing.
 */
final class ComponentResolver {
    static final int MAX_ROUNDS = 64;
    private static final Logger log = LoggerFactory.getLogger(ComponentResolver.class);

    private final List<Spec> roots;
    private final ConcretizationRequest request;
    private final PackageRepository repository;
    private final PackagePreferences preferences;
    private final Architecture hostArchitecture;
    private final Map<String, String> virtualBindings = new HashMap<>();

    private Map<String, Choice> choices = new TreeMap<>();
    private Map<String, Set<String>> edges = new TreeMap<>();

    ComponentResolver(
        List<Spec> roots,
        ConcretizationRequest request,
        PackageRepository repository,
        PackagePreferences preferences,
        Architecture hostArchitecture
    ) {
        this.roots = roots;
        this.request = request;
        this.repository = repository;
        this.preferences = preferences;
        this.hostArchitecture = hostArchitecture;
    }

    /**
     * Concrete roots, in the order they were given.
     */
    List<Spec> resolve() {
        int round = 0;
        boolean changed = true;
        while (changed) {
            if (++round > MAX_ROUNDS) {
                throw new ConcretizationException(
                    "Concretization of " + roots + " did not settle after " + MAX_ROUNDS + " rounds"
                );
            }
            changed = runRound();
        }
        log.debug("Resolved {} in {} rounds", roots, round);

        Map<String, Spec> built = new HashMap<>();
        List<Spec> concreteRoots = new ArrayList<>();
        for (Spec root : roots) {
            Spec concrete = build(target(root.name()), built, new LinkedHashSet<>());
            checkDependencyConstraints(root, concrete);
            concreteRoots.add(concrete);
        }
        return concreteRoots;
    }

    private boolean runRound() {
        Map<String, List<Requirement>> constraints = new LinkedHashMap<>();
        Map<String, Set<String>> roundEdges = new TreeMap<>();
        Map<String, Choice> working = new HashMap<>(choices);
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();

        for (Spec root : roots) {
            String origin = root.toString();
            String rootTarget = target(root.name());
            add(constraints, rootTarget, userConstraint(root.withoutDependencies(), rootTarget), origin);
            for (Spec dep : root.dependencies().values()) {
                String depTarget = target(dep.name());
                add(constraints, depTarget, userConstraint(dep, depTarget), origin);
            }
            queue.add(rootTarget);
        }

        while (!queue.isEmpty()) {
            String name = queue.poll();
            if (!reachable.add(name)) {
                continue;
            }
            Choice choice = working.get(name);
            if (choice == null) {
                choice = choose(name, constraints.getOrDefault(name, List.of()));
                working.put(name, choice);
            }
            Set<String> children = new TreeSet<>();
            for (PackageRecipe.DependencyDeclaration declaration : choice.recipe().dependencies()) {
                if (declaration.when() != null && !choice.matches(declaration.when())) {
                    continue;
                }
                String depTarget = target(declaration.name());
                Spec constraint = depTarget.equals(declaration.name())
                    ? declaration.constraint()
                    : Spec.builder(depTarget).build();
                add(constraints, depTarget, constraint, choice.label());
                children.add(depTarget);
                queue.add(depTarget);
            }
            roundEdges.put(name, children);
        }

        Map<String, Choice> next = new TreeMap<>();
        for (String name : reachable) {
            next.put(name, choose(name, constraints.getOrDefault(name, List.of())));
        }
        boolean changed = !next.equals(choices);
        choices = next;
        edges = roundEdges;
        return changed;
    }

    private void add(Map<String, List<Requirement>> constraints, String name, Spec constraint, String origin) {
        constraints.computeIfAbsent(name, key -> new ArrayList<>()).add(new Requirement(constraint, origin));
    }

    /**
     * A constraint written by the user, adjusted for virtual targets and relaxed names.
     */
    private Spec userConstraint(Spec constraint, String target) {
        if (!target.equals(constraint.name())) {
            return Spec.builder(target).build();
        }
        if (request.relaxed().contains(target)) {
            return constraint.withVersions(VersionConstraint.ANY);
        }
        return constraint;
    }

    /**
     * Package name a requested name resolves to: itself, or the bound provider of a virtual.
     */
    private String target(String name) {
        if (repository.exists(name)) {
            return name;
        }
        return virtualBindings.computeIfAbsent(name, this::bindProvider);
    }

    private String bindProvider(String virtual) {
        List<String> providers = repository.providersFor(virtual);
        if (providers.isEmpty()) {
            throw new PackageNotFoundException(virtual, "Unknown package or virtual '" + virtual + "'");
        }
        for (Spec root : roots) {
            if (providers.contains(root.name())) {
                return root.name();
            }
            for (String depName : root.dependencies().keySet()) {
                if (providers.contains(depName)) {
                    return depName;
                }
            }
        }
        for (String preferred : preferences.providers(virtual)) {
            if (providers.contains(preferred)) {
                return preferred;
            }
        }
        return providers.get(0);
    }

    private Choice choose(String name, List<Requirement> requirements) {
        PackageRecipe recipe = repository.get(name);
        Spec pinned = request.pinned().get(name);
        if (pinned != null && canReuse(pinned, recipe, requirements)) {
            Map<String, String> values = new TreeMap<>();
            pinned.variants().keySet().forEach(key -> values.put(key, pinned.variant(key)));
            return new Choice(recipe, pinned.version(), pinned.compiler(), values, pinned.architecture());
        }
        PackagePreferences.Prefs prefs = preferences.forPackage(name);
        return new Choice(
            recipe,
            chooseVersion(recipe, prefs, requirements),
            chooseCompiler(name, prefs, requirements),
            chooseVariants(recipe, prefs, requirements),
            chooseArchitecture(name, requirements)
        );
    }

    private boolean canReuse(Spec pinned, PackageRecipe recipe, List<Requirement> requirements) {
        if (request.relaxed().contains(pinned.name()) || !recipe.namespace().equals(pinned.namespace())) {
            return false;
        }
        if (!recipe.versions().contains(pinned.version())) {
            return false;
        }
        if (!pinned.variants().keySet().equals(recipe.variants().keySet())) {
            return false;
        }
        if (request.forcedCompiler() != null && !pinned.compiler().satisfies(request.forcedCompiler())) {
            return false;
        }
        for (Requirement requirement : requirements) {
            if (!pinned.withoutDependencies().satisfies(requirement.constraint().withoutDependencies())) {
                return false;
            }
        }
        return true;
    }

    private Version chooseVersion(PackageRecipe recipe, PackagePreferences.Prefs prefs, List<Requirement> requirements) {
        List<Version> candidates = new ArrayList<>();
        for (Version version : recipe.versions()) {
            if (requirements.stream().allMatch(r -> r.constraint().versions().contains(version))) {
                candidates.add(version);
            }
        }
        if (candidates.isEmpty()) {
            throw new ConcretizationConflictException(
                recipe.name(),
                "version",
                relevant(requirements, r -> !r.constraint().versions().isAny())
            );
        }
        candidates.sort(
            Comparator.comparingInt(prefs::versionRank)
                .thenComparingInt(version -> version.equals(recipe.preferred()) ? 0 : 1)
                .thenComparing(Comparator.<Version>reverseOrder())
        );
        return candidates.get(0);
    }

    private CompilerSpec chooseCompiler(String name, PackagePreferences.Prefs prefs, List<Requirement> requirements) {
        List<CompilerSpec> available = preferences.compilers();
        if (available.isEmpty()) {
            throw new ConcretizationException("No compilers are configured; cannot concretize " + name);
        }
        boolean explicit = requirements.stream().anyMatch(r -> r.constraint().compiler() != null);
        CompilerSpec forced = request.forcedCompiler();
        List<CompilerSpec> candidates = new ArrayList<>();
        for (CompilerSpec compiler : available) {
            boolean allowed = requirements.stream()
                .allMatch(r -> r.constraint().compiler() == null || compiler.satisfies(r.constraint().compiler()));
            if (allowed && (explicit || forced == null || compiler.satisfies(forced))) {
                candidates.add(compiler);
            }
        }
        if (candidates.isEmpty()) {
            List<Requirement> conflicting = relevant(requirements, r -> r.constraint().compiler() != null);
            if (conflicting.isEmpty() && forced != null) {
                throw new ConcretizationException("No configured compiler matches %" + forced + " for " + name);
            }
            throw new ConcretizationConflictException(name, "compiler", conflicting);
        }
        List<String> nameOrder = available.stream().map(CompilerSpec::name).distinct().toList();
        candidates.sort(
            Comparator.comparingInt(prefs::compilerRank)
                .thenComparingInt(compiler -> nameOrder.indexOf(compiler.name()))
                .thenComparing(CompilerSpec::version, Comparator.reverseOrder())
        );
        return candidates.get(0);
    }

    private Map<String, String> chooseVariants(
        PackageRecipe recipe,
        PackagePreferences.Prefs prefs,
        List<Requirement> requirements
    ) {
        for (Requirement requirement : requirements) {
            for (String key : requirement.constraint().variants().keySet()) {
                if (recipe.variant(key).isEmpty()) {
                    throw new ConcretizationException(
                        "Package " + recipe.name() + " has no variant '" + key + "' (requested by "
                            + requirement.origin() + ")"
                    );
                }
            }
        }
        Map<String, String> values = new TreeMap<>();
        for (VariantDefinition definition : recipe.variants().values()) {
            String key = definition.name();
            Set<String> allowed = new TreeSet<>(definition.allowedValues());
            for (Requirement requirement : requirements) {
                Set<String> wanted = requirement.constraint().variants().get(key);
                if (wanted != null) {
                    allowed.retainAll(wanted);
                }
            }
            if (allowed.isEmpty()) {
                throw new ConcretizationConflictException(
                    recipe.name(),
                    "variant '" + key + "'",
                    relevant(requirements, r -> r.constraint().variants().containsKey(key))
                );
            }
            String preferred = prefs.variants().get(key);
            String value;
            if (allowed.size() == 1) {
                value = allowed.iterator().next();
            } else if (preferred != null && allowed.contains(preferred)) {
                value = preferred;
            } else if (allowed.contains(definition.defaultValue())) {
                value = definition.defaultValue();
            } else {
                value = allowed.iterator().next();
            }
            values.put(key, value);
        }
        return values;
    }

    private Architecture chooseArchitecture(String name, List<Requirement> requirements) {
        Architecture requested = null;
        for (Requirement requirement : requirements) {
            Architecture wanted = requirement.constraint().architecture();
            if (wanted == null) {
                continue;
            }
            if (requested != null && !requested.equals(wanted)) {
                throw new ConcretizationConflictException(
                    name,
                    "architecture",
                    relevant(requirements, r -> r.constraint().architecture() != null)
                );
            }
            requested = wanted;
        }
        if (requested != null) {
            return requested;
        }
        return preferences.defaultArchitecture().orElse(hostArchitecture);
    }

    private static List<Requirement> relevant(List<Requirement> requirements, Predicate<Requirement> filter) {
        List<Requirement> matching = requirements.stream().filter(filter).toList();
        return matching.isEmpty() ? requirements : matching;
    }

    private Spec build(String name, Map<String, Spec> built, Set<String> path) {
        Spec existing = built.get(name);
        if (existing != null) {
            return existing;
        }
        if (!path.add(name)) {
            List<String> cycle = new ArrayList<>(path);
            cycle.add(name);
            throw new ConcretizationException("Dependency cycle: " + String.join(" -> ", cycle));
        }
        Choice choice = Objects.requireNonNull(choices.get(name), name);
        Map<String, Spec> deps = new TreeMap<>();
        for (String child : edges.getOrDefault(name, Set.of())) {
            deps.put(child, build(child, built, path));
        }
        path.remove(name);
        Spec concrete = Spec.concrete(
            name,
            choice.recipe().namespace(),
            choice.version(),
            choice.compiler(),
            choice.variants(),
            choice.architecture(),
            deps
        );
        built.put(name, concrete);
        return concrete;
    }

    private void checkDependencyConstraints(Spec root, Spec concrete) {
        for (String depName : root.dependencies().keySet()) {
            String depTarget = target(depName);
            if (concrete.find(depTarget).isEmpty()) {
                throw new ConcretizationException(root.name() + " does not depend on " + depName);
            }
        }
    }

    /**
     * Values picked for one package in one round.
     */
    record Choice(
        PackageRecipe recipe,
        Version version,
        CompilerSpec compiler,
        Map<String, String> variants,
        Architecture architecture
    ) {
        boolean matches(Spec when) {
            if (!when.versions().contains(version)) {
                return false;
            }
            if (when.compiler() != null && !compiler.satisfies(when.compiler())) {
                return false;
            }
            for (Map.Entry<String, Set<String>> wanted : when.variants().entrySet()) {
                String value = variants.get(wanted.getKey());
                if (value == null || !wanted.getValue().contains(value)) {
                    return false;
                }
            }
            return when.architecture() == null || when.architecture().equals(architecture);
        }

        String label() {
            return recipe.name() + "@" + version;
        }
    }
}
