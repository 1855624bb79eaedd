package work.stackenv.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import work.stackenv.spec.Architecture;
import work.stackenv.spec.CompilerSpec;
import work.stackenv.spec.Spec;
import work.stackenv.spec.Version;
import work.stackenv.spec.VersionConstraint;

/**
 * Memoized read-through view of the {@code packages}, {@code compilers} and {@code config} sections of one
 * {@link ConfigScopeStack}. The memo is cleared whenever the stack reports a change; each environment owns its
 * own instance.
 */
public final class PackagePreferences {
    private static final String ALL = "all";

    private final ConfigScopeStack stack;
    private final Map<String, Prefs> cache = new ConcurrentHashMap<>();
    private volatile List<CompilerSpec> compilers;

    public PackagePreferences(ConfigScopeStack stack) {
        this.stack = stack;
        stack.addInvalidationListener(this::invalidate);
    }

    public void invalidate() {
        cache.clear();
        compilers = null;
    }

    public ConfigScopeStack stack() {
        return stack;
    }

    public Prefs forPackage(String name) {
        return cache.computeIfAbsent(name, this::compute);
    }

    private Prefs compute(String name) {
        Map<String, Object> packages = stack.section(ConfigSchema.PACKAGES);
        Map<String, Object> all = asMap(packages.get(ALL));
        Map<String, Object> own = ALL.equals(name) ? Map.of() : asMap(packages.get(name));

        List<VersionConstraint> versions = new ArrayList<>();
        for (String raw : strings(own.get("version"))) {
            versions.add(VersionConstraint.parse(raw));
        }

        List<String> compilerSource = own.containsKey("compiler") ? strings(own.get("compiler")) : strings(all.get("compiler"));
        List<CompilerSpec> compilerOrder = new ArrayList<>();
        for (String raw : compilerSource) {
            compilerOrder.add(CompilerSpec.parse(raw));
        }

        Map<String, String> variants = new LinkedHashMap<>();
        variants.putAll(variantValues(all.get("variants")));
        variants.putAll(variantValues(own.get("variants")));

        Map<String, List<String>> providers = new LinkedHashMap<>();
        asMap(all.get("providers")).forEach((virtual, list) -> providers.put(virtual, strings(list)));
        asMap(own.get("providers")).forEach((virtual, list) -> providers.put(virtual, strings(list)));

        return new Prefs(List.copyOf(versions), List.copyOf(compilerOrder), Map.copyOf(variants), Map.copyOf(providers));
    }

    /**
     * Provider names configured for a virtual package, most preferred first.
     */
    public List<String> providers(String virtual) {
        return forPackage(ALL).providers().getOrDefault(virtual, List.of());
    }

    /**
     * Compilers available for concretization, in configured order.
     */
    public List<CompilerSpec> compilers() {
        List<CompilerSpec> current = compilers;
        if (current == null) {
            List<CompilerSpec> parsed = new ArrayList<>();
            for (Object entry : stack.listSection(ConfigSchema.COMPILERS)) {
                Object spec = asMap(entry).get("spec");
                if (spec != null) {
                    CompilerSpec compiler = CompilerSpec.parse(String.valueOf(spec));
                    if (compiler.isConcrete() && !parsed.contains(compiler)) {
                        parsed.add(compiler);
                    }
                }
            }
            current = List.copyOf(parsed);
            compilers = current;
        }
        return current;
    }

    public Optional<Architecture> defaultArchitecture() {
        Object arch = stack.section(ConfigSchema.CONFIG).get("arch");
        return arch == null ? Optional.empty() : Optional.of(Architecture.parse(String.valueOf(arch)));
    }

    public int concretizeJobs() {
        return intSetting("concretize_jobs", Runtime.getRuntime().availableProcessors());
    }

    public int buildJobs() {
        return intSetting("build_jobs", Runtime.getRuntime().availableProcessors());
    }

    private int intSetting(String key, int fallback) {
        Object value = stack.section(ConfigSchema.CONFIG).get(key);
        return value instanceof Number number ? Math.max(1, number.intValue()) : fallback;
    }

    private static Map<String, String> variantValues(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        String joined = raw instanceof List<?> list
            ? String.join(" ", strings(list))
            : String.valueOf(raw);
        if (joined.isBlank()) {
            return Map.of();
        }
        Spec parsed = Spec.parse(joined);
        Map<String, String> values = new LinkedHashMap<>();
        parsed.variants().forEach((key, allowed) -> values.put(key, allowed.iterator().next()));
        return values;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object raw) {
        return raw instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static List<String> strings(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                values.add(String.valueOf(item));
            }
        }
        return values;
    }

    /**
     * Preferences for one package.
     *
     * @param versions preferred version constraints, best first
     * @param compilers preferred compilers, best first (falls back to the {@code all} entry)
     * @param variants preferred variant values ({@code all} overlaid by the package's own)
     * @param providers virtual name to preferred provider names
     */
    public record Prefs(
        List<VersionConstraint> versions,
        List<CompilerSpec> compilers,
        Map<String, String> variants,
        Map<String, List<String>> providers
    ) {
        /**
         * Index of the first preferred constraint admitting {@code version}; {@code versions().size()} if none.
         */
        public int versionRank(Version version) {
            for (int i = 0; i < versions.size(); i++) {
                if (versions.get(i).contains(version)) {
                    return i;
                }
            }
            return versions.size();
        }

        public int compilerRank(CompilerSpec compiler) {
            for (int i = 0; i < compilers.size(); i++) {
                if (compiler.satisfies(compilers.get(i))) {
                    return i;
                }
            }
            return compilers.size();
        }
    }
}
