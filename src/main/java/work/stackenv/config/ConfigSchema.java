package work.stackenv.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema checks for configuration sections. Every violation is reported as a {@link ConfigFormatException}
 * carrying the source file and the line of the offending key.
 */
public final class ConfigSchema {
    public static final String PACKAGES = "packages";
    public static final String COMPILERS = "compilers";
    public static final String CONFIG = "config";
    public static final Set<String> SECTIONS = Set.of(PACKAGES, COMPILERS, CONFIG);

    private static final Set<String> PACKAGE_KEYS = Set.of("version", "compiler", "variants", "providers", "target");
    private static final Set<String> COMPILER_KEYS = Set.of("spec");
    private static final Set<String> CONFIG_KEYS = Set.of("arch", "build_jobs", "concretize_jobs");

    private ConfigSchema() {}

    /**
     * Validates a mapping whose keys are configuration sections (plus {@code extraKeys}), located at
     * {@code prefix} inside {@code doc}.
     */
    public static void validateSections(YamlDocument doc, Map<String, Object> sections, Set<String> extraKeys, String... prefix) {
        Set<String> allowed = new LinkedHashSet<>(SECTIONS);
        allowed.addAll(extraKeys);
        requireKeys(doc, sections, allowed, prefix);
        for (Map.Entry<String, Object> entry : sections.entrySet()) {
            String[] path = append(prefix, entry.getKey());
            switch (entry.getKey()) {
                case PACKAGES -> validatePackages(doc, entry.getValue(), path);
                case COMPILERS -> validateCompilers(doc, entry.getValue(), path);
                case CONFIG -> validateConfig(doc, entry.getValue(), path);
                default -> {
                    // extra keys are validated by the caller
                }
            }
        }
    }

    private static void validatePackages(YamlDocument doc, Object value, String[] path) {
        Map<String, Object> packages = requireMap(doc, value, path);
        for (Map.Entry<String, Object> pkg : packages.entrySet()) {
            String[] pkgPath = append(path, pkg.getKey());
            Map<String, Object> prefs = requireMap(doc, pkg.getValue(), pkgPath);
            requireKeys(doc, prefs, PACKAGE_KEYS, pkgPath);
            for (Map.Entry<String, Object> pref : prefs.entrySet()) {
                String[] prefPath = append(pkgPath, pref.getKey());
                switch (pref.getKey()) {
                    case "variants" -> {
                        if (!(pref.getValue() instanceof String)) {
                            requireScalarList(doc, pref.getValue(), prefPath);
                        }
                    }
                    case "providers" -> {
                        Map<String, Object> providers = requireMap(doc, pref.getValue(), prefPath);
                        providers.forEach((virtual, list) -> requireScalarList(doc, list, append(prefPath, virtual)));
                    }
                    default -> requireScalarList(doc, pref.getValue(), prefPath);
                }
            }
        }
    }

    private static void validateCompilers(YamlDocument doc, Object value, String[] path) {
        List<Object> entries = requireList(doc, value, path);
        for (int i = 0; i < entries.size(); i++) {
            String[] entryPath = append(path, String.valueOf(i));
            Map<String, Object> entry = requireMap(doc, entries.get(i), path);
            requireKeys(doc, entry, COMPILER_KEYS, entryPath);
            if (!(entry.get("spec") instanceof String spec) || !spec.contains("@")) {
                throw new ConfigFormatException(doc.source(), line(doc, path),
                    "compiler entry " + i + " needs 'spec: name@version'");
            }
        }
    }

    private static void validateConfig(YamlDocument doc, Object value, String[] path) {
        Map<String, Object> config = requireMap(doc, value, path);
        requireKeys(doc, config, CONFIG_KEYS, path);
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            String[] keyPath = append(path, entry.getKey());
            if ("arch".equals(entry.getKey())) {
                if (!(entry.getValue() instanceof String)) {
                    throw typeError(doc, keyPath, "a string", entry.getValue());
                }
            } else if (!(entry.getValue() instanceof Long jobs) || jobs < 1) {
                throw typeError(doc, keyPath, "a positive integer", entry.getValue());
            }
        }
    }

    public static void requireKeys(YamlDocument doc, Map<String, Object> map, Set<String> allowed, String... path) {
        for (String key : map.keySet()) {
            if (!allowed.contains(key)) {
                throw new ConfigFormatException(
                    doc.source(),
                    doc.lineOf(append(path, key)),
                    "Additional properties are not allowed ('" + key + "' was unexpected)"
                );
            }
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> requireMap(YamlDocument doc, Object value, String... path) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw typeError(doc, path, "a mapping", value);
    }

    @SuppressWarnings("unchecked")
    public static List<Object> requireList(YamlDocument doc, Object value, String... path) {
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        throw typeError(doc, path, "a list", value);
    }

    public static List<String> requireScalarList(YamlDocument doc, Object value, String... path) {
        List<String> result = new ArrayList<>();
        for (Object item : requireList(doc, value, path)) {
            if (item == null || item instanceof Map || item instanceof List) {
                throw typeError(doc, path, "a list of scalars", value);
            }
            result.add(String.valueOf(item));
        }
        return result;
    }

    private static ConfigFormatException typeError(YamlDocument doc, String[] path, String expected, Object actual) {
        String kind = actual == null ? "null" : actual instanceof Map ? "mapping" : actual instanceof List ? "list" : "'" + actual + "'";
        return new ConfigFormatException(
            doc.source(),
            line(doc, path),
            String.join(":", path) + " must be " + expected + ", got " + kind
        );
    }

    private static int line(YamlDocument doc, String[] path) {
        return doc.lineOf(path);
    }

    static String[] append(String[] prefix, String... more) {
        String[] joined = Arrays.copyOf(prefix, prefix.length + more.length);
        System.arraycopy(more, 0, joined, prefix.length, more.length);
        return joined;
    }
}
