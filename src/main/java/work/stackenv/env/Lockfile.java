package work.stackenv.env;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.stackenv.spec.IncompleteSpecException;
import work.stackenv.spec.Spec;
import work.stackenv.spec.SpecNodes;
import work.stackenv.spec.SpecParseException;

/**
 * Persisted snapshot of an environment's concrete DAG.
 *
 * <pre>
 * {
 *   "_meta": {"file-type": "stackenv-lockfile", "lockfile-version": 2},
 *   "roots": [{"hash": "...", "spec": "mpileaks ^callpath@0.9"}],
 *   "concrete-specs": {"...": {"name": "mpileaks", ...}}
 * }
 * </pre>
 *
 * Version 1 files list roots as bare hashes; they are still read.
 */
public record Lockfile(List<Root> roots, Map<String, Spec> specsByHash) {
    public static final int CURRENT_VERSION = 2;
    static final String FILE_TYPE = "stackenv-lockfile";

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public Lockfile {
        roots = List.copyOf(roots);
        specsByHash = Collections.unmodifiableMap(new LinkedHashMap<>(specsByHash));
    }

    /**
     * One concretized root: the abstract spec the user asked for and the hash it resolved to.
     */
    public record Root(String hash, Spec spec) {
        public Root {
            Objects.requireNonNull(hash, "hash");
            Objects.requireNonNull(spec, "spec");
        }
    }

    public String toJson() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("file-type", FILE_TYPE);
        meta.put("lockfile-version", CURRENT_VERSION);

        List<Map<String, Object>> rootNodes = new ArrayList<>();
        for (Root root : roots) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("hash", root.hash());
            node.put("spec", root.spec().toString());
            rootNodes.add(node);
        }

        Map<String, Object> concrete = new LinkedHashMap<>();
        specsByHash.forEach((hash, spec) -> concrete.put(hash, SpecNodes.toNode(spec)));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("_meta", meta);
        document.put("roots", rootNodes);
        document.put("concrete-specs", concrete);
        try {
            return JSON.writeValueAsString(document) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render lockfile", ex);
        }
    }

    /**
     * @param source name used in error messages
     */
    public static Lockfile fromJson(String json, String source) {
        Map<String, Object> document;
        try {
            document = JSON.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException ex) {
            throw new LockfileFormatException(source, "not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (document == null || !(document.get("_meta") instanceof Map<?, ?> meta)) {
            throw new LockfileFormatException(source, "missing _meta block");
        }
        if (!(meta.get("lockfile-version") instanceof Number version)) {
            throw new LockfileFormatException(source, "missing lockfile-version");
        }
        if (!(document.get("concrete-specs") instanceof Map<?, ?> nodes)) {
            throw new LockfileFormatException(source, "missing concrete-specs");
        }
        if (!(document.get("roots") instanceof List<?> rawRoots)) {
            throw new LockfileFormatException(source, "missing roots");
        }
        Map<String, Spec> specs = readNodes(nodes, source);
        List<Root> roots = switch (version.intValue()) {
            case 1 -> readRootsV1(rawRoots, specs, source);
            case 2 -> readRootsV2(rawRoots, specs, source);
            default -> throw new LockfileFormatException(
                source,
                "unsupported lockfile-version " + version + " (this tool reads versions 1 to " + CURRENT_VERSION + ")"
            );
        };
        return new Lockfile(roots, specs);
    }

    private static List<Root> readRootsV1(List<?> rawRoots, Map<String, Spec> specs, String source) {
        List<Root> roots = new ArrayList<>();
        for (Object raw : rawRoots) {
            String hash = String.valueOf(raw);
            Spec concrete = requireNode(specs, hash, source);
            roots.add(new Root(hash, Spec.parse(concrete.name())));
        }
        return roots;
    }

    private static List<Root> readRootsV2(List<?> rawRoots, Map<String, Spec> specs, String source) {
        List<Root> roots = new ArrayList<>();
        for (Object raw : rawRoots) {
            if (!(raw instanceof Map<?, ?> entry) || entry.get("hash") == null || entry.get("spec") == null) {
                throw new LockfileFormatException(source, "root entries need 'hash' and 'spec'");
            }
            String hash = String.valueOf(entry.get("hash"));
            requireNode(specs, hash, source);
            try {
                roots.add(new Root(hash, Spec.parse(String.valueOf(entry.get("spec")))));
            } catch (SpecParseException ex) {
                throw new LockfileFormatException(source, "bad root spec: " + ex.getMessage(), ex);
            }
        }
        return roots;
    }

    private static Spec requireNode(Map<String, Spec> specs, String hash, String source) {
        Spec spec = specs.get(hash);
        if (spec == null) {
            throw new LockfileFormatException(source, "root " + hash + " is not in concrete-specs");
        }
        return spec;
    }

    private static Map<String, Spec> readNodes(Map<?, ?> nodes, String source) {
        Map<String, Spec> rebuilt = new LinkedHashMap<>();
        for (Object key : nodes.keySet()) {
            rebuild(String.valueOf(key), nodes, rebuilt, new HashSet<>(), source);
        }
        return rebuilt;
    }

    private static Spec rebuild(String hash, Map<?, ?> nodes, Map<String, Spec> rebuilt, Set<String> path, String source) {
        Spec done = rebuilt.get(hash);
        if (done != null) {
            return done;
        }
        if (!(nodes.get(hash) instanceof Map<?, ?> node)) {
            return null;
        }
        if (!path.add(hash)) {
            throw new LockfileFormatException(source, "dependency cycle through " + hash);
        }
        Spec spec;
        try {
            spec = SpecNodes.fromNode(node, depHash -> rebuild(depHash, nodes, rebuilt, path, source));
        } catch (IllegalArgumentException | IncompleteSpecException ex) {
            throw new LockfileFormatException(source, "bad node " + hash + ": " + ex.getMessage(), ex);
        }
        path.remove(hash);
        if (!spec.dagHash().equals(hash)) {
            throw new LockfileFormatException(
                source,
                "node " + spec.name() + " is stored under " + hash + " but hashes to " + spec.dagHash()
            );
        }
        rebuilt.put(hash, spec);
        return spec;
    }
}
