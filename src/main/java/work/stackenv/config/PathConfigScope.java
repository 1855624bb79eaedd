package work.stackenv.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scope read from disk. A regular file holds any of the top-level sections; a directory holds one
 * {@code <section>.yaml} file per section. A path that does not exist contributes nothing.
 */
public final class PathConfigScope extends ConfigScope {
    private static final Logger log = LoggerFactory.getLogger(PathConfigScope.class);

    private final Path path;
    private final String displayPath;

    public PathConfigScope(String name, Path path) {
        this(name, path, path.toString());
    }

    /**
     * @param displayPath path as the user wrote it, used in error messages
     */
    public PathConfigScope(String name, Path path, String displayPath) {
        super(name);
        this.path = path.toAbsolutePath().normalize();
        this.displayPath = displayPath;
    }

    public Path path() {
        return path;
    }

    @Override
    protected Map<String, Object> load() {
        if (Files.isDirectory(path)) {
            return loadDirectory();
        }
        if (Files.isRegularFile(path)) {
            return loadFile(path, displayPath);
        }
        log.warn("Configuration scope {} not found at {}; ignoring", name(), displayPath);
        return Map.of();
    }

    private Map<String, Object> loadDirectory() {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (String section : ConfigSchema.SECTIONS.stream().sorted().toList()) {
            Path file = path.resolve(section + ".yaml");
            if (Files.isRegularFile(file)) {
                merged.putAll(loadFile(file, displayPath + "/" + section + ".yaml"));
            }
        }
        return merged;
    }

    private static Map<String, Object> loadFile(Path file, String display) {
        YamlDocument doc = YamlDocument.read(file, display);
        ConfigSchema.validateSections(doc, doc.root(), Set.of());
        Map<String, Object> sections = new LinkedHashMap<>();
        doc.root().forEach((key, value) -> {
            if (value != null) {
                sections.put(key, value);
            }
        });
        return sections;
    }
}
