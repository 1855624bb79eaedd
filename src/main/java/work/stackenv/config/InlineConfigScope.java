package work.stackenv.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Scope backed by a block of an already parsed document, such as the configuration embedded in an environment
 * manifest.
 */
public final class InlineConfigScope extends ConfigScope {
    private final Map<String, Object> content;

    private InlineConfigScope(String name, Map<String, Object> content) {
        super(name);
        this.content = content;
    }

    /**
     * Takes the configuration sections found at {@code prefix} in {@code doc}, ignoring any other keys there.
     */
    public static InlineConfigScope fromDocument(String name, YamlDocument doc, Set<String> ignoredKeys, String... prefix) {
        Map<String, Object> block = doc.root();
        for (String key : prefix) {
            Object next = block.get(key);
            block = next == null ? Map.of() : ConfigSchema.requireMap(doc, next, key);
        }
        ConfigSchema.validateSections(doc, block, ignoredKeys, prefix);
        Map<String, Object> sections = new LinkedHashMap<>();
        block.forEach((key, value) -> {
            if (ConfigSchema.SECTIONS.contains(key) && value != null) {
                sections.put(key, value);
            }
        });
        return new InlineConfigScope(name, sections);
    }

    @Override
    protected Map<String, Object> load() {
        return content;
    }
}
