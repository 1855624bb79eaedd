package work.stackenv.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered configuration layers, lowest precedence first. Merging overlays scopes in order: mappings merge
 * key by key, any other value at a key path replaces the lower one outright.
 *
 * <p>Every mutation bumps {@link #generation()} and notifies the registered invalidation listeners, which is how
 * {@link PackagePreferences} learns that its memo is stale.
 */
public final class ConfigScopeStack {
    static final String DEFAULTS_RESOURCE = "stackenv/defaults.yaml";

    private final List<ConfigScope> scopes = new ArrayList<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private long generation;
    private Map<String, Object> merged;

    public ConfigScopeStack() {}

    private ConfigScopeStack(List<ConfigScope> initial) {
        scopes.addAll(initial);
    }

    /**
     * A stack holding only the built-in defaults shipped with the tool.
     */
    public static ConfigScopeStack withDefaults() {
        var stack = new ConfigScopeStack();
        stack.push(defaultsScope());
        return stack;
    }

    static ConfigScope defaultsScope() {
        try (InputStream in = ConfigScopeStack.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing built-in configuration " + DEFAULTS_RESOURCE);
            }
            return InlineConfigScope.fromDocument("defaults", YamlDocument.read(in, DEFAULTS_RESOURCE), Set.of());
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read built-in configuration " + DEFAULTS_RESOURCE, ex);
        }
    }

    public synchronized ConfigScopeStack push(ConfigScope scope) {
        requireNewName(scope);
        scopes.add(scope);
        changed();
        return this;
    }

    /**
     * Inserts {@code scope} directly below the scope named {@code upperName}, so that scope keeps precedence over it.
     */
    public synchronized ConfigScopeStack pushBelow(String upperName, ConfigScope scope) {
        requireNewName(scope);
        int index = indexOf(upperName);
        if (index < 0) {
            throw new IllegalArgumentException("No configuration scope named " + upperName);
        }
        scopes.add(index, scope);
        changed();
        return this;
    }

    private void requireNewName(ConfigScope scope) {
        if (indexOf(scope.name()) >= 0) {
            throw new IllegalArgumentException("Configuration scope already present: " + scope.name());
        }
    }

    private int indexOf(String scopeName) {
        for (int i = 0; i < scopes.size(); i++) {
            if (scopes.get(i).name().equals(scopeName)) {
                return i;
            }
        }
        return -1;
    }

    public synchronized boolean remove(String scopeName) {
        boolean removed = scopes.removeIf(scope -> scope.name().equals(scopeName));
        if (removed) {
            changed();
        }
        return removed;
    }

    /**
     * Re-reads every scope from its source; call after editing scope files.
     */
    public synchronized void reload() {
        scopes.forEach(ConfigScope::reload);
        changed();
    }

    public synchronized List<ConfigScope> scopes() {
        return Collections.unmodifiableList(new ArrayList<>(scopes));
    }

    public synchronized long generation() {
        return generation;
    }

    /**
     * Independent stack with the same scopes and no listeners.
     */
    public synchronized ConfigScopeStack copy() {
        return new ConfigScopeStack(scopes);
    }

    public void addInvalidationListener(Runnable listener) {
        listeners.add(listener);
    }

    /**
     * Effective configuration of all scopes.
     */
    public synchronized Map<String, Object> merge() {
        if (merged == null) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (ConfigScope scope : scopes) {
                result = overlay(result, scope.sections());
            }
            merged = Collections.unmodifiableMap(result);
        }
        return merged;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> section(String section) {
        Object value = merge().get(section);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    public List<Object> listSection(String section) {
        Object value = merge().get(section);
        return value instanceof List<?> list ? List.copyOf(list) : List.of();
    }

    private void changed() {
        generation++;
        merged = null;
        listeners.forEach(Runnable::run);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> overlay(Map<String, Object> lower, Map<String, Object> higher) {
        Map<String, Object> result = new LinkedHashMap<>(lower);
        for (Map.Entry<String, Object> entry : higher.entrySet()) {
            Object below = result.get(entry.getKey());
            Object above = entry.getValue();
            if (below instanceof Map<?, ?> belowMap && above instanceof Map<?, ?> aboveMap) {
                result.put(entry.getKey(), overlay((Map<String, Object>) belowMap, (Map<String, Object>) aboveMap));
            } else {
                result.put(entry.getKey(), above);
            }
        }
        return result;
    }
}
