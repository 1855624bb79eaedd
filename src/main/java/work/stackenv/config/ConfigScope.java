package work.stackenv.config;

import java.util.Map;
import java.util.Objects;

/**
 * One named layer of configuration. Content is read lazily and cached until {@link #reload()}.
 */
public abstract class ConfigScope {
    private final String name;
    private volatile Map<String, Object> sections;

    protected ConfigScope(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public final String name() {
        return name;
    }

    /**
     * Validated section contents ({@code packages}, {@code compilers}, {@code config}) of this scope.
     */
    public final Map<String, Object> sections() {
        Map<String, Object> current = sections;
        if (current == null) {
            synchronized (this) {
                current = sections;
                if (current == null) {
                    current = Map.copyOf(load());
                    sections = current;
                }
            }
        }
        return current;
    }

    /**
     * Drops cached content; the next {@link #sections()} call reads the source again.
     */
    public final synchronized void reload() {
        sections = null;
    }

    protected abstract Map<String, Object> load();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
