package work.stackenv.repo;

import java.util.List;

/**
 * Source of package recipes.
 */
public interface PackageRepository {
    /**
     * Recipe for {@code name}; throws {@link PackageNotFoundException} when unknown.
     */
    PackageRecipe get(String name);

    /**
     * Recipe for {@code name} published under {@code namespace}.
     */
    PackageRecipe get(String name, String namespace);

    boolean exists(String name);

    /**
     * Names of packages that provide {@code virtual}, sorted.
     */
    List<String> providersFor(String virtual);

    default boolean isVirtual(String name) {
        return !exists(name) && !providersFor(name).isEmpty();
    }
}
