package work.stackenv.repo;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import work.stackenv.spec.Spec;
import work.stackenv.spec.Version;

/**
 * Package metadata the concretizer needs: known versions, variants, dependencies and provided virtuals.
 * Build logic lives with the external build collaborator, not here.
 */
public record PackageRecipe(
    String name,
    String namespace,
    String description,
    List<Version> versions,
    Version preferred,
    Map<String, VariantDefinition> variants,
    List<DependencyDeclaration> dependencies,
    List<String> provides
) {
    public PackageRecipe {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(namespace, "namespace");
        description = description == null ? "" : description;
        versions = versions.stream().sorted(Comparator.reverseOrder()).toList();
        variants = variants == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(variants));
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        provides = provides == null ? List.of() : List.copyOf(provides);
        if (versions.isEmpty()) {
            throw new IllegalArgumentException("Package " + name + " declares no versions");
        }
        if (preferred != null && !versions.contains(preferred)) {
            throw new IllegalArgumentException("Preferred version " + preferred + " of " + name + " is not a declared version");
        }
    }

    /**
     * Same recipe published under another namespace.
     */
    public PackageRecipe inNamespace(String otherNamespace) {
        return new PackageRecipe(name, otherNamespace, description, versions, preferred, variants, dependencies, provides);
    }

    public Optional<VariantDefinition> variant(String variantName) {
        return Optional.ofNullable(variants.get(variantName));
    }

    public boolean provides(String virtual) {
        return provides.contains(virtual);
    }

    /**
     * Dependency edge declared by a recipe, active only when the dependent satisfies {@code when}.
     */
    public record DependencyDeclaration(Spec constraint, Spec when) {
        public DependencyDeclaration {
            Objects.requireNonNull(constraint, "constraint");
            Objects.requireNonNull(constraint.name(), "dependency constraints must be named");
        }

        public String name() {
            return constraint.name();
        }
    }
}
