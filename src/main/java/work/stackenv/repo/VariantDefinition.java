package work.stackenv.repo;

import java.util.Objects;
import java.util.Set;

/**
 * Variant a recipe exposes. Boolean variants use the values {@code true} and {@code false}.
 */
public record VariantDefinition(String name, String defaultValue, Set<String> allowedValues, String description) {
    public static final Set<String> BOOLEAN_VALUES = Set.of("true", "false");

    public VariantDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(defaultValue, "defaultValue");
        allowedValues = allowedValues == null || allowedValues.isEmpty() ? BOOLEAN_VALUES : Set.copyOf(allowedValues);
        description = description == null ? "" : description;
        if (!allowedValues.contains(defaultValue)) {
            throw new IllegalArgumentException("Default '" + defaultValue + "' of variant " + name + " is not an allowed value");
        }
    }

    public boolean isBoolean() {
        return allowedValues.equals(BOOLEAN_VALUES);
    }
}
