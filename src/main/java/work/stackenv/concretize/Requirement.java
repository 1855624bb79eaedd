package work.stackenv.concretize;

import java.util.Objects;
import work.stackenv.spec.Spec;

/**
 * A constraint placed on one package node together with who asked for it: a root spec as the user wrote it,
 * or a dependent as {@code name@version}.
 */
public record Requirement(Spec constraint, String origin) {
    public Requirement {
        Objects.requireNonNull(constraint, "constraint");
        Objects.requireNonNull(origin, "origin");
    }

    @Override
    public String toString() {
        return constraint.format() + " (required by " + origin + ")";
    }
}
