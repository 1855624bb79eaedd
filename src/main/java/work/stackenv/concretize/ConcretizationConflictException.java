package work.stackenv.concretize;

import java.util.List;
import java.util.stream.Collectors;

/**
 * No candidate satisfies every constraint placed on one package. Lists every conflicting constraint with the
 * spec that requested it.
 */
public final class ConcretizationConflictException extends ConcretizationException {
    private final String packageName;
    private final List<Requirement> requirements;

    public ConcretizationConflictException(String packageName, String attribute, List<Requirement> requirements) {
        super(describe(packageName, attribute, requirements));
        this.packageName = packageName;
        this.requirements = List.copyOf(requirements);
    }

    private static String describe(String packageName, String attribute, List<Requirement> requirements) {
        String lines = requirements.stream()
            .map(requirement -> "    " + requirement)
            .collect(Collectors.joining("\n"));
        return "Conflicting " + attribute + " constraints on " + packageName
            + "; no candidate satisfies all of:\n" + lines;
    }

    public String packageName() {
        return packageName;
    }

    public List<Requirement> requirements() {
        return requirements;
    }
}
