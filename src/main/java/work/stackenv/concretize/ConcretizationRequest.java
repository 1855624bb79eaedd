package work.stackenv.concretize;

import java.util.List;
import java.util.Map;
import java.util.Set;
import work.stackenv.spec.CompilerSpec;
import work.stackenv.spec.Spec;

/**
 * Input of one concretizer run.
 *
 * @param roots abstract root specs, in order
 * @param pinned previously concretized nodes by package name, reused while still compatible
 * @param relaxed package names whose pinned node and user version constraints are ignored
 * @param forcedCompiler compiler every node must use unless it asks for another one explicitly, or {@code null}
 */
public record ConcretizationRequest(
    List<Spec> roots,
    Map<String, Spec> pinned,
    Set<String> relaxed,
    CompilerSpec forcedCompiler
) {
    public ConcretizationRequest {
        roots = List.copyOf(roots);
        pinned = pinned == null ? Map.of() : Map.copyOf(pinned);
        relaxed = relaxed == null ? Set.of() : Set.copyOf(relaxed);
    }

    public static ConcretizationRequest of(List<Spec> roots) {
        return new ConcretizationRequest(roots, Map.of(), Set.of(), null);
    }

    public ConcretizationRequest reusing(Map<String, Spec> priorNodes) {
        return new ConcretizationRequest(roots, priorNodes, relaxed, forcedCompiler);
    }

    public ConcretizationRequest relaxing(Set<String> names) {
        return new ConcretizationRequest(roots, pinned, names, forcedCompiler);
    }

    public ConcretizationRequest forcingCompiler(CompilerSpec compiler) {
        return new ConcretizationRequest(roots, pinned, relaxed, compiler);
    }
}
