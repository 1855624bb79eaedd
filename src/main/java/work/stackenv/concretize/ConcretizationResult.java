package work.stackenv.concretize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.stackenv.spec.Spec;

/**
 * Concrete roots, aligned with the request's roots, and their deduplicated closure keyed by content hash.
 */
public record ConcretizationResult(List<Spec> roots, Map<String, Spec> specsByHash) {
    public ConcretizationResult {
        roots = List.copyOf(roots);
        specsByHash = Collections.unmodifiableMap(new LinkedHashMap<>(specsByHash));
    }
}
