package work.stackenv.install;

import java.util.List;
import work.stackenv.spec.Spec;

/**
 * Outcome of one install pass, each list in dependency-first order.
 *
 * @param installed nodes built during this pass
 * @param upToDate nodes that were already installed
 * @param failures nodes whose build failed
 * @param skipped nodes not attempted because a dependency failed
 */
public record InstallReport(
    List<Spec> installed,
    List<Spec> upToDate,
    List<BuildFailureException> failures,
    List<Spec> skipped
) {
    public InstallReport {
        installed = List.copyOf(installed);
        upToDate = List.copyOf(upToDate);
        failures = List.copyOf(failures);
        skipped = List.copyOf(skipped);
    }

    public boolean success() {
        return failures.isEmpty() && skipped.isEmpty();
    }
}
