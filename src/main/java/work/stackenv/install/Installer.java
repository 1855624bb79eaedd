package work.stackenv.install;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.stackenv.shared.WorkerPools;
import work.stackenv.spec.Spec;

/**
 * Installs the closure of a set of roots, dependencies first. Independent nodes build concurrently; a node whose
 * dependency failed is skipped while unrelated subtrees keep going.
 */
public final class Installer {
    private static final Logger log = LoggerFactory.getLogger(Installer.class);

    private final BuildCollaborator collaborator;
    private final InstallClaimTable claims;
    private final int jobs;

    public Installer(BuildCollaborator collaborator, InstallClaimTable claims, int jobs) {
        this.collaborator = collaborator;
        this.claims = claims;
        this.jobs = Math.max(1, jobs);
    }

    public InstallReport install(List<Spec> roots) {
        Map<String, Spec> order = new LinkedHashMap<>();
        for (Spec root : roots) {
            for (Spec node : root.traverse()) {
                order.putIfAbsent(node.dagHash(), node);
            }
        }
        ExecutorService executor = WorkerPools.bounded("install", jobs);
        Map<String, CompletableFuture<Outcome>> futures = new LinkedHashMap<>();
        try {
            for (Spec node : order.values()) {
                List<CompletableFuture<Outcome>> deps = new ArrayList<>();
                for (Spec dep : node.dependencies().values()) {
                    deps.add(futures.get(dep.dagHash()));
                }
                CompletableFuture<Outcome> future = CompletableFuture
                    .allOf(deps.toArray(CompletableFuture[]::new))
                    .thenApplyAsync(ignored -> {
                        for (CompletableFuture<Outcome> dep : deps) {
                            if (!dep.join().succeeded()) {
                                log.warn("Skipping {}/{}: dependency {} was not installed",
                                    node.format(), node.shortHash(), dep.join().spec().name());
                                return new Outcome(node, Status.SKIPPED, null);
                            }
                        }
                        return build(node);
                    }, executor);
                futures.put(node.dagHash(), future);
            }
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new)).join();
        } finally {
            executor.shutdown();
        }

        List<Spec> installed = new ArrayList<>();
        List<Spec> upToDate = new ArrayList<>();
        List<BuildFailureException> failures = new ArrayList<>();
        List<Spec> skipped = new ArrayList<>();
        for (CompletableFuture<Outcome> future : futures.values()) {
            Outcome outcome = future.join();
            switch (outcome.status()) {
                case INSTALLED -> installed.add(outcome.spec());
                case UP_TO_DATE -> upToDate.add(outcome.spec());
                case FAILED -> failures.add(outcome.failure());
                case SKIPPED -> skipped.add(outcome.spec());
            }
        }
        return new InstallReport(installed, upToDate, failures, skipped);
    }

    private Outcome build(Spec node) {
        try (InstallClaimTable.Claim claim = claims.claim(node.dagHash())) {
            if (collaborator.isInstalled(node)) {
                log.debug("{}/{} is already installed", node.format(), node.shortHash());
                return new Outcome(node, Status.UP_TO_DATE, null);
            }
            log.info("Installing {}/{}", node.format(), claim.hash().substring(0, 7));
            collaborator.install(node);
            return new Outcome(node, Status.INSTALLED, null);
        } catch (Exception ex) {
            BuildFailureException failure = new BuildFailureException(node, ex);
            log.error(failure.getMessage());
            return new Outcome(node, Status.FAILED, failure);
        }
    }

    private enum Status {
        INSTALLED,
        UP_TO_DATE,
        FAILED,
        SKIPPED
    }

    private record Outcome(Spec spec, Status status, BuildFailureException failure) {
        boolean succeeded() {
            return status == Status.INSTALLED || status == Status.UP_TO_DATE;
        }
    }
}
