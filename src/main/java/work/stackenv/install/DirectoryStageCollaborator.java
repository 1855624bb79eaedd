package work.stackenv.install;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import work.stackenv.spec.Spec;

/**
 * Creates an empty stage directory {@code <stage>/<name>-<version>-<hash>} per node; fetching sources is left to
 * the build collaborator.
 */
public final class DirectoryStageCollaborator implements StageCollaborator {
    private final Path stageRoot;

    public DirectoryStageCollaborator(Path stageRoot) {
        this.stageRoot = stageRoot;
    }

    @Override
    public Path stage(Spec spec) throws IOException {
        Path directory = stageRoot.resolve(spec.name() + "-" + spec.version() + "-" + spec.dagHash());
        return Files.createDirectories(directory);
    }
}
