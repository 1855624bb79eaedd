package work.stackenv.install;

import java.io.IOException;
import java.nio.file.Path;
import work.stackenv.spec.Spec;

/**
 * Prepares the source tree of one concrete node and returns where it lives.
 */
public interface StageCollaborator {
    Path stage(Spec spec) throws IOException;
}
