package work.stackenv.install;

import java.io.IOException;
import work.stackenv.spec.Spec;

/**
 * Builds and installs one concrete node. Called once per hash, after all of the node's dependencies are installed.
 */
public interface BuildCollaborator {
    void install(Spec spec) throws IOException;

    boolean isInstalled(Spec spec);

    void uninstall(Spec spec) throws IOException;
}
