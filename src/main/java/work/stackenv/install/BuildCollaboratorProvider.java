package work.stackenv.install;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import work.stackenv.api.StackenvConfiguration;

/**
 * Service-loader entry point for build collaborators. Implementations are listed in
 * {@code META-INF/services/work.stackenv.install.BuildCollaboratorProvider}.
 */
public interface BuildCollaboratorProvider {
    String name();

    BuildCollaborator create(StackenvConfiguration configuration);

    static List<BuildCollaboratorProvider> available() {
        List<BuildCollaboratorProvider> providers = new ArrayList<>();
        ServiceLoader.load(BuildCollaboratorProvider.class).forEach(providers::add);
        return providers;
    }
}
