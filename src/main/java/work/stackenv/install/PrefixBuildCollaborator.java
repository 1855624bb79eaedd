package work.stackenv.install;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import work.stackenv.api.StackenvConfiguration;
import work.stackenv.spec.Spec;
import work.stackenv.spec.SpecNodes;

/**
 * Records an install prefix per node without building anything. The prefix layout is
 * {@code <opt>/<arch>/<compiler>-<version>/<name>-<version>-<hash>}; a node counts as installed once its
 * {@code .stackenv/spec.json} marker exists.
 */
public final class PrefixBuildCollaborator implements BuildCollaborator {
    public static final String MARKER_DIRECTORY = ".stackenv";
    public static final String MARKER_FILE = "spec.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final Path installRoot;

    public PrefixBuildCollaborator(Path installRoot) {
        this.installRoot = installRoot;
    }

    public Path prefix(Spec spec) {
        return installRoot
            .resolve(spec.architecture().toString())
            .resolve(spec.compiler().name() + "-" + spec.compiler().version())
            .resolve(spec.name() + "-" + spec.version() + "-" + spec.dagHash());
    }

    @Override
    public void install(Spec spec) throws IOException {
        Path marker = prefix(spec).resolve(MARKER_DIRECTORY).resolve(MARKER_FILE);
        Files.createDirectories(marker.getParent());
        MAPPER.writeValue(marker.toFile(), SpecNodes.toNode(spec));
    }

    @Override
    public boolean isInstalled(Spec spec) {
        return Files.isRegularFile(prefix(spec).resolve(MARKER_DIRECTORY).resolve(MARKER_FILE));
    }

    @Override
    public void uninstall(Spec spec) throws IOException {
        Path prefix = prefix(spec);
        if (!Files.exists(prefix)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(prefix)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.delete(path);
        }
    }

    /**
     * Registers this collaborator under the name {@code prefix}.
     */
    public static final class Provider implements BuildCollaboratorProvider {
        public static final String NAME = "prefix";

        @Override
        public String name() {
            return NAME;
        }

        @Override
        public BuildCollaborator create(StackenvConfiguration configuration) {
            return new PrefixBuildCollaborator(configuration.installDirectory());
        }
    }
}
