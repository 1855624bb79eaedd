package work.stackenv.env;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.stackenv.config.ConfigFormatException;
import work.stackenv.config.ConfigSchema;
import work.stackenv.config.InlineConfigScope;
import work.stackenv.config.YamlDocument;
import work.stackenv.spec.Spec;
import work.stackenv.spec.SpecParseException;

/**
 * Contents of an environment's {@code stackenv.yaml}:
 *
 * <pre>
 * env:
 *   specs: [mpileaks, "hypre@2.10"]
 *   include: [../shared/packages.yaml]
 *   packages:
 *     libelf:
 *       version: [0.8.12]
 * </pre>
 *
 * Besides {@code specs} and {@code include}, the {@code env} block may hold any configuration section; those form
 * the environment's own, highest-precedence configuration scope.
 */
public final class Manifest {
    public static final String ENV = "env";
    public static final String SPECS = "specs";
    public static final String INCLUDE = "include";
    static final Set<String> ENV_KEYS = Set.of(SPECS, INCLUDE);

    private static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
    );

    private final YamlDocument document;
    private final List<String> specs;
    private final List<String> includes;
    private final Map<String, Object> sections;

    private Manifest(YamlDocument document, List<String> specs, List<String> includes, Map<String, Object> sections) {
        this.document = document;
        this.specs = List.copyOf(specs);
        this.includes = List.copyOf(includes);
        this.sections = sections;
    }

    public static Manifest empty() {
        return parse("env:\n  specs: []\n", "./" + Environment.MANIFEST_NAME);
    }

    public static Manifest read(Path file) {
        return from(YamlDocument.read(file, file.toString()));
    }

    /**
     * @param display name used in error messages
     */
    public static Manifest parse(String text, String display) {
        return from(YamlDocument.parse(text, display));
    }

    private static Manifest from(YamlDocument doc) {
        ConfigSchema.requireKeys(doc, doc.root(), Set.of(ENV));
        Object rawEnv = doc.root().get(ENV);
        Map<String, Object> env = rawEnv == null ? Map.of() : ConfigSchema.requireMap(doc, rawEnv, ENV);
        ConfigSchema.validateSections(doc, env, ENV_KEYS, ENV);

        List<String> specs = env.get(SPECS) == null
            ? List.of()
            : ConfigSchema.requireScalarList(doc, env.get(SPECS), ENV, SPECS);
        for (String spec : specs) {
            try {
                Spec.parse(spec);
            } catch (SpecParseException ex) {
                throw new ConfigFormatException(doc.source(), doc.lineOf(ENV, SPECS), ex.getMessage(), ex);
            }
        }
        List<String> includes = env.get(INCLUDE) == null
            ? List.of()
            : ConfigSchema.requireScalarList(doc, env.get(INCLUDE), ENV, INCLUDE);

        Map<String, Object> sections = new LinkedHashMap<>();
        env.forEach((key, value) -> {
            if (!ENV_KEYS.contains(key) && value != null) {
                sections.put(key, value);
            }
        });
        return new Manifest(doc, specs, includes, sections);
    }

    public String source() {
        return document.source();
    }

    public List<String> specs() {
        return specs;
    }

    public List<String> includes() {
        return includes;
    }

    /**
     * The environment's own configuration scope, built from the sections inside {@code env}.
     */
    public InlineConfigScope scope(String scopeName) {
        return InlineConfigScope.fromDocument(scopeName, document, ENV_KEYS, ENV);
    }

    public Manifest withSpecs(List<String> newSpecs) {
        return new Manifest(document, newSpecs, includes, sections);
    }

    public String toYaml() {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put(SPECS, new ArrayList<>(specs));
        if (!includes.isEmpty()) {
            env.put(INCLUDE, new ArrayList<>(includes));
        }
        env.putAll(sections);
        try {
            return YAML.writeValueAsString(Map.of(ENV, env));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render manifest " + document.source(), ex);
        }
    }
}
