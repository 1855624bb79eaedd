package work.stackenv.env;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.stackenv.config.ConfigFormatException;
import work.stackenv.config.ConfigScope;
import work.stackenv.config.PathConfigScope;
import work.stackenv.install.DirectoryStageCollaborator;
import work.stackenv.install.PrefixBuildCollaborator;
import work.stackenv.repo.PackageNotFoundException;
import work.stackenv.spec.CompilerSpec;
import work.stackenv.spec.Spec;
import work.stackenv.support.StackenvTestSupport;

class EnvironmentTest {
    private Path root;
    private EnvironmentStore store;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("stackenv-env");
        store = StackenvTestSupport.mockStore(root);
    }

    @AfterEach
    void tearDown() throws Exception {
        StackenvTestSupport.deleteRecursively(root);
    }

    private static Spec node(Environment env, String name) {
        return env.closure().stream()
            .filter(spec -> spec.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError(name + " is not in " + env.closure()));
    }

    private PrefixBuildCollaborator builds() {
        return new PrefixBuildCollaborator(root.resolve("opt"));
    }

    @Test
    void concretizeIsIdempotent() {
        var env = store.create("test", null);
        env.add("mpileaks");
        env.add("python");
        var first = env.concretize();
        var firstClosure = Set.copyOf(env.specsByHash().keySet());
        var second = env.concretize();

        assertEquals(first, second);
        assertEquals(firstClosure, env.specsByHash().keySet());
        assertTrue(env.isConcretized());
    }

    @Test
    void closureIsCompleteAndLockfileRoundTrips() {
        var env = store.create("test", null);
        env.add("mpileaks");
        env.add("hypre@2.10.0");
        env.concretize();
        env.write();

        for (Spec root : env.environmentSpecs()) {
            for (Spec dep : root.traverse()) {
                assertTrue(env.specsByHash().containsKey(dep.dagHash()), dep.format());
            }
        }
        var reread = Lockfile.fromJson(env.toLockfile().toJson(), "memory");
        assertEquals(env.specsByHash(), reread.specsByHash());

        var reopened = store.read("test");
        assertTrue(reopened.isConcretized());
        assertEquals(env.concretizedOrder(), reopened.concretizedOrder());
        assertEquals(env.specsByHash().keySet(), reopened.specsByHash().keySet());
        assertEquals(env.userSpecs(), reopened.userSpecs());
        assertTrue(Files.isRegularFile(reopened.path().resolve(Environment.LOCKFILE_NAME)));
    }

    @Test
    void inlineConfigurationBeatsIncludedConfiguration() throws Exception {
        var included = Files.writeString(root.resolve("shared.yaml"), "packages:\n  libelf:\n    version: [0.8.11]\n");
        var env = store.create("test", """
            env:
              include:
                - %s
              packages:
                libelf:
                  version: [0.8.12]
              specs:
                - mpileaks
            """.formatted(included));
        env.concretize();
        assertEquals("0.8.12", node(env, "libelf").version().toString());
    }

    @Test
    void pushedScopesStayBelowTheManifestSettings() throws Exception {
        var env = store.create("test", "env:\n  packages:\n    libelf:\n      version: [0.8.12]\n  specs: [libdwarf]\n");
        var extra = Files.writeString(
            root.resolve("extra.yaml"),
            "packages:\n  libelf:\n    version: [0.8.10]\n  libdwarf:\n    version: [20111030]\n"
        );
        env.concretize();
        assertEquals("20130729", node(env, "libdwarf").version().toString());

        env.pushConfigScope(new PathConfigScope("extra", extra));
        env.resetOsAndCompiler(null);

        assertEquals("0.8.12", node(env, "libelf").version().toString());
        assertEquals("20111030", node(env, "libdwarf").version().toString());
        var names = env.config().scopes().stream().map(ConfigScope::name).toList();
        assertEquals("env:test", names.get(names.size() - 1));
        assertEquals("extra", names.get(names.size() - 2));
    }

    @Test
    void includedDirectoryScopesApply() throws Exception {
        var shared = Files.createDirectories(root.resolve("shared"));
        Files.writeString(shared.resolve("packages.yaml"), "packages:\n  libelf:\n    version: [0.8.11]\n");
        var env = store.create("test", "env:\n  include: [" + shared + "]\n  specs: [libdwarf]\n");
        env.concretize();
        assertEquals("0.8.11", node(env, "libelf").version().toString());
    }

    @Test
    void relativeIncludesResolveAgainstTheEnvironmentDirectory() throws Exception {
        var env = store.create("test", "env:\n  include: [./site.yaml]\n  specs: [libelf]\n");
        Files.writeString(env.path().resolve("site.yaml"), "packages:\n  libelf:\n    version: [0.8.10]\n");
        var reopened = store.read("test");
        reopened.concretize();
        assertEquals("0.8.10", node(reopened, "libelf").version().toString());
    }

    @Test
    void malformedManifestReportsFileAndLine() {
        var error = assertThrows(
            ConfigFormatException.class,
            () -> store.create("bad", "env:\n  spacks:\n    - mpileaks\n")
        );
        assertTrue(error.getMessage().startsWith("./stackenv.yaml:2"), error.getMessage());
        assertTrue(error.getMessage().contains("'spacks' was unexpected"), error.getMessage());
        assertFalse(store.exists("bad"));
    }

    @Test
    void removalIsPurgedOnTheNextConcretization() {
        var env = store.create("test", null);
        env.add("mpileaks");
        env.add("hypre");
        env.add("python");
        env.concretize();
        var hypreHash = env.concretizedOrder().get(1);

        var removed = env.remove("hypre");
        assertEquals("hypre", removed.name());
        assertEquals(List.of("mpileaks", "python"), env.userSpecs().stream().map(Spec::name).toList());
        assertTrue(env.specsByHash().containsKey(hypreHash));
        assertFalse(env.closure().stream().anyMatch(spec -> spec.name().equals("hypre")));

        env.concretize();
        assertFalse(env.specsByHash().containsKey(hypreHash));
        assertEquals(2, env.environmentSpecs().size());
    }

    @Test
    void addAndRemoveRejectMisuse() {
        var env = store.create("test", null);
        env.add("mpileaks");
        assertThrows(EnvironmentException.class, () -> env.add("mpileaks@2.2"));
        assertThrows(PackageNotFoundException.class, () -> env.add("nosuchpkg"));
        assertThrows(EnvironmentException.class, () -> env.remove("libelf"));
        assertThrows(EnvironmentException.class, () -> env.add("+debug"));
        assertEquals("mpi", env.add("mpi").name());
    }

    @Test
    void upgradeOnlyMovesTheNamedPackageAndItsDependents() {
        var env = store.create("test", null);
        env.add("mpileaks ^callpath@0.9");
        env.concretize();
        var dyninst = node(env, "dyninst");
        var libelf = node(env, "libelf");
        var mpich = node(env, "mpich");
        var mpileaks = env.environmentSpecs().get(0);
        assertEquals("0.9", node(env, "callpath").version().toString());

        env.upgradeDependency("callpath");

        assertEquals("1.0", node(env, "callpath").version().toString());
        assertEquals(dyninst, node(env, "dyninst"));
        assertEquals(libelf, node(env, "libelf"));
        assertEquals(mpich, node(env, "mpich"));
        assertNotEquals(mpileaks.dagHash(), env.environmentSpecs().get(0).dagHash());
        assertEquals(mpileaks.version(), env.environmentSpecs().get(0).version());
        assertThrows(EnvironmentException.class, () -> env.upgradeDependency("cmake"));
    }

    @Test
    void upgradeSurvivesWriteReadAndConcretize() {
        var env = store.create("test", null);
        env.add("mpileaks ^callpath@0.9");
        env.concretize();
        env.upgradeDependency("callpath");
        assertEquals("1.0", node(env, "callpath").version().toString());
        assertEquals(List.of(Spec.parse("mpileaks ^callpath@1.0")), env.userSpecs());
        assertTrue(env.isConcretized());
        env.write();

        var reread = store.read("test");
        assertEquals(List.of(Spec.parse("mpileaks ^callpath@1.0")), reread.userSpecs());
        var roots = List.copyOf(env.concretizedOrder());
        reread.concretize();

        assertEquals("1.0", node(reread, "callpath").version().toString());
        assertEquals(roots, reread.concretizedOrder());
    }

    @Test
    void upgradeLeavesCompatibleConstraintsAlone() {
        var env = store.create("test", null);
        env.add("mpileaks ^callpath@0.9:");
        env.concretize();
        env.upgradeDependency("callpath");
        assertEquals(List.of(Spec.parse("mpileaks ^callpath@0.9:")), env.userSpecs());
    }

    @Test
    void resettingTheCompilerRebuildsEveryNode() {
        var env = store.create("test", null);
        env.add("mpileaks");
        env.concretize();
        assertTrue(env.closure().stream().allMatch(spec -> spec.compiler().name().equals("gcc")));

        env.resetOsAndCompiler(CompilerSpec.parse("clang"));
        assertTrue(env.closure().stream().allMatch(spec -> spec.compiler().toString().equals("clang@3.3")));
    }

    @Test
    void environmentRepositoryShadowsTheSharedOne() throws Exception {
        store.create("dev", "env:\n  specs: [libdwarf]\n");
        var recipe = Files.createDirectories(store.pathOf("dev").resolve("repo").resolve("packages").resolve("libelf"));
        Files.writeString(recipe.resolve("package.toml"), "name = \"libelf\"\nversions = [\"0.9.0\"]\n");

        var env = store.read("dev");
        env.concretize();
        var libelf = node(env, "libelf");
        assertEquals("env.dev", libelf.namespace());
        assertEquals("0.9.0", libelf.version().toString());
        assertEquals("builtin.mock", node(env, "libdwarf").namespace());
    }

    @Test
    void statusShowsInstallStateOfEveryRoot() {
        var env = store.create("test", null);
        env.add("libdwarf");
        env.concretize();
        env.add("python");

        var before = new StringWriter();
        env.status(new PrintWriter(before, true), builds());
        assertTrue(before.toString().contains("==> Environment test"), before.toString());
        assertTrue(before.toString().contains(" [-] libdwarf"), before.toString());
        assertTrue(before.toString().contains("python (not concretized)"), before.toString());

        var report = env.install(builds());
        assertTrue(report.success());
        var after = new StringWriter();
        env.status(new PrintWriter(after, true), builds());
        assertTrue(after.toString().contains(" [+] libdwarf"), after.toString());
        assertTrue(after.toString().contains(" [+] python"), after.toString());
        assertTrue(after.toString().contains(node(env, "libelf").shortHash()), after.toString());
    }

    @Test
    void installLoadsStageAndUninstall() throws Exception {
        var env = store.create("test", "env:\n  specs: [mpileaks, hypre]\n");
        var builds = builds();

        var report = env.install(builds);
        assertTrue(report.success());
        assertEquals(env.closure().size(), report.installed().size());
        assertTrue(env.closure().stream().allMatch(builds::isInstalled));
        assertTrue(env.install(builds).installed().isEmpty());

        var loads = Files.readAllLines(env.writeLoads(builds));
        var libelf = node(env, "libelf");
        assertEquals(env.closure().size(), loads.size());
        assertTrue(loads.contains("module load libelf-0.8.13-gcc-4.5.0-" + libelf.shortHash()), loads.toString());
        assertTrue(loads.indexOf("module load " + Environment.moduleName(libelf))
            < loads.indexOf("module load " + Environment.moduleName(node(env, "mpileaks"))));

        var staged = env.stage(new DirectoryStageCollaborator(root.resolve("stage")));
        assertEquals(env.closure().size(), staged.size());
        assertTrue(staged.stream().allMatch(Files::isDirectory));
        var stageNames = staged.stream().map(dir -> dir.getFileName().toString()).collect(Collectors.toSet());
        assertTrue(stageNames.contains("libelf-0.8.13-" + libelf.dagHash()));

        var removed = env.uninstall(builds);
        assertEquals(env.closure().size(), removed.size());
        var removedNames = removed.stream().map(Spec::name).toList();
        assertTrue(removedNames.indexOf("mpileaks") < removedNames.indexOf("libelf"), removedNames.toString());
        assertFalse(env.closure().stream().anyMatch(builds::isInstalled));
    }

    @Test
    void environmentsShareInstalledNodes() {
        var first = store.create("first", "env:\n  specs: [libdwarf]\n");
        var second = store.create("second", "env:\n  specs: [dyninst]\n");
        var builds = builds();

        assertEquals(2, first.install(builds).installed().size());
        var report = second.install(builds);
        assertEquals(List.of("dyninst"), report.installed().stream().map(Spec::name).toList());
        assertEquals(2, report.upToDate().size());
    }
}
