package work.stackenv.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.stackenv.env.Environment;
import work.stackenv.support.StackenvTestSupport;

class MainTest {
    private Path root;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("stackenv-cli");
        StackenvTestSupport.copyTree(StackenvTestSupport.mockRepoPath(), root.resolve("repo"));
        StackenvTestSupport.copyTree(StackenvTestSupport.mockConfigPath(), root.resolve("etc"));
    }

    @AfterEach
    void tearDown() throws Exception {
        StackenvTestSupport.deleteRecursively(root);
    }

    private int run(Map<String, String> environment, String... args) {
        out = new StringWriter();
        err = new StringWriter();
        var commandLine = Main.commandLine(environment);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        String[] withRoot = new String[args.length + 2];
        withRoot[0] = "--root";
        withRoot[1] = root.toString();
        System.arraycopy(args, 0, withRoot, 2, args.length);
        return commandLine.execute(withRoot);
    }

    private int run(String... args) {
        return run(Map.of(), args);
    }

    @Test
    void commandsWithoutAnEnvironmentAreUsageErrors() {
        assertEquals(2, run("env", "concretize"));
        assertTrue(err.toString().contains("`stackenv env concretize` requires an environment"), err.toString());
        assertEquals(2, run("env", "add", "libelf"));
    }

    @Test
    void unknownEnvironmentIsAShortError() {
        assertEquals(1, run("env", "status", "nope"));
        assertTrue(err.toString().contains("==> Error: No such environment: 'nope'"), err.toString());
        assertFalse(err.toString().contains("\tat "), err.toString());
    }

    @Test
    void createAddConcretizeInstallAndInspect() {
        assertEquals(0, run("env", "create", "dev"));
        assertTrue(out.toString().contains("Created environment 'dev'"), out.toString());

        assertEquals(0, run("env", "add", "-e", "dev", "mpileaks", "python@3.11"));
        assertEquals(0, run("env", "concretize", "dev"));
        assertTrue(out.toString().contains("==> Concretized mpileaks"), out.toString());
        assertTrue(out.toString().contains("^libelf@0.8.13%gcc@4.5.0"), out.toString());
        assertTrue(Files.isRegularFile(root.resolve("environments").resolve("dev").resolve(Environment.LOCKFILE_NAME)));

        assertEquals(0, run("env", "install", "--fake", "dev"));
        assertTrue(out.toString().contains("==> Installed libelf@0.8.13"), out.toString());

        assertEquals(0, run("env", "status", "dev"));
        assertTrue(out.toString().contains(" [+] mpileaks"), out.toString());
        assertTrue(out.toString().contains(" [+] python@3.11"), out.toString());

        assertEquals(0, run("env", "loads", "dev"));
        assertTrue(out.toString().contains("module load python-3.11.4-gcc-4.5.0-"), out.toString());

        assertEquals(0, run("env", "list"));
        assertTrue(out.toString().contains("    dev"), out.toString());
    }

    @Test
    void environmentVariableSelectsTheEnvironment() {
        assertEquals(0, run("env", "create", "dev"));
        var selected = Map.of("STACKENV_ENV", "dev");
        assertEquals(0, run(selected, "env", "add", "libdwarf"));
        assertEquals(0, run(selected, "env", "concretize"));
        assertEquals(0, run(selected, "env", "remove", "libdwarf"));
        assertTrue(out.toString().contains("==> Removing libdwarf"), out.toString());
    }

    @Test
    void upgradeAndStage() {
        assertEquals(0, run("env", "create", "dev"));
        assertEquals(0, run("env", "add", "-e", "dev", "mpileaks ^callpath@0.9"));
        assertEquals(0, run("env", "concretize", "dev"));
        assertTrue(out.toString().contains("^callpath@0.9"), out.toString());

        assertEquals(0, run("env", "upgrade", "-e", "dev", "callpath"));
        assertTrue(out.toString().contains("^callpath@1.0"), out.toString());

        assertEquals(0, run("env", "stage", "dev"));
        assertTrue(out.toString().contains("==> Staged " + root.resolve("stage")), out.toString());
    }

    @Test
    void destroyNeedsConfirmation() {
        assertEquals(0, run("env", "create", "dev"));
        assertEquals(2, run("env", "destroy", "dev"));
        assertEquals(0, run("env", "destroy", "-y", "dev"));
        assertFalse(Files.exists(root.resolve("environments").resolve("dev")));
        assertEquals(0, run("env", "list"));
        assertTrue(out.toString().contains("==> No environments"), out.toString());
    }

    @Test
    void malformedManifestIsReportedWithItsLine() throws Exception {
        var manifest = Files.writeString(root.resolve("my-env.yaml"), "env:\n  spacks: [mpileaks]\n");
        assertEquals(1, run("env", "create", "bad", manifest.toString()));
        assertTrue(err.toString().contains(manifest + ":2"), err.toString());
        assertFalse(err.toString().contains("stackenv.yaml"), err.toString());
        assertFalse(Files.exists(root.resolve("environments").resolve("bad")));
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("stackenv "), out.toString());
        assertTrue(out.toString().contains("lockfile format 2"), out.toString());
    }
}
