package work.stackenv.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.stackenv.support.StackenvTestSupport;

class ConfigScopeStackTest {
    private static InlineConfigScope inline(String name, String yaml) {
        return InlineConfigScope.fromDocument(name, YamlDocument.parse(yaml, name + ".yaml"), Set.of());
    }

    @Test
    void higherScopesWinKeyByKey() {
        var stack = new ConfigScopeStack()
            .push(inline("low", "packages:\n  libelf:\n    version: [0.8.11]\n    compiler: [gcc]\n"))
            .push(inline("high", "packages:\n  libelf:\n    version: [0.8.12]\n"));

        var libelf = (Map<?, ?>) stack.section(ConfigSchema.PACKAGES).get("libelf");
        assertEquals(List.of("0.8.12"), libelf.get("version"));
        assertEquals(List.of("gcc"), libelf.get("compiler"));
    }

    @Test
    void pushBelowKeepsTheUpperScopeOnTop() {
        var stack = new ConfigScopeStack()
            .push(inline("low", "packages:\n  libelf:\n    version: [0.8.10]\n"))
            .push(inline("top", "packages:\n  libelf:\n    version: [0.8.12]\n"));
        var generation = stack.generation();

        stack.pushBelow("top", inline("middle", "packages:\n  libelf:\n    version: [0.8.11]\n    compiler: [clang]\n"));

        assertEquals(List.of("low", "middle", "top"), stack.scopes().stream().map(ConfigScope::name).toList());
        var libelf = (Map<?, ?>) stack.section(ConfigSchema.PACKAGES).get("libelf");
        assertEquals(List.of("0.8.12"), libelf.get("version"));
        assertEquals(List.of("clang"), libelf.get("compiler"));
        assertTrue(stack.generation() > generation);
        assertThrows(IllegalArgumentException.class, () -> stack.pushBelow("missing", inline("x", "packages: {}\n")));
        assertThrows(IllegalArgumentException.class, () -> stack.pushBelow("top", inline("low", "packages: {}\n")));
    }

    @Test
    void defaultsShipCompilerOrderAndProviders() {
        var prefs = new PackagePreferences(ConfigScopeStack.withDefaults());
        assertEquals(List.of("mpich", "openmpi"), prefs.providers("mpi"));
        assertEquals("gcc", prefs.forPackage("all").compilers().get(0).name());
        assertTrue(prefs.compilers().isEmpty());
    }

    @Test
    void mutationsBumpGenerationAndNotifyListeners() {
        var stack = ConfigScopeStack.withDefaults();
        var notified = new AtomicInteger();
        stack.addInvalidationListener(notified::incrementAndGet);
        long before = stack.generation();

        stack.push(inline("extra", "config:\n  build_jobs: 8\n"));
        assertEquals(before + 1, stack.generation());
        assertEquals(8L, stack.section(ConfigSchema.CONFIG).get("build_jobs"));

        assertTrue(stack.remove("extra"));
        assertFalse(stack.remove("extra"));
        assertEquals(2, notified.get());
        assertEquals(4L, stack.section(ConfigSchema.CONFIG).get("build_jobs"));
    }

    @Test
    void copiesAreIndependent() {
        var stack = ConfigScopeStack.withDefaults();
        var copy = stack.copy();
        copy.push(inline("extra", "config:\n  build_jobs: 8\n"));
        assertEquals(1, stack.scopes().size());
        assertEquals(2, copy.scopes().size());
    }

    @Test
    void rejectsDuplicateScopeNames() {
        var stack = ConfigScopeStack.withDefaults();
        assertThrows(IllegalArgumentException.class, () -> stack.push(inline("defaults", "config: {}\n")));
    }

    @Test
    void readsDirectoryScopesOneFilePerSection() {
        var stack = StackenvTestSupport.mockConfig();
        var prefs = new PackagePreferences(stack);
        assertEquals(2, prefs.compilers().size());
        assertEquals("test-debian6-x86_64", prefs.defaultArchitecture().orElseThrow().toString());
        assertEquals(2, prefs.concretizeJobs());
    }

    @Test
    void reloadPicksUpEditedFiles() throws Exception {
        var dir = Files.createTempDirectory("stackenv-config");
        try {
            var file = dir.resolve("packages.yaml");
            Files.writeString(file, "packages:\n  libelf:\n    version: [0.8.11]\n");
            var stack = new ConfigScopeStack().push(new PathConfigScope("user", file));
            var prefs = new PackagePreferences(stack);
            assertEquals("0.8.11", prefs.forPackage("libelf").versions().get(0).toString());

            Files.writeString(file, "packages:\n  libelf:\n    version: [0.8.12]\n");
            assertEquals("0.8.11", prefs.forPackage("libelf").versions().get(0).toString());
            stack.reload();
            assertEquals("0.8.12", prefs.forPackage("libelf").versions().get(0).toString());
        } finally {
            StackenvTestSupport.deleteRecursively(dir);
        }
    }

    @Test
    void missingPathScopeContributesNothing() {
        var stack = new ConfigScopeStack().push(new PathConfigScope("user", Path.of("does-not-exist")));
        assertTrue(stack.merge().isEmpty());
    }
}
