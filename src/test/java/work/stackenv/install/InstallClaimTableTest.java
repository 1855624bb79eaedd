package work.stackenv.install;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.stackenv.support.StackenvTestSupport;

class InstallClaimTableTest {
    @Test
    void claimsOnTheSameHashAreExclusive() throws Exception {
        var locks = Files.createTempDirectory("stackenv-locks");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            var active = new AtomicInteger();
            var maxActive = new AtomicInteger();
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                var table = new InstallClaimTable(locks);
                futures.add(CompletableFuture.runAsync(() -> {
                    try (var claim = table.claim("abc123")) {
                        int now = active.incrementAndGet();
                        maxActive.accumulateAndGet(now, Math::max);
                        Thread.sleep(5);
                        active.decrementAndGet();
                    } catch (Exception ex) {
                        throw new IllegalStateException(ex);
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

            assertEquals(1, maxActive.get());
            assertTrue(Files.exists(locks.resolve("abc123.lock")));
        } finally {
            executor.shutdownNow();
            StackenvTestSupport.deleteRecursively(locks);
        }
    }

    @Test
    void differentHashesDoNotBlockEachOther() throws Exception {
        var locks = Files.createTempDirectory("stackenv-locks");
        try {
            var table = new InstallClaimTable(locks.resolve("nested"));
            try (var first = table.claim("aaa"); var second = table.claim("bbb")) {
                assertEquals("aaa", first.hash());
                assertEquals("bbb", second.hash());
            }
            try (var again = table.claim("aaa")) {
                assertEquals("aaa", again.hash());
            }
        } finally {
            StackenvTestSupport.deleteRecursively(locks);
        }
    }
}
