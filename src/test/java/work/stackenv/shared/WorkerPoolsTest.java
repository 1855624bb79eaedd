package work.stackenv.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class WorkerPoolsTest {
    @Test
    void overflowRunsOnTheSubmittingThread() throws Exception {
        var pool = WorkerPools.bounded("test", 1);
        var release = new CountDownLatch(1);
        var threads = ConcurrentHashMap.<String>newKeySet();
        try {
            List<Future<?>> tasks = new ArrayList<>();
            var started = new CountDownLatch(1);
            tasks.add(pool.submit(() -> {
                started.countDown();
                threads.add(Thread.currentThread().getName());
                release.await();
                return null;
            }));
            assertTrue(started.await(10, TimeUnit.SECONDS));
            for (int i = 0; i < 2; i++) {
                tasks.add(pool.submit(() -> threads.add(Thread.currentThread().getName())));
            }
            // worker busy, queue of two full: this one runs right here
            pool.submit(() -> threads.add(Thread.currentThread().getName()));
            assertTrue(threads.contains(Thread.currentThread().getName()), threads.toString());

            release.countDown();
            for (Future<?> task : tasks) {
                task.get(10, TimeUnit.SECONDS);
            }
            assertTrue(threads.contains("stackenv-test-1"), threads.toString());
            assertEquals(Set.of("stackenv-test-1", Thread.currentThread().getName()), Set.copyOf(threads));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void poolsAreFixedSize() {
        var pool = (ThreadPoolExecutor) WorkerPools.bounded("fixed", 3);
        try {
            assertEquals(3, pool.getCorePoolSize());
            assertEquals(3, pool.getMaximumPoolSize());
            assertEquals(6, pool.getQueue().remainingCapacity());
        } finally {
            pool.shutdownNow();
        }
        assertThrows(IllegalArgumentException.class, () -> WorkerPools.bounded("empty", 0));
    }
}
