package work.stackenv.shared;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pools with a bounded queue. When the queue is full the submitting thread runs the task itself.
 */
public final class WorkerPools {
    private WorkerPools() {}

    /**
     * A pool of {@code workers} daemon threads named {@code stackenv-<purpose>-<n>}, queueing at most twice that many
     * tasks.
     */
    public static ExecutorService bounded(String purpose, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("A " + purpose + " pool needs at least one worker, got " + workers);
        }
        return new ThreadPoolExecutor(
            workers,
            workers,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(2 * workers),
            threads(purpose),
            new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static ThreadFactory threads(String purpose) {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, "stackenv-" + purpose + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
