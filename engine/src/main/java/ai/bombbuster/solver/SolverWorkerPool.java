package ai.bombbuster.solver;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker threads for signature generation and call simulation.
 * <p>
 * Owned by whoever creates it (usually the engine factory) and closed with its owner; there is no
 * process-wide pool. Tasks only receive immutable snapshots or private clones.
 */
public class SolverWorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SolverWorkerPool.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final ExecutorService executor;
    private final int threads;

    /**
     * @param threads worker count; {@code 0} uses the number of available processors
     */
    public SolverWorkerPool(int threads) {
        if (threads < 0) {
            throw new IllegalArgumentException("Thread count must not be negative, got " + threads);
        }
        this.threads = threads == 0 ? Runtime.getRuntime().availableProcessors() : threads;
        this.executor = Executors.newFixedThreadPool(this.threads, new WorkerThreadFactory());
        log.debug("Started solver worker pool with {} threads", this.threads);
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    public int getThreads() {
        return threads;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Solver workers did not finish within {} seconds; forcing shutdown", SHUTDOWN_GRACE_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "solver-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
