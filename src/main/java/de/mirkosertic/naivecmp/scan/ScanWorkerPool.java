package de.mirkosertic.naivecmp.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size thread pool running the worker loops of one scan.
 */
class ScanWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(ScanWorkerPool.class);

    private final String label;
    private final ThreadPoolExecutor executor;

    ScanWorkerPool(final String label, final int workerCount) {
        this.label = label;
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "scan-" + label + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory
        );

        logger.debug("Scan worker pool '{}' initialized with {} threads", label, workerCount);
    }

    void execute(final Runnable task) {
        executor.execute(task);
    }

    /**
     * Stop the pool. The worker loops exit on their own once the scan is finished or
     * cancelled; stragglers are interrupted.
     */
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Scan worker pool '{}' did not terminate in time, forcing shutdown", label);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.warn("Interrupted while waiting for scan worker pool '{}' to terminate", label);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
