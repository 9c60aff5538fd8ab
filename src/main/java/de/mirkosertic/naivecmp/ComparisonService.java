package de.mirkosertic.naivecmp;

import de.mirkosertic.naivecmp.config.ApplicationConfig;
import de.mirkosertic.naivecmp.diff.DiffTree;
import de.mirkosertic.naivecmp.diff.TreeMatcher;
import de.mirkosertic.naivecmp.scan.DirectoryIndex;
import de.mirkosertic.naivecmp.scan.DirectoryScanner;
import de.mirkosertic.naivecmp.scan.ScanSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Orchestrates one comparison run: scans both roots concurrently, then computes both diff
 * directions concurrently.
 * <p>
 * Configuration problems are reported before any scanning starts. The first filesystem
 * error in either scan cancels the other one and is thrown to the caller; no partial
 * result is ever returned.
 */
public class ComparisonService {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonService.class);

    private final ApplicationConfig config;
    private final TreeMatcher matcher;
    private final LongSupplier seedSource;
    private final Function<ScanSettings, DirectoryScanner> scannerFactory;

    public ComparisonService(final ApplicationConfig config) {
        this(config, new TreeMatcher(), new SecureRandom()::nextLong);
    }

    ComparisonService(final ApplicationConfig config, final TreeMatcher matcher, final LongSupplier seedSource) {
        this(config, matcher, seedSource, DirectoryScanner::new);
    }

    ComparisonService(final ApplicationConfig config,
                      final TreeMatcher matcher,
                      final LongSupplier seedSource,
                      final Function<ScanSettings, DirectoryScanner> scannerFactory) {
        this.config = config;
        this.matcher = matcher;
        this.seedSource = seedSource;
        this.scannerFactory = scannerFactory;
    }

    /**
     * Compare the two roots named in the configuration.
     */
    public ComparisonResult compare() throws FilesystemAccessException, InterruptedException {
        final String directoryA = config.getDirectoryA();
        final String directoryB = config.getDirectoryB();
        if (directoryA == null || directoryB == null) {
            throw new ConfigurationException("Two directories are required");
        }
        return compare(Paths.get(directoryA), Paths.get(directoryB));
    }

    public ComparisonResult compare(final Path rootA, final Path rootB) throws FilesystemAccessException, InterruptedException {
        // Fail fast on configuration before any thread is started
        final ScanSettings settings = config.toScanSettings(seedSource.getAsLong());
        final Path a = DirectoryScanner.validateRoot(rootA);
        final Path b = DirectoryScanner.validateRoot(rootB);

        logger.debug("Comparing {} and {} with attributes {}, {} workers per directory",
                a, b, settings.attributes().describe(), settings.workerCount());

        final long startTime = System.currentTimeMillis();
        final DirectoryScanner scanner = scannerFactory.apply(settings);
        final ExecutorService executor = Executors.newFixedThreadPool(2, newThreadFactory());
        try {
            logger.info("Mapping directories...");
            final CompletionService<DirectoryIndex> scans = new ExecutorCompletionService<>(executor);
            final Future<DirectoryIndex> scanA = scans.submit(() -> scan(scanner, a, "a"));
            final Future<DirectoryIndex> scanB = scans.submit(() -> scan(scanner, b, "b"));
            awaitBoth(scans, scanA, scanB);
            final DirectoryIndex indexA = scanA.get();
            final DirectoryIndex indexB = scanB.get();

            logger.info("Comparing...");
            final CompletionService<DiffTree> diffs = new ExecutorCompletionService<>(executor);
            final Future<DiffTree> diffA = diffs.submit(() -> matcher.diff(indexA, indexB));
            final Future<DiffTree> diffB = diffs.submit(() -> matcher.diff(indexB, indexA));
            awaitBoth(diffs, diffA, diffB);
            final DiffTree onlyInA = diffA.get();
            final DiffTree onlyInB = diffB.get();
            logger.info("Done");

            final ComparisonStatistics statistics = new ComparisonStatistics(
                    indexA.statistics(), indexB.statistics(),
                    onlyInA.statistics(), onlyInB.statistics(),
                    settings.attributes().describe(),
                    startTime, System.currentTimeMillis());
            return new ComparisonResult(indexA, indexB, onlyInA, onlyInB, statistics);
        } catch (final ExecutionException e) {
            // awaitBoth has already unwrapped every failure
            throw new IllegalStateException("Unexpected failure after completion", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static DirectoryIndex scan(final DirectoryScanner scanner, final Path root, final String label)
            throws FilesystemAccessException, InterruptedException {
        final DirectoryIndex index = scanner.scan(root, label);
        logger.info("Finished {} ({} directories, {} files in {}ms)", root,
                index.directoryCount(), index.leafCount(), index.statistics().elapsedTimeMs());
        return index;
    }

    /**
     * Wait until both tasks are done. The first failure cancels the other task and is rethrown.
     */
    private static <T> void awaitBoth(final CompletionService<T> completion, final Future<T> first, final Future<T> second)
            throws FilesystemAccessException, InterruptedException {
        try {
            for (int i = 0; i < 2; i++) {
                unwrap(completion.take());
            }
        } catch (final FilesystemAccessException | RuntimeException | Error | InterruptedException e) {
            first.cancel(true);
            second.cancel(true);
            throw e;
        }
    }

    private static <T> T unwrap(final Future<T> future) throws FilesystemAccessException, InterruptedException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof FilesystemAccessException) {
                throw (FilesystemAccessException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Comparison task failed", cause);
        }
    }

    private static ThreadFactory newThreadFactory() {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        return r -> {
            final Thread thread = new Thread(r, "compare-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
