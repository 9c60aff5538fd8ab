package de.mirkosertic.naivecmp.scan;

import de.mirkosertic.naivecmp.ConfigurationException;
import de.mirkosertic.naivecmp.FilesystemAccessException;
import de.mirkosertic.naivecmp.tree.Entry;
import de.mirkosertic.naivecmp.tree.EntryTreeBuilder;
import de.mirkosertic.naivecmp.tree.RelativePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Walks one root directory with a pool of worker threads and builds its {@link DirectoryIndex}.
 * <p>
 * Workers share a bounded queue of visit tasks. A worker that lists a directory offers
 * each child to the queue; when the queue is full it visits the child itself instead of
 * blocking. A pending-task counter tracks completion: it is incremented when tasks are
 * created and decremented when they finish, and the scan is done when it reaches zero.
 * <p>
 * Tree insertion and fingerprint recording are guarded by two separate locks, neither of
 * which is held during filesystem I/O. The first failure cancels the scan: remaining
 * workers stop visiting and the error is thrown from {@link #scan(Path, String)}.
 */
public class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    private static final long POLL_INTERVAL_MS = 50;

    private final ScanSettings settings;
    private final Fingerprinter fingerprinter;
    private final MetadataReader metadataReader;

    public DirectoryScanner(final ScanSettings settings) {
        this(settings, LeafMetadata::read);
    }

    DirectoryScanner(final ScanSettings settings, final MetadataReader metadataReader) {
        this.settings = settings;
        this.fingerprinter = new Fingerprinter(settings.attributes(), settings.seed());
        this.metadataReader = metadataReader;
    }

    /**
     * Reads the metadata of one leaf, see {@link LeafMetadata#read(Path, String, boolean)}.
     */
    @FunctionalInterface
    interface MetadataReader {
        LeafMetadata read(Path file, String relativePath, boolean withMode) throws IOException;
    }

    public ScanSettings getSettings() {
        return settings;
    }

    public DirectoryIndex scan(final Path root) throws FilesystemAccessException, InterruptedException {
        return scan(root, "worker");
    }

    /**
     * Scan a root directory.
     *
     * @param root  an existing, readable directory
     * @param label used in worker thread names
     * @return the complete, frozen index
     * @throws ConfigurationException     if the root is not a readable directory
     * @throws FilesystemAccessException  on the first listing or metadata read that fails
     * @throws InterruptedException       if the calling thread is interrupted; the scan is cancelled
     */
    public DirectoryIndex scan(final Path root, final String label) throws FilesystemAccessException, InterruptedException {
        final Path normalizedRoot = validateRoot(root);
        final long startTime = System.currentTimeMillis();

        logger.debug("Scanning {} with {} workers, queue capacity {}, attributes {}",
                normalizedRoot, settings.workerCount(), settings.queueCapacity(), settings.attributes().describe());

        final ScanRun run = new ScanRun(normalizedRoot);
        final ScanWorkerPool pool = new ScanWorkerPool(label, settings.workerCount());
        try {
            run.submitRoot();
            for (int i = 0; i < settings.workerCount(); i++) {
                pool.execute(run::drain);
            }
            run.awaitCompletion();
        } catch (final InterruptedException e) {
            run.cancel();
            throw e;
        } finally {
            pool.shutdown();
        }

        run.rethrowFailure();

        final DirectoryIndex index = run.freeze(System.currentTimeMillis() - startTime);
        logger.debug("Scan of {} complete: {} directories, {} leaves, {} buckets in {}ms",
                normalizedRoot, index.directoryCount(), index.leafCount(), index.bucketCount(),
                index.statistics().elapsedTimeMs());
        return index;
    }

    /**
     * Absolute, normalized form of a root that exists and is a readable directory.
     *
     * @throws ConfigurationException otherwise
     */
    public static Path validateRoot(final Path root) {
        if (root == null) {
            throw new ConfigurationException("Root directory must not be null");
        }
        final Path absolute = root.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new ConfigurationException("Root directory does not exist: " + absolute);
        }
        if (!Files.isDirectory(absolute)) {
            throw new ConfigurationException("Root is not a directory: " + absolute);
        }
        if (!Files.isReadable(absolute)) {
            throw new ConfigurationException("Root directory is not readable: " + absolute);
        }
        return absolute;
    }

    /**
     * State of a single scan, shared by its workers.
     */
    private final class ScanRun {

        private final Path root;
        private final BlockingQueue<ScanTask> queue = new ArrayBlockingQueue<>(settings.queueCapacity());
        private final AtomicLong pending = new AtomicLong(0);
        private final CountDownLatch finished = new CountDownLatch(1);
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicReference<Exception> failure = new AtomicReference<>();

        private final Object treeLock = new Object();
        private final EntryTreeBuilder treeBuilder = new EntryTreeBuilder();

        private final Object fingerprintLock = new Object();
        private final Map<Long, List<Entry>> buckets = new HashMap<>();
        private final Map<Entry, Long> fingerprints = new IdentityHashMap<>();

        ScanRun(final Path root) {
            this.root = root;
        }

        void submitRoot() {
            pending.incrementAndGet();
            if (!queue.offer(new ScanTask(RelativePaths.ROOT, root, true))) {
                throw new IllegalStateException("Empty scan queue rejected the root task");
            }
        }

        void awaitCompletion() throws InterruptedException {
            finished.await();
        }

        boolean isFinished() {
            return finished.getCount() == 0;
        }

        /**
         * Worker loop: take tasks until the scan is finished or cancelled.
         */
        void drain() {
            try {
                while (!isFinished()) {
                    final ScanTask task = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                    if (task != null) {
                        execute(task);
                    }
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void execute(final ScanTask task) {
            try {
                if (!cancelled.get()) {
                    if (task.directory()) {
                        visitDirectory(task);
                    } else {
                        visitLeaf(task);
                    }
                }
            } catch (final FilesystemAccessException | RuntimeException e) {
                fail(e);
            } finally {
                completeTask();
            }
        }

        private void visitDirectory(final ScanTask task) throws FilesystemAccessException {
            final List<ScanTask> children = listChildren(task.path(), task.relativePath());

            synchronized (treeLock) {
                treeBuilder.insertDirectory(task.relativePath());
            }

            pending.addAndGet(children.size());
            for (final ScanTask child : children) {
                if (cancelled.get()) {
                    completeTask();
                } else if (!queue.offer(child)) {
                    // Queue is full: visit synchronously instead of blocking
                    execute(child);
                }
            }
        }

        private List<ScanTask> listChildren(final Path directory, final String relativePath) throws FilesystemAccessException {
            final List<ScanTask> children = new ArrayList<>();
            final Set<String> names = new HashSet<>();
            try (final DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (final Path child : stream) {
                    final BasicFileAttributes attributes = readAttributes(child);
                    // Names that are not valid in the platform encoding decode lossily
                    final String name = child.getFileName().toString();
                    if (!names.add(name)) {
                        throw new FilesystemAccessException(child,
                                "File name is not unique after decoding to '" + name + "' in " + directory);
                    }
                    children.add(new ScanTask(RelativePaths.child(relativePath, name), child, attributes.isDirectory()));
                }
            } catch (final DirectoryIteratorException e) {
                throw new FilesystemAccessException(directory, "list directory", e.getCause());
            } catch (final IOException e) {
                if (e instanceof FilesystemAccessException) {
                    throw (FilesystemAccessException) e;
                }
                throw new FilesystemAccessException(directory, "list directory", e);
            }
            return children;
        }

        private BasicFileAttributes readAttributes(final Path child) throws FilesystemAccessException {
            try {
                return Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (final IOException e) {
                throw new FilesystemAccessException(child, "read attributes of", e);
            }
        }

        private void visitLeaf(final ScanTask task) throws FilesystemAccessException {
            final Entry leaf;
            synchronized (treeLock) {
                leaf = treeBuilder.insertLeaf(task.relativePath());
            }

            final Path file = task.path();
            final LeafMetadata metadata;
            try {
                metadata = metadataReader.read(file, task.relativePath(), settings.attributes().mode());
            } catch (final IOException e) {
                throw new FilesystemAccessException(file, "read metadata of", e);
            }
            final long fingerprint = fingerprinter.fingerprint(metadata);

            synchronized (fingerprintLock) {
                buckets.computeIfAbsent(fingerprint, k -> new ArrayList<>()).add(leaf);
                fingerprints.put(leaf, fingerprint);
            }
        }

        private void completeTask() {
            if (pending.decrementAndGet() == 0) {
                finished.countDown();
            }
        }

        private void fail(final Exception e) {
            if (failure.compareAndSet(null, e)) {
                logger.debug("Scan of {} aborted: {}", root, e.getMessage());
            }
            cancel();
        }

        void cancel() {
            cancelled.set(true);
            finished.countDown();
        }

        void rethrowFailure() throws FilesystemAccessException {
            final Exception e = failure.get();
            if (e == null) {
                return;
            }
            if (e instanceof FilesystemAccessException) {
                throw (FilesystemAccessException) e;
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new IllegalStateException("Scan of " + root + " failed", e);
        }

        DirectoryIndex freeze(final long elapsedTimeMs) {
            final Entry rootEntry;
            synchronized (treeLock) {
                rootEntry = treeBuilder.freeze();
            }
            synchronized (fingerprintLock) {
                return new DirectoryIndex(root, rootEntry, buckets, fingerprints,
                        settings.workerCount(), elapsedTimeMs);
            }
        }
    }
}
