package de.mirkosertic.naivecmp.scan;

import de.mirkosertic.naivecmp.InternalConsistencyException;
import de.mirkosertic.naivecmp.tree.Entry;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The frozen result of one scan: the entry tree of a root plus its fingerprint buckets.
 * <p>
 * Instances are created by {@link DirectoryScanner} once every reachable entry has been
 * recorded and are never modified afterwards, so they can be shared between threads.
 */
public final class DirectoryIndex {

    private final Path rootPath;
    private final Entry root;
    private final Map<Long, Set<Entry>> buckets;
    private final Map<Entry, Long> fingerprints;
    private final long directoryCount;
    private final long leafCount;
    private final int collisionBucketCount;
    private final ScanStatistics statistics;

    DirectoryIndex(final Path rootPath,
                   final Entry root,
                   final Map<Long, List<Entry>> buckets,
                   final Map<Entry, Long> fingerprints,
                   final int workers,
                   final long elapsedTimeMs) {
        this.rootPath = rootPath;
        this.root = root;

        final Map<Long, Set<Entry>> frozenBuckets = new HashMap<>(buckets.size() * 2);
        int collisions = 0;
        for (final Map.Entry<Long, List<Entry>> bucket : buckets.entrySet()) {
            frozenBuckets.put(bucket.getKey(), Set.copyOf(bucket.getValue()));
            if (bucket.getValue().size() > 1) {
                collisions++;
            }
        }
        this.buckets = Collections.unmodifiableMap(frozenBuckets);
        this.fingerprints = Collections.unmodifiableMap(new IdentityHashMap<>(fingerprints));
        this.collisionBucketCount = collisions;

        long directories = 0;
        long leaves = 0;
        final Deque<Entry> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final Entry entry = pending.pop();
            if (entry.isDirectory()) {
                directories++;
                entry.children().forEach(pending::push);
            } else {
                leaves++;
            }
        }
        this.directoryCount = directories;
        this.leafCount = leaves;

        this.statistics = new ScanStatistics(rootPath.toString(), directories, leaves,
                this.buckets.size(), collisions, workers, elapsedTimeMs);
    }

    public Path rootPath() {
        return rootPath;
    }

    public Entry root() {
        return root;
    }

    /**
     * All leaves sharing the fingerprint, empty if there are none.
     */
    public Set<Entry> lookupByFingerprint(final long fingerprint) {
        final Set<Entry> bucket = buckets.get(fingerprint);
        return bucket == null ? Set.of() : bucket;
    }

    /**
     * @throws InternalConsistencyException for directories and for entries of another index
     */
    public long fingerprintOf(final Entry leaf) {
        if (!leaf.isLeaf()) {
            throw new InternalConsistencyException("Directories have no fingerprint: " + leaf);
        }
        final Long fingerprint = fingerprints.get(leaf);
        if (fingerprint == null) {
            throw new InternalConsistencyException("Leaf does not belong to index of " + rootPath + ": " + leaf);
        }
        return fingerprint;
    }

    public Optional<Entry> entryAt(final String relativePath) {
        return Optional.ofNullable(root.resolve(relativePath));
    }

    /**
     * Children ordered by name, empty for leaves.
     */
    public List<Entry> children(final Entry entry) {
        return entry.children();
    }

    public long directoryCount() {
        return directoryCount;
    }

    public long leafCount() {
        return leafCount;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public int collisionBucketCount() {
        return collisionBucketCount;
    }

    /**
     * Number of leaves across all buckets. Equals {@link #leafCount()} for a complete scan.
     */
    public long bucketedLeafCount() {
        long count = 0;
        for (final Set<Entry> bucket : buckets.values()) {
            count += bucket.size();
        }
        return count;
    }

    /**
     * Every leaf with its fingerprint, ordered by path.
     */
    public List<Map.Entry<Entry, Long>> fingerprintedLeaves() {
        final List<Map.Entry<Entry, Long>> result = new ArrayList<>(fingerprints.size());
        fingerprints.forEach((leaf, fingerprint) -> result.add(Map.entry(leaf, fingerprint)));
        result.sort(Comparator.comparing((Map.Entry<Entry, Long> e) -> e.getKey().relativePath()));
        return result;
    }

    public ScanStatistics statistics() {
        return statistics;
    }
}
