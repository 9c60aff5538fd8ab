package de.mirkosertic.naivecmp.diff;

import de.mirkosertic.naivecmp.tree.Entry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The unmatched leaves of one comparison direction, with just the directories needed to
 * reach them. Read-only once built by {@link TreeMatcher}.
 */
public final class DiffTree {

    private final Entry root;
    private final List<String> leafPaths;
    private final MatchStatistics statistics;

    DiffTree(final Entry root, final MatchStatistics statistics) {
        this.root = root;
        this.statistics = statistics;
        this.leafPaths = Collections.unmodifiableList(collectLeafPaths(root));
    }

    public Entry root() {
        return root;
    }

    /**
     * Child names of an entry, ordered.
     */
    public List<String> list(final Entry entry) {
        return entry.childNames();
    }

    public Optional<Entry> child(final Entry entry, final String name) {
        return Optional.ofNullable(entry.child(name));
    }

    /**
     * Root-relative, '/'-separated path of an entry of this tree.
     */
    public String path(final Entry entry) {
        return entry.relativePath();
    }

    public Optional<Entry> entryAt(final String relativePath) {
        return Optional.ofNullable(root.resolve(relativePath));
    }

    public boolean contains(final String relativePath) {
        return root.resolve(relativePath) != null;
    }

    /**
     * Paths of all unmatched leaves, sorted.
     */
    public List<String> leafPaths() {
        return leafPaths;
    }

    public int leafCount() {
        return leafPaths.size();
    }

    public boolean isEmpty() {
        return leafPaths.isEmpty();
    }

    public MatchStatistics statistics() {
        return statistics;
    }

    private static List<String> collectLeafPaths(final Entry root) {
        final List<String> result = new ArrayList<>();
        final Deque<Entry> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final Entry entry = pending.pop();
            if (entry.isLeaf()) {
                result.add(entry.relativePath());
            } else {
                entry.children().forEach(pending::push);
            }
        }
        Collections.sort(result);
        return result;
    }
}
