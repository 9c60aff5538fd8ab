package de.mirkosertic.naivecmp.diff;

import de.mirkosertic.naivecmp.scan.DirectoryIndex;
import de.mirkosertic.naivecmp.tree.Entry;
import de.mirkosertic.naivecmp.tree.EntryTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Finds the leaves of a source index that have no counterpart in a target index.
 * <p>
 * A leaf matches when its fingerprint occurs exactly once in the target, wherever that
 * leaf lives, which is what lets renamed and moved files be tracked. When several target
 * leaves share the fingerprint, only a candidate with the same relative path counts.
 * Directories never match on their own; they show up in the result only as ancestors of
 * unmatched leaves.
 * <p>
 * Holds no state, both directions of a comparison can run concurrently.
 */
public class TreeMatcher {

    private static final Logger logger = LoggerFactory.getLogger(TreeMatcher.class);

    public DiffTree diff(final DirectoryIndex source, final DirectoryIndex target) {
        final long startTime = System.currentTimeMillis();
        final EntryTreeBuilder result = new EntryTreeBuilder();

        long compared = 0;
        long matchedByFingerprint = 0;
        long matchedByPath = 0;
        long missing = 0;
        long collisionMisses = 0;

        final Deque<Entry> pending = new ArrayDeque<>();
        pending.push(source.root());
        while (!pending.isEmpty()) {
            final Entry entry = pending.pop();
            if (entry.isDirectory()) {
                final List<Entry> children = source.children(entry);
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
                continue;
            }

            compared++;
            final Set<Entry> candidates = target.lookupByFingerprint(source.fingerprintOf(entry));
            if (candidates.isEmpty()) {
                missing++;
                result.insertLeaf(entry.relativePath());
            } else if (candidates.size() == 1) {
                matchedByFingerprint++;
            } else if (containsPath(candidates, entry.relativePath())) {
                matchedByPath++;
            } else {
                // Either a real mismatch or the two roots are not laid out alike
                logger.debug("{}: {} candidates share the fingerprint, none at the same path",
                        entry.relativePath(), candidates.size());
                collisionMisses++;
                result.insertLeaf(entry.relativePath());
            }
        }

        final MatchStatistics statistics = new MatchStatistics(compared, matchedByFingerprint, matchedByPath,
                missing, collisionMisses, System.currentTimeMillis() - startTime);
        logger.debug("Compared {} against {}: {}", source.rootPath(), target.rootPath(), statistics);
        return new DiffTree(result.freeze(), statistics);
    }

    private static boolean containsPath(final Set<Entry> candidates, final String relativePath) {
        for (final Entry candidate : candidates) {
            if (candidate.relativePath().equals(relativePath)) {
                return true;
            }
        }
        return false;
    }
}
