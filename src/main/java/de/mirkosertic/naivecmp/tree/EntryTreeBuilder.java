package de.mirkosertic.naivecmp.tree;

import de.mirkosertic.naivecmp.InternalConsistencyException;

import java.util.List;

/**
 * Builds an entry tree from root-relative paths, creating missing ancestor directories.
 * Not thread-safe; concurrent callers serialize access themselves.
 */
public class EntryTreeBuilder {

    private final Entry root = Entry.root();
    private boolean frozen;

    /**
     * Insert a directory. Inserting an existing directory again returns the existing node,
     * since directories are also created implicitly as ancestors.
     */
    public Entry insertDirectory(final String relativePath) {
        return insert(relativePath, EntryKind.DIRECTORY);
    }

    /**
     * Insert a leaf. A leaf path must be inserted exactly once.
     */
    public Entry insertLeaf(final String relativePath) {
        return insert(relativePath, EntryKind.LEAF);
    }

    private Entry insert(final String relativePath, final EntryKind kind) {
        if (frozen) {
            throw new InternalConsistencyException("Tree is frozen, cannot insert '" + relativePath + "'");
        }
        final List<String> segments = RelativePaths.segments(relativePath);
        if (segments.isEmpty()) {
            if (kind == EntryKind.LEAF) {
                throw new InternalConsistencyException("The root cannot be a leaf");
            }
            return root;
        }

        Entry current = root;
        final int last = segments.size() - 1;
        for (int i = 0; i < last; i++) {
            final String segment = segments.get(i);
            final Entry existing = current.child(segment);
            if (existing == null) {
                current = current.addChild(segment, EntryKind.DIRECTORY);
            } else if (existing.isDirectory()) {
                current = existing;
            } else {
                throw new InternalConsistencyException("Ancestor '" + existing.relativePath() + "' of '"
                        + relativePath + "' is a leaf");
            }
        }

        final String name = segments.get(last);
        final Entry existing = current.child(name);
        if (existing == null) {
            return current.addChild(name, kind);
        }
        if (kind == EntryKind.DIRECTORY && existing.isDirectory()) {
            return existing;
        }
        throw new InternalConsistencyException("Duplicate entry '" + existing.relativePath() + "' ("
                + existing.kind() + " exists, inserting " + kind + ")");
    }

    /**
     * Stop accepting insertions and hand out the finished root.
     */
    public Entry freeze() {
        frozen = true;
        return root;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
