package de.mirkosertic.naivecmp.tree;

import de.mirkosertic.naivecmp.InternalConsistencyException;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One node of an entry tree: a directory with children ordered by name, or a leaf.
 * <p>
 * The kind is fixed at construction. Each node stores its full root-relative path, so no
 * parent reference is needed to reconstruct it. Children are only added through
 * {@link EntryTreeBuilder}; once the owning tree is frozen the node never changes.
 * Identity equality is intentional: two trees may contain entries with equal paths.
 */
public final class Entry {

    private final String name;
    private final String relativePath;
    private final EntryKind kind;
    private final @Nullable Map<String, Entry> children;

    private Entry(final String name, final String relativePath, final EntryKind kind) {
        this.name = name;
        this.relativePath = relativePath;
        this.kind = kind;
        this.children = kind == EntryKind.DIRECTORY ? new TreeMap<>() : null;
    }

    static Entry root() {
        return new Entry(RelativePaths.ROOT, RelativePaths.ROOT, EntryKind.DIRECTORY);
    }

    public String name() {
        return name;
    }

    public String relativePath() {
        return relativePath;
    }

    public EntryKind kind() {
        return kind;
    }

    public boolean isDirectory() {
        return kind == EntryKind.DIRECTORY;
    }

    public boolean isLeaf() {
        return kind == EntryKind.LEAF;
    }

    public boolean isRoot() {
        return relativePath.isEmpty();
    }

    public @Nullable Entry child(final String childName) {
        return children == null ? null : children.get(childName);
    }

    /**
     * Walk down from this node along a '/'-separated path relative to it.
     *
     * @return the entry, or {@code null} if any segment is missing
     */
    public @Nullable Entry resolve(final String path) {
        Entry current = this;
        for (final String segment : RelativePaths.segments(path)) {
            current = current.child(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Children ordered by name; empty for leaves.
     */
    public List<Entry> children() {
        if (children == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(children.values()));
    }

    public List<String> childNames() {
        if (children == null) {
            return List.of();
        }
        return List.copyOf(children.keySet());
    }

    public int childCount() {
        return children == null ? 0 : children.size();
    }

    Entry addChild(final String childName, final EntryKind childKind) {
        if (children == null) {
            throw new InternalConsistencyException("Cannot add '" + childName + "' below leaf '" + relativePath + "'");
        }
        if (children.containsKey(childName)) {
            throw new InternalConsistencyException("Duplicate child '" + childName + "' in '" + relativePath + "'");
        }
        final Entry child = new Entry(childName, RelativePaths.child(relativePath, childName), childKind);
        children.put(childName, child);
        return child;
    }

    @Override
    public String toString() {
        return kind + ":" + (isRoot() ? "/" : relativePath);
    }
}
