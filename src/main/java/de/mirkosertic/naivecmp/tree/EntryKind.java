package de.mirkosertic.naivecmp.tree;

public enum EntryKind {
    DIRECTORY,
    LEAF
}
