package de.mirkosertic.naivecmp;

/**
 * One of the two compared roots.
 */
public enum Side {
    A,
    B;

    public Side other() {
        return this == A ? B : A;
    }
}
