package de.mirkosertic.naivecmp;

/**
 * Classification of an entry of either scanned tree, for views that show everything
 * annotated by match status.
 */
public enum MatchStatus {
    /** A leaf with a counterpart on the other side. */
    MATCHED,
    /** A leaf without a counterpart on the other side. */
    UNMATCHED,
    /** A directory whose leaves all have counterparts. */
    DIRECTORY_MATCHED,
    /** A directory containing at least one unmatched leaf. */
    DIRECTORY_WITH_UNMATCHED
}
