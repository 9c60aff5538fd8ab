package de.mirkosertic.naivecmp;

import de.mirkosertic.naivecmp.diff.DiffTree;
import de.mirkosertic.naivecmp.scan.DirectoryIndex;
import de.mirkosertic.naivecmp.tree.Entry;

/**
 * Outcome of comparing two roots. Everything in here is frozen and may be read from any thread.
 *
 * @param indexA  scan of root A
 * @param indexB  scan of root B
 * @param onlyInA leaves of A without a counterpart in B
 * @param onlyInB leaves of B without a counterpart in A
 */
public record ComparisonResult(
        DirectoryIndex indexA,
        DirectoryIndex indexB,
        DiffTree onlyInA,
        DiffTree onlyInB,
        ComparisonStatistics statistics
) {

    public DirectoryIndex index(final Side side) {
        return side == Side.A ? indexA : indexB;
    }

    /**
     * The unmatched leaves of the given side.
     */
    public DiffTree diff(final Side side) {
        return side == Side.A ? onlyInA : onlyInB;
    }

    public boolean isIdentical() {
        return onlyInA.isEmpty() && onlyInB.isEmpty();
    }

    /**
     * Classify an entry of the given side's index by looking it up in that side's diff tree.
     */
    public MatchStatus statusOf(final Side side, final Entry entry) {
        final DiffTree diff = diff(side);
        final boolean inDiff = entry.isRoot() ? !diff.isEmpty() : diff.contains(entry.relativePath());
        if (entry.isDirectory()) {
            return inDiff ? MatchStatus.DIRECTORY_WITH_UNMATCHED : MatchStatus.DIRECTORY_MATCHED;
        }
        return inDiff ? MatchStatus.UNMATCHED : MatchStatus.MATCHED;
    }
}
