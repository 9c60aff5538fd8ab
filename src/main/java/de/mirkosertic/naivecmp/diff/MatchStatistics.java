package de.mirkosertic.naivecmp.diff;

/**
 * Counters of one diff direction.
 */
public record MatchStatistics(
        long leavesCompared,
        /** Leaves whose fingerprint had exactly one candidate in the target. */
        long matchedByFingerprint,
        /** Leaves matched through the collision fallback on an identical relative path. */
        long matchedByPath,
        /** Leaves whose fingerprint does not occur in the target at all. */
        long missing,
        /** Leaves with several candidates in the target, none of them at the same path. */
        long collisionMisses,
        long elapsedTimeMs
) {
    public long unmatched() {
        return missing + collisionMisses;
    }

    public long matched() {
        return matchedByFingerprint + matchedByPath;
    }
}
