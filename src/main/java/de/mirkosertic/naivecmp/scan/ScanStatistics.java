package de.mirkosertic.naivecmp.scan;

/**
 * Summary of one finished scan.
 */
public record ScanStatistics(
        String root,
        long directories,
        long leaves,
        int fingerprintBuckets,
        /** Buckets holding more than one leaf; these go through the path fallback when matched. */
        int collisionBuckets,
        int workers,
        long elapsedTimeMs
) {
    public double leavesPerSecond() {
        if (elapsedTimeMs == 0) return 0;
        return leaves / (elapsedTimeMs / 1000.0);
    }
}
