package de.mirkosertic.naivecmp;

import de.mirkosertic.naivecmp.diff.MatchStatistics;
import de.mirkosertic.naivecmp.scan.ScanStatistics;

public record ComparisonStatistics(
        ScanStatistics scanA,
        ScanStatistics scanB,
        MatchStatistics onlyInA,
        MatchStatistics onlyInB,
        String attributes,
        long startTimeMs,
        long endTimeMs
) {
    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }
}
