package de.mirkosertic.naivecmp.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.mirkosertic.naivecmp.ComparisonResult;
import de.mirkosertic.naivecmp.ComparisonStatistics;
import de.mirkosertic.naivecmp.scan.DirectoryIndex;
import de.mirkosertic.naivecmp.tree.Entry;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a comparison.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComparisonReport(
        String rootA,
        String rootB,
        List<String> onlyInA,
        List<String> onlyInB,
        ComparisonStatistics statistics,
        @Nullable Map<String, List<Fingerprint>> fingerprints
) {

    /**
     * A leaf with its unsigned fingerprint, only present in debug reports.
     */
    public record Fingerprint(String path, String fingerprint) {
    }

    public static ComparisonReport from(final ComparisonResult result, final boolean debug) {
        Map<String, List<Fingerprint>> debugFingerprints = null;
        if (debug) {
            debugFingerprints = new LinkedHashMap<>();
            debugFingerprints.put("a", fingerprints(result.indexA()));
            debugFingerprints.put("b", fingerprints(result.indexB()));
        }
        return new ComparisonReport(
                result.indexA().rootPath().toString(),
                result.indexB().rootPath().toString(),
                result.onlyInA().leafPaths(),
                result.onlyInB().leafPaths(),
                result.statistics(),
                debugFingerprints);
    }

    private static List<Fingerprint> fingerprints(final DirectoryIndex index) {
        return index.fingerprintedLeaves().stream()
                .map((Map.Entry<Entry, Long> leaf) -> new Fingerprint(leaf.getKey().relativePath(),
                        Long.toUnsignedString(leaf.getValue())))
                .toList();
    }
}
