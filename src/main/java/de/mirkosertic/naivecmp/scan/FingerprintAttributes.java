package de.mirkosertic.naivecmp.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Which leaf attributes feed the fingerprint. Disabling name and directory path lets
 * renamed or moved files still match.
 */
public record FingerprintAttributes(
        boolean modificationTime,
        boolean size,
        boolean mode,
        boolean name,
        boolean directoryPath
) {

    /** Modification time and size only. */
    public static FingerprintAttributes defaults() {
        return new FingerprintAttributes(true, true, false, false, false);
    }

    public static FingerprintAttributes nameOnly() {
        return new FingerprintAttributes(false, false, false, true, false);
    }

    public String describe() {
        final List<String> enabled = new ArrayList<>();
        if (modificationTime) enabled.add("modification-time");
        if (size) enabled.add("size");
        if (mode) enabled.add("mode");
        if (name) enabled.add("name");
        if (directoryPath) enabled.add("directory-path");
        return enabled.isEmpty() ? "none" : String.join(",", enabled);
    }
}
