package de.mirkosertic.naivecmp.tree;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Root-relative paths are always '/'-separated, with the empty string naming the root.
 */
public final class RelativePaths {

    public static final String ROOT = "";
    public static final char SEPARATOR = '/';

    private RelativePaths() {
        // Prevent instantiation
    }

    public static String child(final String parent, final String name) {
        if (parent.isEmpty()) {
            return name;
        }
        return parent + SEPARATOR + name;
    }

    /**
     * Parent path of the given relative path, {@link #ROOT} for top-level entries.
     */
    public static String parent(final String relativePath) {
        final int index = relativePath.lastIndexOf(SEPARATOR);
        return index < 0 ? ROOT : relativePath.substring(0, index);
    }

    /**
     * Split into non-empty segments. Leading, trailing and doubled separators are ignored.
     */
    public static List<String> segments(final String relativePath) {
        final List<String> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= relativePath.length(); i++) {
            if (i == relativePath.length() || relativePath.charAt(i) == SEPARATOR) {
                if (i > start) {
                    result.add(relativePath.substring(start, i));
                }
                start = i + 1;
            }
        }
        return result;
    }

    /**
     * Relativize {@code path} against {@code root} and join the name elements with '/',
     * independent of the host separator.
     */
    public static String of(final Path root, final Path path) {
        final Path relative = root.relativize(path);
        final StringBuilder builder = new StringBuilder();
        for (final Path element : relative) {
            final String name = element.toString();
            if (name.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(SEPARATOR);
            }
            builder.append(name);
        }
        return builder.toString();
    }
}
