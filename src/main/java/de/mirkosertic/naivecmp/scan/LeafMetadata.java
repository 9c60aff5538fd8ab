package de.mirkosertic.naivecmp.scan;

import de.mirkosertic.naivecmp.tree.RelativePaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Instant;
import java.util.Set;

/**
 * The attributes of one leaf that a fingerprint can be built from.
 *
 * @param name            the last path segment
 * @param directoryPath   root-relative path of the containing directory, empty for the root
 * @param mode            mode bits, 0 when the platform exposes none
 * @param modifiedNanos   modification time as nanoseconds since the epoch
 * @param size            size in bytes
 */
public record LeafMetadata(
        String name,
        String directoryPath,
        int mode,
        long modifiedNanos,
        long size
) {

    /**
     * Read the metadata of a leaf without following symbolic links.
     *
     * @param file         absolute path of the leaf
     * @param relativePath its root-relative path
     * @param withMode     whether to read mode bits, which costs an extra attribute read
     */
    public static LeafMetadata read(final Path file, final String relativePath, final boolean withMode) throws IOException {
        final BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        final int mode = withMode ? readMode(file) : 0;
        final String name = file.getFileName() == null ? relativePath : file.getFileName().toString();
        return new LeafMetadata(
                name,
                RelativePaths.parent(relativePath),
                mode,
                toEpochNanos(attributes.lastModifiedTime()),
                attributes.size());
    }

    static long toEpochNanos(final FileTime time) {
        final Instant instant = time.toInstant();
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    private static int readMode(final Path file) throws IOException {
        final Set<String> views = file.getFileSystem().supportedFileAttributeViews();
        if (views.contains("unix")) {
            return (Integer) Files.getAttribute(file, "unix:mode", LinkOption.NOFOLLOW_LINKS);
        }
        if (!views.contains("posix")) {
            return 0;
        }
        final PosixFileAttributes posix = Files.readAttributes(file, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        int bits = 0;
        for (final PosixFilePermission permission : posix.permissions()) {
            // OWNER_READ (0400) down to OTHERS_EXECUTE (0001)
            bits |= 1 << (8 - permission.ordinal());
        }
        return bits;
    }
}
