package de.mirkosertic.naivecmp.scan;

import java.nio.file.Path;

/**
 * Visit one filesystem object. The path is the one handed out by the directory listing and
 * is used for all further I/O; the root-relative path is only the key in the entry tree.
 */
record ScanTask(String relativePath, Path path, boolean directory) {
}
