package de.mirkosertic.naivecmp;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A directory listing or metadata read failed while scanning. Aborts the whole run,
 * transient and permanent causes are treated the same.
 */
public class FilesystemAccessException extends IOException {

    private final Path path;

    public FilesystemAccessException(final Path path, final String operation, final Throwable cause) {
        super("Cannot " + operation + " " + path + ": " + describe(cause), cause);
        this.path = path;
    }

    public FilesystemAccessException(final Path path, final String message) {
        super(message);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    private static String describe(final Throwable cause) {
        final String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + " (" + message + ")";
    }
}
