package de.mirkosertic.naivecmp;

/**
 * Raised when the run cannot start: a root is missing, is not a readable directory,
 * or a numeric setting is out of range. Always thrown before any scanning begins.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
