package de.mirkosertic.naivecmp.scan;

import de.mirkosertic.naivecmp.ConfigurationException;

import java.util.Objects;

/**
 * Everything a {@link DirectoryScanner} needs besides the root. The seed is part of the
 * settings so that both roots of one run fingerprint with the same value.
 */
public record ScanSettings(
        int workerCount,
        int queueCapacity,
        FingerprintAttributes attributes,
        long seed
) {

    public static final int DEFAULT_WORKER_COUNT = 6;
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    public ScanSettings {
        if (workerCount < 1) {
            throw new ConfigurationException("Worker count must be positive, got " + workerCount);
        }
        if (queueCapacity < 1) {
            throw new ConfigurationException("Queue capacity must be positive, got " + queueCapacity);
        }
        Objects.requireNonNull(attributes, "attributes");
    }

    public static ScanSettings of(final int workerCount, final FingerprintAttributes attributes, final long seed) {
        return new ScanSettings(workerCount, DEFAULT_QUEUE_CAPACITY, attributes, seed);
    }
}
