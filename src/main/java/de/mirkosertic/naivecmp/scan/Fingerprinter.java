package de.mirkosertic.naivecmp.scan;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Maps leaf metadata to a 64-bit fingerprint.
 * <p>
 * The enabled attributes are encoded in a fixed order: mode (32 bit), modification time
 * (64 bit), size (64 bit), all little-endian, then the containing directory path with a
 * trailing '/' and finally the name. The bytes go through a seeded FNV-1a pass followed by
 * a 64-bit avalanche step. Not collision resistant against adversaries, and values are
 * only comparable between fingerprints computed with the same seed.
 */
public final class Fingerprinter {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final FingerprintAttributes attributes;
    private final long seed;

    public Fingerprinter(final FingerprintAttributes attributes, final long seed) {
        this.attributes = attributes;
        this.seed = seed;
    }

    public long fingerprint(final LeafMetadata metadata) {
        return fingerprint(metadata, attributes, seed);
    }

    public FingerprintAttributes getAttributes() {
        return attributes;
    }

    public static long fingerprint(final LeafMetadata metadata, final FingerprintAttributes attributes, final long seed) {
        return hash(encode(metadata, attributes), seed);
    }

    static byte[] encode(final LeafMetadata metadata, final FingerprintAttributes attributes) {
        final byte[] directory = attributes.directoryPath()
                ? directoryBytes(metadata.directoryPath())
                : new byte[0];
        final byte[] name = attributes.name()
                ? metadata.name().getBytes(StandardCharsets.UTF_8)
                : new byte[0];

        final ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + 2 * Long.BYTES + directory.length + name.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        if (attributes.mode()) {
            buffer.putInt(metadata.mode());
        }
        if (attributes.modificationTime()) {
            buffer.putLong(metadata.modifiedNanos());
        }
        if (attributes.size()) {
            buffer.putLong(metadata.size());
        }
        buffer.put(directory);
        buffer.put(name);

        final byte[] result = new byte[buffer.position()];
        buffer.flip();
        buffer.get(result);
        return result;
    }

    private static byte[] directoryBytes(final String directoryPath) {
        final String value = directoryPath.isEmpty() ? "./" : directoryPath + "/";
        return value.getBytes(StandardCharsets.UTF_8);
    }

    static long hash(final byte[] data, final long seed) {
        long hash = FNV_OFFSET_BASIS ^ mix(seed);
        for (final byte b : data) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        hash ^= data.length;
        return mix(hash);
    }

    // MurmurHash3 fmix64
    private static long mix(long value) {
        value ^= value >>> 33;
        value *= 0xff51afd7ed558ccdL;
        value ^= value >>> 33;
        value *= 0xc4ceb9fe1a85ec53L;
        value ^= value >>> 33;
        return value;
    }
}
