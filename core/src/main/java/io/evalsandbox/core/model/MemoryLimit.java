package io.evalsandbox.core.model;

/**
 * Ceiling on live allocation inside a session's evaluation runtime. Breaching it is terminal for the runtime.
 *
 * @param bytes maximum live allocation in bytes (default: 16 MiB)
 */
public record MemoryLimit(long bytes) {

    private static final long MIB = 1024L * 1024L;

    /** Default limit: 16 MiB. */
    public static final MemoryLimit DEFAULT = ofMebibytes(16);

    public MemoryLimit {
        if (bytes <= 0) {
            throw new IllegalArgumentException("memory limit must be positive, got: " + bytes);
        }
    }

    /** Creates a limit of {@code mebibytes} MiB. */
    public static MemoryLimit ofMebibytes(long mebibytes) {
        return new MemoryLimit(mebibytes * MIB);
    }

    /** Creates a limit of {@code bytes} bytes. */
    public static MemoryLimit ofBytes(long bytes) {
        return new MemoryLimit(bytes);
    }
}
