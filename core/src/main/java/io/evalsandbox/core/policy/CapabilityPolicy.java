package io.evalsandbox.core.policy;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative capability rules for one session. Immutable and thread-safe.
 *
 * <p>
 * Filesystem access is granted per subtree: a path is readable when it lies under a read root or a write
 * root, and writable when it lies under a write root. Relative paths resolve against
 * {@code workingDirectory}. Network and process execution are all-or-nothing.
 *
 * @param workingDirectory directory relative paths resolve against
 * @param readRoots        subtrees that may be read
 * @param writeRoots       subtrees that may be written (and read)
 * @param networkAllowed   whether listen/connect are permitted
 * @param processAllowed   whether process execution is permitted
 */
public record CapabilityPolicy(
        Path workingDirectory,
        Set<Path> readRoots,
        Set<Path> writeRoots,
        boolean networkAllowed,
        boolean processAllowed) {

    /** How many directory levels above the working directory the default read scope starts. */
    public static final int DEFAULT_READ_ANCESTOR_LEVELS = 2;

    public CapabilityPolicy {
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        workingDirectory = workingDirectory.toAbsolutePath().normalize();
        readRoots = normalizeRoots(workingDirectory, readRoots);
        writeRoots = normalizeRoots(workingDirectory, writeRoots);
    }

    /** Default policy for the JVM's current working directory. */
    public static CapabilityPolicy defaults() {
        return defaultsFor(Path.of("").toAbsolutePath());
    }

    /**
     * Default policy for the given working directory: read only under the directory two levels above it, no
     * writes, no network, no process execution.
     *
     * <p>
     * The filesystem root is never granted. For a shallow working directory the read scope stops at the
     * highest ancestor below the root; a working directory that is itself the root gets no read access.
     */
    public static CapabilityPolicy defaultsFor(Path workingDirectory) {
        Path wd = workingDirectory.toAbsolutePath().normalize();
        if (wd.getParent() == null) {
            return denyAll(wd);
        }
        Path scope = wd;
        for (int i = 0; i < DEFAULT_READ_ANCESTOR_LEVELS && !isFilesystemRoot(scope.getParent()); i++) {
            scope = scope.getParent();
        }
        return new CapabilityPolicy(wd, Set.of(scope), Set.of(), false, false);
    }

    private static boolean isFilesystemRoot(Path path) {
        return path.getParent() == null;
    }

    /** A policy that grants nothing at all. */
    public static CapabilityPolicy denyAll(Path workingDirectory) {
        return new CapabilityPolicy(workingDirectory, Set.of(), Set.of(), false, false);
    }

    /** Creates a builder starting from a deny-all policy rooted at the current working directory. */
    public static Builder builder() {
        return new Builder();
    }

    private static Set<Path> normalizeRoots(Path workingDirectory, Set<Path> roots) {
        if (roots == null || roots.isEmpty()) {
            return Set.of();
        }
        Set<Path> normalized = new LinkedHashSet<>();
        for (Path root : roots) {
            normalized.add(workingDirectory.resolve(root).normalize());
        }
        return Set.copyOf(normalized);
    }

    /** Builder for {@link CapabilityPolicy}. Everything is denied unless granted. */
    public static final class Builder {
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private final Set<Path> readRoots = new LinkedHashSet<>();
        private final Set<Path> writeRoots = new LinkedHashSet<>();
        private boolean networkAllowed;
        private boolean processAllowed;

        Builder() {}

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder readRoot(Path root) {
            this.readRoots.add(root);
            return this;
        }

        public Builder writeRoot(Path root) {
            this.writeRoots.add(root);
            return this;
        }

        public Builder networkAllowed(boolean networkAllowed) {
            this.networkAllowed = networkAllowed;
            return this;
        }

        public Builder processAllowed(boolean processAllowed) {
            this.processAllowed = processAllowed;
            return this;
        }

        public CapabilityPolicy build() {
            return new CapabilityPolicy(workingDirectory, readRoots, writeRoots, networkAllowed, processAllowed);
        }
    }
}
