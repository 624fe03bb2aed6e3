package io.evalsandbox.standalone.config;

import io.evalsandbox.core.capture.OutputCapture;
import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.policy.CapabilityPolicy;
import io.evalsandbox.core.runtime.RuntimeRegistry;
import io.evalsandbox.core.runtime.datalog.DatalogRuntime;
import io.evalsandbox.core.session.SessionFactory;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for the standalone REPL.
 *
 * <p>
 * All fields have defaults. Use {@link #builder()} to construct instances.
 *
 * @param runtime              id of the evaluation runtime to start
 * @param memoryLimitBytes     memory ceiling of each session
 * @param captureCapacityBytes capacity of each stdout/stderr capture
 * @param startupTimeoutMs     maximum wait for a session's runtime to become ready
 * @param workingDirectory     working directory of evaluated code; {@code null} means the process's
 * @param readRoots            readable subtrees; empty means two levels above the working directory
 * @param writeRoots           writable subtrees (default none)
 * @param networkAllowed       allow listen/connect
 * @param processAllowed       allow process execution
 * @param loggingFormat        json or text
 * @param loggingLevel         root log level
 */
public record ReplConfig(
        String runtime,
        long memoryLimitBytes,
        int captureCapacityBytes,
        int startupTimeoutMs,
        String workingDirectory,
        List<String> readRoots,
        List<String> writeRoots,
        boolean networkAllowed,
        boolean processAllowed,
        String loggingFormat,
        String loggingLevel) {

    public ReplConfig {
        readRoots = List.copyOf(readRoots);
        writeRoots = List.copyOf(writeRoots);
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** A configuration with every default applied. */
    public static ReplConfig defaults() {
        return builder().build();
    }

    public MemoryLimit memoryLimit() {
        return MemoryLimit.ofBytes(memoryLimitBytes);
    }

    /**
     * The capability policy granted to sessions. Relative roots resolve against the working directory.
     */
    public CapabilityPolicy policy() {
        Path cwd = workingDirectory != null
                ? Path.of(workingDirectory).toAbsolutePath()
                : Path.of("").toAbsolutePath();
        CapabilityPolicy.Builder builder = CapabilityPolicy.builder()
                .workingDirectory(cwd)
                .networkAllowed(networkAllowed)
                .processAllowed(processAllowed);
        if (readRoots.isEmpty()) {
            CapabilityPolicy.defaultsFor(cwd).readRoots().forEach(builder::readRoot);
        }
        readRoots.forEach(root -> builder.readRoot(cwd.resolve(root)));
        writeRoots.forEach(root -> builder.writeRoot(cwd.resolve(root)));
        return builder.build();
    }

    /**
     * A session factory for {@link #runtime()} with this configuration's capacities.
     *
     * @throws IllegalArgumentException if the registry has no runtime with that id
     */
    public SessionFactory sessionFactory(RuntimeRegistry registry) {
        return SessionFactory.builder()
                .runtime(registry.requireRuntime(runtime))
                .captureCapacity(captureCapacityBytes)
                .startupTimeout(Duration.ofMillis(startupTimeoutMs))
                .build();
    }

    /** Builder for {@link ReplConfig}. */
    public static final class Builder {
        private String runtime = DatalogRuntime.ID;
        private long memoryLimitBytes = MemoryLimit.DEFAULT.bytes();
        private int captureCapacityBytes = OutputCapture.DEFAULT_CAPACITY;
        private int startupTimeoutMs = (int) SessionFactory.DEFAULT_STARTUP_TIMEOUT.toMillis();
        private String workingDirectory;
        private final List<String> readRoots = new ArrayList<>();
        private final List<String> writeRoots = new ArrayList<>();
        private boolean networkAllowed;
        private boolean processAllowed;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder runtime(String runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder memoryLimitBytes(long memoryLimitBytes) {
            this.memoryLimitBytes = memoryLimitBytes;
            return this;
        }

        public Builder captureCapacityBytes(int captureCapacityBytes) {
            this.captureCapacityBytes = captureCapacityBytes;
            return this;
        }

        public Builder startupTimeoutMs(int startupTimeoutMs) {
            this.startupTimeoutMs = startupTimeoutMs;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        /** Replaces the read roots. */
        public Builder readRoots(List<String> readRoots) {
            this.readRoots.clear();
            this.readRoots.addAll(readRoots);
            return this;
        }

        /** Replaces the write roots. */
        public Builder writeRoots(List<String> writeRoots) {
            this.writeRoots.clear();
            this.writeRoots.addAll(writeRoots);
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

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the {@link ReplConfig}.
         *
         * @throws ConfigLoadException if a numeric value is out of range
         */
        public ReplConfig build() {
            if (runtime == null || runtime.isBlank()) {
                throw new ConfigLoadException("session.runtime must not be empty");
            }
            if (memoryLimitBytes <= 0) {
                throw new ConfigLoadException("session.memory-limit-bytes must be positive, got: " + memoryLimitBytes);
            }
            if (captureCapacityBytes <= 0) {
                throw new ConfigLoadException(
                        "session.capture-capacity-bytes must be positive, got: " + captureCapacityBytes);
            }
            if (startupTimeoutMs <= 0) {
                throw new ConfigLoadException("session.startup-timeout-ms must be positive, got: " + startupTimeoutMs);
            }
            return new ReplConfig(
                    runtime,
                    memoryLimitBytes,
                    captureCapacityBytes,
                    startupTimeoutMs,
                    workingDirectory,
                    readRoots,
                    writeRoots,
                    networkAllowed,
                    processAllowed,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
