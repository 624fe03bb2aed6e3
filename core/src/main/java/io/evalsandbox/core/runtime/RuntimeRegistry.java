package io.evalsandbox.core.runtime;

import io.evalsandbox.core.spi.EvaluationRuntime;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for evaluation runtimes. Manages registration and lookup by runtime id. Thread-safe: registration
 * and lookup can happen concurrently.
 */
public final class RuntimeRegistry {

    private final Map<String, EvaluationRuntime> runtimes = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding every runtime declared under {@code META-INF/services} on the class path of
     * this class's loader.
     */
    public static RuntimeRegistry installed() {
        RuntimeRegistry registry = new RuntimeRegistry();
        for (EvaluationRuntime runtime :
                ServiceLoader.load(EvaluationRuntime.class, RuntimeRegistry.class.getClassLoader())) {
            registry.register(runtime);
        }
        return registry;
    }

    /**
     * Registers a runtime. If a runtime with the same id is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @param runtime the runtime to register
     * @throws NullPointerException     if runtime is null
     * @throws IllegalArgumentException if runtime.id() is null or empty
     */
    public void register(EvaluationRuntime runtime) {
        if (runtime == null) {
            throw new NullPointerException("runtime must not be null");
        }
        String id = runtime.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("runtime id must not be null or empty");
        }
        runtimes.put(id, runtime);
    }

    /** Looks up a runtime by id. */
    public Optional<EvaluationRuntime> getRuntime(String runtimeId) {
        return Optional.ofNullable(runtimes.get(runtimeId));
    }

    /**
     * Looks up a runtime by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no runtime is registered with the given id
     */
    public EvaluationRuntime requireRuntime(String runtimeId) {
        return getRuntime(runtimeId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No evaluation runtime registered for id: '" + runtimeId + "'"));
    }

    /** Registered ids in sorted order. */
    public Set<String> ids() {
        return new TreeSet<>(runtimes.keySet());
    }

    public int size() {
        return runtimes.size();
    }

    public boolean hasRuntime(String runtimeId) {
        return runtimes.containsKey(runtimeId);
    }
}
