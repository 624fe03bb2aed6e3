package io.evalsandbox.core.runtime.datalog;

import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.policy.CapabilityGuard;
import io.evalsandbox.core.policy.CapabilityPolicy;
import io.evalsandbox.core.spi.EvaluationRuntime;
import io.evalsandbox.core.spi.RuntimeInstance;
import java.io.OutputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bundled {@link EvaluationRuntime} for a small Datalog dialect with side-effecting built-ins.
 *
 * <p>
 * Program units consist of statements: {@code p(a).} asserts a fact, {@code p(X) :- q(X).} asserts a rule,
 * {@code p(a)~} retracts a fact and {@code p(X)?} queries. Evaluating a unit returns a JSON array with one
 * element per statement: {@code "ok"} for assertions and retractions, an array of matching facts for a query.
 *
 * <p>
 * Stateless; each {@link #start} call returns an independent knowledge base.
 */
public final class DatalogRuntime implements EvaluationRuntime {

    private static final Logger LOG = LoggerFactory.getLogger(DatalogRuntime.class);

    public static final String ID = "datalog";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuntimeInstance start(
            CapabilityPolicy policy, MemoryLimit memoryLimit, OutputStream stdout, OutputStream stderr) {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(memoryLimit, "memoryLimit must not be null");
        Objects.requireNonNull(stdout, "stdout must not be null");
        Objects.requireNonNull(stderr, "stderr must not be null");
        DatalogInstance instance = new DatalogInstance(new CapabilityGuard(policy), memoryLimit, stdout, stderr);
        LOG.debug(
                "Datalog instance started: working_directory={}, memory_limit_bytes={}",
                policy.workingDirectory(),
                memoryLimit.bytes());
        return instance;
    }
}
