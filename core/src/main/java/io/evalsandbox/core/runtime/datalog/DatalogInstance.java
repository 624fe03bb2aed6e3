package io.evalsandbox.core.runtime.datalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.evalsandbox.core.error.EvalRuntimeException;
import io.evalsandbox.core.error.ResourceExhaustedException;
import io.evalsandbox.core.error.TerminatedEvaluatorException;
import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.policy.CapabilityGuard;
import io.evalsandbox.core.spi.RuntimeInstance;
import java.io.OutputStream;
import java.util.List;

/**
 * One running Datalog knowledge base. {@link #submit} runs on the owning session's worker thread only;
 * {@link #terminate()} and {@link #isRunning()} may be called from any thread.
 */
final class DatalogInstance implements RuntimeInstance {

    static final String OK = "ok";

    private final KnowledgeBase kb = new KnowledgeBase();
    private final MemoryMeter meter;
    private final Builtins builtins;
    private final FixpointEvaluator evaluator;
    private volatile boolean terminated;
    private volatile boolean exhausted;

    DatalogInstance(CapabilityGuard guard, MemoryLimit memoryLimit, OutputStream stdout, OutputStream stderr) {
        this.meter = new MemoryMeter(memoryLimit.bytes());
        this.builtins = new Builtins(guard, stdout, stderr, meter);
        this.evaluator = new FixpointEvaluator(kb, builtins, meter, this::checkpoint);
    }

    @Override
    public JsonNode submit(String program) {
        checkpoint();
        if (exhausted) {
            throw new TerminatedEvaluatorException();
        }
        try {
            List<Statement> statements = DatalogParser.parse(program);
            ArrayNode results = JsonNodeFactory.instance.arrayNode();
            for (Statement statement : statements) {
                checkpoint();
                results.add(execute(statement));
            }
            return results;
        } catch (ResourceExhaustedException e) {
            exhausted = true;
            throw e;
        } catch (OutOfMemoryError e) {
            exhausted = true;
            throw new ResourceExhaustedException(
                    "out of memory: heap exhausted while evaluating (limit " + meter.limitBytes() + " bytes)",
                    e,
                    meter.limitBytes());
        }
    }

    @Override
    public void terminate() {
        terminated = true;
    }

    @Override
    public boolean isRunning() {
        return !terminated && !exhausted;
    }

    long usedBytes() {
        return meter.usedBytes();
    }

    private JsonNode execute(Statement statement) {
        Clause clause = statement.clause();
        Literal head = clause.head();
        return switch (statement.kind()) {
            case ASSERT -> {
                rejectBuiltin(head, "assert");
                if (clause.isFact()) {
                    long size = MemoryMeter.sizeOf(head);
                    meter.ensureAvailable(size);
                    if (kb.addFact(head)) {
                        meter.charge(size);
                    }
                } else {
                    long size = MemoryMeter.sizeOf(clause);
                    meter.ensureAvailable(size);
                    if (kb.addRule(clause)) {
                        meter.charge(size);
                    }
                }
                yield JsonNodeFactory.instance.textNode(OK);
            }
            case RETRACT -> {
                rejectBuiltin(head, "retract");
                if (kb.removeFact(head)) {
                    meter.release(MemoryMeter.sizeOf(head));
                }
                yield JsonNodeFactory.instance.textNode(OK);
            }
            case QUERY -> {
                ArrayNode answers = JsonNodeFactory.instance.arrayNode();
                for (Literal answer : evaluator.query(head)) {
                    answers.add(answer.toString());
                }
                yield answers;
            }
        };
    }

    private void rejectBuiltin(Literal head, String action) {
        if (builtins.isReserved(head.predicate())) {
            throw new EvalRuntimeException("cannot " + action + " built-in predicate '" + head.predicate() + "'");
        }
    }

    /** Aborts the current evaluation if the instance was terminated or its thread interrupted. */
    private void checkpoint() {
        if (terminated) {
            throw new TerminatedEvaluatorException();
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new EvalRuntimeException("evaluation interrupted");
        }
    }
}
