package io.evalsandbox.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.evalsandbox.core.error.AccessDeniedException;
import io.evalsandbox.core.error.EvalSyntaxException;
import io.evalsandbox.core.error.ResourceExhaustedException;
import io.evalsandbox.core.error.TerminatedEvaluatorException;
import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.model.SessionState;
import io.evalsandbox.core.policy.AccessKind;
import io.evalsandbox.core.policy.CapabilityPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end tests for {@link Session} over the bundled Datalog runtime. */
@DisplayName("Session")
class SessionTest {

    @TempDir
    Path tempDir;

    private CapabilityPolicy policy;
    private final SessionFactory factory = SessionFactory.withDefaults();
    private final ExecutorService caller = Executors.newSingleThreadExecutor();

    @BeforeEach
    void setUp() throws IOException {
        policy = CapabilityPolicy.defaultsFor(Files.createDirectories(tempDir.resolve("a").resolve("b")));
    }

    @AfterEach
    void tearDown() {
        caller.shutdownNow();
    }

    /** Waits until {@code session} has an evaluation in flight. */
    private static void awaitEvaluating(Session session) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (session.state() != SessionState.EVALUATING) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("session never started evaluating");
            }
            Thread.sleep(5);
        }
        // let the worker reach the blocking write
        Thread.sleep(50);
    }

    @Nested
    @DisplayName("fresh session")
    class Fresh {

        @Test
        @DisplayName("is alive and both drains are empty")
        void freshSession() {
            try (Session session = factory.create(MemoryLimit.DEFAULT, policy)) {
                assertThat(session.isAlive()).isTrue();
                assertThat(session.state()).isEqualTo(SessionState.READY);
                assertThat(session.drainStdout()).isEmpty();
                assertThat(session.drainStderr()).isEmpty();
                assertThat(session.id().toString()).startsWith("session-");
                assertThat(session.memoryLimit()).isEqualTo(MemoryLimit.DEFAULT);
                assertThat(session.policy()).isSameAs(policy);
            }
        }

        @Test
        @DisplayName("each session gets a distinct id")
        void distinctIds() {
            try (Session first = factory.create(); Session second = factory.create()) {
                assertThat(first.id()).isNotEqualTo(second.id());
                assertThat(second.id().sequence()).isGreaterThan(first.id().sequence());
            }
        }
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("asserting then querying a fact returns ok and that fact")
        void assertThenQuery() {
            try (Session session = factory.create(MemoryLimit.DEFAULT, policy)) {
                assertThat(session.evaluate("parent(john, douglas). parent(john, X)?").toString())
                        .isEqualTo("[\"ok\",[\"parent(john, douglas)\"]]");
            }
        }

        @Test
        @DisplayName("output is only returned by the drains")
        void outputGoesToCaptures() {
            try (Session session = factory.create(MemoryLimit.DEFAULT, policy)) {
                session.evaluate("print(\"to stdout\")? eprint(\"to stderr\")?");

                assertThat(session.drainStdoutText()).isEqualTo("to stdout");
                assertThat(session.drainStdoutText()).isEmpty();
                assertThat(session.drainStderrText()).isEqualTo("to stderr");
            }
        }

        @Test
        @DisplayName("flush discards both streams")
        void flushDiscards() {
            try (Session session = factory.create(MemoryLimit.DEFAULT, policy)) {
                session.evaluate("print(a)? eprint(b)?");
                session.flush();

                assertThat(session.drainStdout()).isEmpty();
                assertThat(session.drainStderr()).isEmpty();
            }
        }

        @Test
        @DisplayName("a syntax error leaves the session alive")
        void syntaxErrorKeepsSessionAlive() {
            try (Session session = factory.create(MemoryLimit.DEFAULT, policy)) {
                assertThatThrownBy(() -> session.evaluate("parent(john"))
                        .isInstanceOf(EvalSyntaxException.class)
                        .satisfies(e -> assertThat(((EvalSyntaxException) e).sessionId()).isSameAs(session.id()));

                assertThat(session.isAlive()).isTrue();
                assertThat(session.state()).isEqualTo(SessionState.READY);
            }
        }

        @Test
        @DisplayName("exhausting memory kills the session")
        void resourceExhaustion() {
            try (Session session = factory.create(MemoryLimit.ofMebibytes(1), policy)) {
                assertThatThrownBy(() -> session.evaluate("nat(0). nat(Y) :- nat(X), add(X, 1, Y). nat(N)?"))
                        .isInstanceOf(ResourceExhaustedException.class)
                        .hasMessageContaining("out of memory")
                        .satisfies(e -> assertThat(((ResourceExhaustedException) e).sessionId())
                                .isSameAs(session.id()));

                assertThat(session.isAlive()).isFalse();
                assertThat(session.state()).isEqualTo(SessionState.DEAD);
                assertThatThrownBy(() -> session.evaluate("nat(X)?"))
                        .isInstanceOf(TerminatedEvaluatorException.class);
            }
        }
    }

    @Nested
    @DisplayName("default capabilities")
    class DefaultCapabilities {

        @Test
        @DisplayName("a shallow working directory cannot read from the filesystem root")
        void shallowWorkingDirectory() {
            CapabilityPolicy shallow = CapabilityPolicy.defaultsFor(Path.of("/tmp/evalsandbox-shallow"));

            try (Session session = factory.create(MemoryLimit.DEFAULT, shallow)) {
                assertThatThrownBy(() -> session.evaluate("read_file(\"/etc/passwd\", C)?"))
                        .isInstanceOf(AccessDeniedException.class)
                        .satisfies(e -> assertThat(((AccessDeniedException) e).kind()).isEqualTo(AccessKind.READ));
                assertThatThrownBy(() -> session.evaluate("file_exists(\"/etc/passwd\")?"))
                        .isInstanceOf(AccessDeniedException.class);

                assertThat(session.isAlive()).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("kill")
    class Kill {

        @Test
        @DisplayName("marks the session dead and rejects further evaluation")
        void killRejectsEvaluate() {
            Session session = factory.create(MemoryLimit.DEFAULT, policy);
            session.kill();

            assertThat(session.isAlive()).isFalse();
            assertThat(session.state()).isEqualTo(SessionState.DEAD);
            assertThatThrownBy(() -> session.evaluate("p(a)."))
                    .isInstanceOf(TerminatedEvaluatorException.class)
                    .hasMessageContaining(session.id().toString());
        }

        @Test
        @DisplayName("is idempotent and close is an alias")
        void idempotent() {
            Session session = factory.create(MemoryLimit.DEFAULT, policy);
            session.kill();
            session.kill();
            session.close();

            assertThat(session.isAlive()).isFalse();
        }

        @Test
        @DisplayName("buffered output stays drainable")
        void bufferedOutputSurvives() {
            Session session = factory.create(MemoryLimit.DEFAULT, policy);
            session.evaluate("print(\"last words\")?");
            session.kill();

            assertThat(session.drainStdoutText()).isEqualTo("last words");
        }

        @Test
        @DisplayName("aborts an in-flight evaluation")
        void killInFlight() throws Exception {
            SessionFactory tiny = SessionFactory.builder().captureCapacity(8).build();
            Session session = tiny.create(MemoryLimit.DEFAULT, policy);
            Future<?> pending = caller.submit(() -> session.evaluate("print(\"0123456789abcdef\")?"));
            awaitEvaluating(session);

            session.kill();

            assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(TerminatedEvaluatorException.class);
            assertThat(session.isAlive()).isFalse();
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("a second evaluate while one is in flight fails fast")
        void concurrentEvaluateRejected() throws Exception {
            SessionFactory tiny = SessionFactory.builder().captureCapacity(8).build();
            try (Session session = tiny.create(MemoryLimit.DEFAULT, policy)) {
                Future<?> pending = caller.submit(() -> session.evaluate("print(\"0123456789abcdef\")?"));
                awaitEvaluating(session);

                assertThatThrownBy(() -> session.evaluate("p(a)."))
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("already evaluating");

                StringBuilder out = new StringBuilder(session.drainStdoutText());
                pending.get(5, TimeUnit.SECONDS);
                out.append(session.drainStdoutText());

                assertThat(out.toString()).isEqualTo("0123456789abcdef");
                assertThat(session.state()).isEqualTo(SessionState.READY);
            }
        }
    }

    @Test
    @DisplayName("sessions are isolated from each other")
    void isolation() {
        try (Session first = factory.create(MemoryLimit.ofMebibytes(1), policy);
                Session second = factory.create(MemoryLimit.DEFAULT, policy)) {
            first.evaluate("secret(42). print(\"first\")?");

            assertThat(second.evaluate("secret(X)?").toString()).isEqualTo("[[]]");
            assertThat(second.drainStdout()).isEmpty();

            assertThatThrownBy(() -> first.evaluate("nat(0). nat(Y) :- nat(X), add(X, 1, Y). nat(N)?"))
                    .isInstanceOf(ResourceExhaustedException.class);

            assertThat(first.isAlive()).isFalse();
            assertThat(second.isAlive()).isTrue();
            assertThat(second.evaluate("ok(yes). ok(X)?").get(1).get(0).asText()).isEqualTo("ok(yes)");
            assertThat(first.drainStdoutText()).isEqualTo("first");
        }
    }
}
