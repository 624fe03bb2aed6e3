package io.evalsandbox.standalone.repl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import io.evalsandbox.core.error.AccessDeniedException;
import io.evalsandbox.core.error.EvalSyntaxException;
import io.evalsandbox.core.error.InitializationException;
import io.evalsandbox.core.error.ResourceExhaustedException;
import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.policy.AccessKind;
import io.evalsandbox.core.policy.CapabilityPolicy;
import io.evalsandbox.core.session.SessionFactory;
import io.evalsandbox.core.spi.EvaluationRuntime;
import io.evalsandbox.core.spi.RuntimeInstance;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link SandboxRepl} driven with scripted input. */
@DisplayName("SandboxRepl")
class SandboxReplTest {

    @TempDir
    Path tempDir;

    private CapabilityPolicy policy;
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private SandboxRepl repl;

    @BeforeEach
    void setUp() throws IOException {
        policy = CapabilityPolicy.defaultsFor(Files.createDirectories(tempDir.resolve("a").resolve("b")));
    }

    private List<String> run(SessionFactory factory, String input) throws IOException {
        repl = new SandboxRepl(
                factory,
                MemoryLimit.DEFAULT,
                policy,
                new BufferedReader(new StringReader(input)),
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8),
                false);
        assertThat(repl.run()).isZero();
        return outBytes.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private List<String> run(String input) throws IOException {
        return run(SessionFactory.withDefaults(), input);
    }

    @Nested
    @DisplayName("evaluation")
    class Evaluation {

        @Test
        @DisplayName("prints each value as compact JSON")
        void printsJson() throws IOException {
            assertThat(run("parent(a, b). parent(a, X)?\n")).containsExactly("[\"ok\",[\"parent(a, b)\"]]");
        }

        @Test
        @DisplayName("echoes drained stdout before the value and stderr separately")
        void echoesOutput() throws IOException {
            assertThat(run("print(hi)? eprint(oops)?\n")).containsExactly("hi", "[[\"print(hi)\"],[\"eprint(oops)\"]]");
            assertThat(errBytes.toString(StandardCharsets.UTF_8)).isEqualTo("oops" + System.lineSeparator());
        }

        @Test
        @DisplayName("streams output larger than the capture capacity while evaluating")
        void outputLargerThanCapacity() {
            SessionFactory smallCaptures = SessionFactory.builder().captureCapacity(8).build();

            List<String> lines = assertTimeoutPreemptively(
                    Duration.ofSeconds(10),
                    () -> run(smallCaptures, "print(abcdefghijklmnop)? eprint(ponmlkjihgfedcba)?\n"));

            assertThat(lines)
                    .containsExactly(
                            "abcdefghijklmnop",
                            "[[\"print(abcdefghijklmnop)\"],[\"eprint(ponmlkjihgfedcba)\"]]");
            assertThat(errBytes.toString(StandardCharsets.UTF_8))
                    .isEqualTo("ponmlkjihgfedcba" + System.lineSeparator());
        }

        @Test
        @DisplayName("keeps state across lines and skips blank ones")
        void keepsState() throws IOException {
            assertThat(run("fruit(apple).\n\n   \nfruit(F)?\n"))
                    .containsExactly("[\"ok\"]", "[[\"fruit(apple)\"]]");
        }

        @Test
        @DisplayName("prints typed errors and continues")
        void printsErrors() throws IOException {
            List<String> lines = run("p(a\nlisten(80)?\np(b). p(X)?\n");

            assertThat(lines).hasSize(3);
            assertThat(lines.get(0)).startsWith("error[syntax]: syntax error at line 1");
            assertThat(lines.get(1))
                    .isEqualTo("error[access-denied:network]: access denied: network of listen :80 is not permitted");
            assertThat(lines.get(2)).isEqualTo("[\"ok\",[\"p(b)\"]]");
        }
    }

    @Nested
    @DisplayName("commands")
    class Commands {

        @Test
        @DisplayName(":alive, :kill and :new manage the session")
        void lifecycleCommands() throws IOException {
            List<String> lines = run(":alive\n:kill\n:alive\np(a).\n:new\n:alive\np(a).\n");

            assertThat(lines).hasSize(7);
            assertThat(lines.get(0)).isEqualTo("true");
            assertThat(lines.get(1)).startsWith("killed session-");
            assertThat(lines.get(2)).isEqualTo("false");
            assertThat(lines.get(3)).startsWith("error[terminated]: evaluator terminated");
            assertThat(lines.get(4)).startsWith("new session-");
            assertThat(lines.get(5)).isEqualTo("true");
            assertThat(lines.get(6)).isEqualTo("[\"ok\"]");
        }

        @Test
        @DisplayName(":flush discards pending output")
        void flush() throws IOException {
            assertThat(run(":flush\n")).containsExactly("flushed");
        }

        @Test
        @DisplayName(":quit stops reading and kills the session")
        void quit() throws IOException {
            assertThat(run("p(a).\n:quit\np(b).\n")).containsExactly("[\"ok\"]");
            assertThat(repl.session().isAlive()).isFalse();
        }

        @Test
        @DisplayName("unknown commands are reported")
        void unknownCommand() throws IOException {
            assertThat(run(":help\n")).containsExactly("error[command]: unknown command ':help'");
        }
    }

    @Test
    @DisplayName("a runtime that fails to start ends the loop with status 1")
    void initializationFailure() throws IOException {
        EvaluationRuntime broken = new EvaluationRuntime() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public RuntimeInstance start(
                    CapabilityPolicy policy, MemoryLimit memoryLimit, OutputStream stdout, OutputStream stderr) {
                throw new IllegalStateException("no interpreter");
            }
        };
        var failing = new SandboxRepl(
                SessionFactory.builder().runtime(broken).build(),
                MemoryLimit.DEFAULT,
                policy,
                new BufferedReader(new StringReader("p(a).\n")),
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8),
                false);

        assertThat(failing.run()).isEqualTo(1);
        assertThat(outBytes.toString(StandardCharsets.UTF_8))
                .startsWith("error[initialization]: evaluation runtime 'broken' failed to start: no interpreter");
    }

    @Test
    @DisplayName("error types name each failure category")
    void errorTypes() {
        assertThat(SandboxRepl.errorType(new EvalSyntaxException("x", 1, 1))).isEqualTo("syntax");
        assertThat(SandboxRepl.errorType(new ResourceExhaustedException(2, 1))).isEqualTo("resource-exhausted");
        assertThat(SandboxRepl.errorType(new AccessDeniedException(AccessKind.EXECUTE, "ls")))
                .isEqualTo("access-denied:execute");
        assertThat(SandboxRepl.errorType(new InitializationException("x"))).isEqualTo("initialization");
    }
}
