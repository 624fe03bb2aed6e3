package io.evalsandbox.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.evalsandbox.core.model.SessionId;
import io.evalsandbox.core.policy.AccessKind;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: the two-tier structure, common fields and session rebinding. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void sandboxExceptionIsAbstractAndRoot() {
        assertThat(SandboxException.class).isAbstract();
        assertThat(SandboxException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void evalExceptionIsAbstract() {
        assertThat(EvalException.class).isAbstract();
        assertThat(EvalException.class.getSuperclass()).isEqualTo(SandboxException.class);
    }

    @Test
    void initializationExceptionIsStartupPhase() {
        var cause = new IllegalStateException("missing");
        var ex = new InitializationException("failed", cause);

        assertThat(ex).isInstanceOf(SandboxException.class).isNotInstanceOf(EvalException.class);
        assertThat(ex.phase()).isEqualTo(SandboxException.Phase.STARTUP);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.sessionId()).isNull();
        assertThat(ex.detail()).isEqualTo("failed");
    }

    // --- Evaluation exceptions ---

    @Test
    void syntaxExceptionCarriesPosition() {
        var ex = new EvalSyntaxException("bad token", 3, 7);

        assertThat(ex.phase()).isEqualTo(SandboxException.Phase.EVALUATION);
        assertThat(ex.line()).isEqualTo(3);
        assertThat(ex.column()).isEqualTo(7);
        assertThat(ex.isTerminal()).isFalse();
    }

    @Test
    void accessDeniedMessageNamesKind() {
        for (AccessKind kind : AccessKind.values()) {
            var ex = new AccessDeniedException(kind, "target");

            assertThat(ex.getMessage()).contains(kind.label()).contains("target");
            assertThat(ex.kind()).isEqualTo(kind);
            assertThat(ex.isTerminal()).isFalse();
        }
    }

    @Test
    void resourceExhaustedIsTerminalAndMentionsOutOfMemory() {
        var ex = new ResourceExhaustedException(2048, 1024);

        assertThat(ex.isTerminal()).isTrue();
        assertThat(ex.getMessage()).startsWith("out of memory").contains("2048").contains("1024");
        assertThat(ex.limitBytes()).isEqualTo(1024);
    }

    @Test
    void terminatedIsTerminal() {
        assertThat(new TerminatedEvaluatorException().isTerminal()).isTrue();
        assertThat(new EvalRuntimeException("x").isTerminal()).isFalse();
    }

    // --- Session rebinding ---

    @Test
    void withSessionPreservesTypeAndMessage() {
        SessionId id = SessionId.next();

        EvalException rebound = new AccessDeniedException(AccessKind.WRITE, "/tmp/x").withSession(id);

        assertThat(rebound).isInstanceOf(AccessDeniedException.class);
        assertThat(rebound.sessionId()).isSameAs(id);
        assertThat(((AccessDeniedException) rebound).kind()).isEqualTo(AccessKind.WRITE);
        assertThat(rebound.getMessage()).isEqualTo("access denied: write of /tmp/x is not permitted");
    }

    @Test
    void withSessionKeepsExistingBinding() {
        SessionId first = SessionId.next();
        EvalException bound = new EvalRuntimeException("boom").withSession(first);

        assertThat(bound.withSession(SessionId.next())).isSameAs(bound);
    }

    @Test
    void terminatedBoundToSessionNamesIt() {
        SessionId id = SessionId.next();

        EvalException bound = new TerminatedEvaluatorException().withSession(id);

        assertThat(bound.getMessage()).isEqualTo("evaluator terminated: session " + id + " is dead");
    }

    @Test
    void sessionIdsCompareByIdentity() {
        SessionId a = SessionId.next();
        SessionId b = SessionId.next();

        assertThat(a).isEqualTo(a).isNotEqualTo(b);
        assertThat(b.sequence()).isGreaterThan(a.sequence());
    }
}
