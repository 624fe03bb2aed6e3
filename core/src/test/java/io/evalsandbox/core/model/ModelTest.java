package io.evalsandbox.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the small value types in the model package. */
class ModelTest {

    @Nested
    class MemoryLimits {

        @Test
        void defaultIsSixteenMebibytes() {
            assertThat(MemoryLimit.DEFAULT.bytes()).isEqualTo(16L * 1024 * 1024);
            assertThat(MemoryLimit.ofMebibytes(16)).isEqualTo(MemoryLimit.DEFAULT);
        }

        @Test
        void nonPositiveRejected() {
            assertThatThrownBy(() -> MemoryLimit.ofBytes(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("memory limit must be positive, got: 0");
            assertThatThrownBy(() -> new MemoryLimit(-1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class SessionIds {

        @Test
        void sequenceIsMonotonic() {
            SessionId first = SessionId.next();
            SessionId second = SessionId.next();

            assertThat(second.sequence()).isGreaterThan(first.sequence());
            assertThat(second.toString()).isEqualTo("session-" + second.sequence());
        }

        @Test
        void equalityIsIdentity() {
            SessionId id = SessionId.next();

            assertThat(id).isEqualTo(id).isNotEqualTo(SessionId.next());
        }
    }

    @Test
    void onlyDeadIsNotAlive() {
        assertThat(SessionState.READY.isAlive()).isTrue();
        assertThat(SessionState.EVALUATING.isAlive()).isTrue();
        assertThat(SessionState.DEAD.isAlive()).isFalse();
    }
}
