package io.github.riemr.roster.optimization.solver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolveStatusTest {

    @Test
    void transitions_followLifecycle() {
        assertThat(SolveStatus.BUILT.canTransitionTo(SolveStatus.SOLVING)).isTrue();
        assertThat(SolveStatus.SOLVING.canTransitionTo(SolveStatus.TIMEOUT)).isTrue();
        assertThat(SolveStatus.SOLVING.canTransitionTo(SolveStatus.BUILT)).isFalse();
        for (SolveStatus terminal : SolveStatus.values()) {
            if (terminal.isTerminal()) {
                assertThat(terminal.canTransitionTo(SolveStatus.SOLVING)).isFalse();
                assertThat(terminal.canTransitionTo(SolveStatus.OPTIMAL)).isFalse();
            }
        }
    }

    @Test
    void handle_rejectsLeavingTerminalStatus() {
        var handle = new SolveHandle();
        handle.transitionTo(SolveStatus.SOLVING);
        handle.transitionTo(SolveStatus.INFEASIBLE);

        assertThat(handle.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThatThrownBy(() -> handle.transitionTo(SolveStatus.OPTIMAL)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void handle_remembersCancellation() {
        var handle = new SolveHandle();
        handle.cancel();
        handle.cancel();

        assertThat(handle.isCancelled()).isTrue();
        assertThat(handle.getStatus()).isEqualTo(SolveStatus.BUILT);
    }
}
