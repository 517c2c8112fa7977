package io.github.riemr.roster.optimization.solver;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one solve: {@code BUILT -> SOLVING -> terminal}. A terminal status never changes.
 */
public enum SolveStatus {
    BUILT,
    SOLVING,
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    TIMEOUT,
    ERROR;

    private static final Set<SolveStatus> TERMINAL = EnumSet.of(OPTIMAL, FEASIBLE, INFEASIBLE, TIMEOUT, ERROR);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(SolveStatus next) {
        return switch (this) {
            case BUILT -> next == SOLVING || next.isTerminal();
            case SOLVING -> next.isTerminal();
            default -> false;
        };
    }
}
