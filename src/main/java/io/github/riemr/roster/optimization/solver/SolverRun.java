package io.github.riemr.roster.optimization.solver;

import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.Literal;

/**
 * Outcome of one CP-SAT invocation. Values can only be read when {@link #hasSolution()} is true.
 */
public record SolverRun(SolveStatus status,
                        boolean hasSolution,
                        boolean cancelled,
                        double objective,
                        double bestBound,
                        double wallTimeSeconds,
                        CpSolver solver) {

    public boolean booleanValue(Literal literal) {
        requireSolution();
        return solver.booleanValue(literal);
    }

    public long value(IntVar variable) {
        requireSolution();
        return solver.value(variable);
    }

    private void requireSolution() {
        if (!hasSolution) {
            throw new IllegalStateException("Solver run with status " + status + " has no solution");
        }
    }
}
