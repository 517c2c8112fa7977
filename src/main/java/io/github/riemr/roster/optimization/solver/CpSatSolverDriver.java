package io.github.riemr.roster.optimization.solver;

import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import io.github.riemr.roster.exception.SolverInternalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Invokes CP-SAT with a mandatory time budget and maps its status.
 * <table>
 *   <tr><td>OPTIMAL</td><td>OPTIMAL</td></tr>
 *   <tr><td>FEASIBLE</td><td>TIMEOUT, or FEASIBLE after cancellation</td></tr>
 *   <tr><td>UNKNOWN</td><td>TIMEOUT without roster</td></tr>
 *   <tr><td>INFEASIBLE</td><td>INFEASIBLE</td></tr>
 *   <tr><td>MODEL_INVALID</td><td>{@link SolverInternalException}</td></tr>
 * </table>
 */
@Component
@Slf4j
public class CpSatSolverDriver {

    public SolverRun solve(RosterModel model, SolverSettings settings, double timeLimitSeconds, SolveHandle handle) {
        if (!(timeLimitSeconds > 0)) {
            throw new IllegalArgumentException("Time limit must be positive: " + timeLimitSeconds);
        }
        String invalid = model.model().validate();
        if (!invalid.isEmpty()) {
            throw new SolverInternalException("CP-SAT rejected the model: " + invalid);
        }

        CpSolver solver = new CpSolver();
        solver.getParameters()
                .setMaxTimeInSeconds(timeLimitSeconds)
                .setNumWorkers(settings.getNumWorkers())
                .setRandomSeed(settings.getRandomSeed())
                .setLogSearchProgress(false);

        if (handle.isCancelled()) {
            log.info("Solve cancelled before CP-SAT started");
            return new SolverRun(SolveStatus.TIMEOUT, false, true, Double.NaN, Double.NaN, 0.0, solver);
        }

        CpSolverStatus status;
        handle.attach(solver);
        try {
            log.info("CP-SAT solve started (limit {}s, {} workers, seed {})",
                    timeLimitSeconds, settings.getNumWorkers(), settings.getRandomSeed());
            status = solver.solve(model.model());
        } catch (RuntimeException | LinkageError e) {
            throw new SolverInternalException("CP-SAT failed: " + e.getMessage(), e);
        } finally {
            handle.detach();
        }

        boolean cancelled = handle.isCancelled();
        SolverRun run = switch (status) {
            case OPTIMAL -> new SolverRun(SolveStatus.OPTIMAL, true, cancelled,
                    solver.objectiveValue(), solver.bestObjectiveBound(), solver.wallTime(), solver);
            case FEASIBLE -> new SolverRun(cancelled ? SolveStatus.FEASIBLE : SolveStatus.TIMEOUT, true, cancelled,
                    solver.objectiveValue(), solver.bestObjectiveBound(), solver.wallTime(), solver);
            case INFEASIBLE -> new SolverRun(SolveStatus.INFEASIBLE, false, cancelled,
                    Double.NaN, Double.NaN, solver.wallTime(), solver);
            case UNKNOWN -> new SolverRun(SolveStatus.TIMEOUT, false, cancelled,
                    Double.NaN, Double.NaN, solver.wallTime(), solver);
            case MODEL_INVALID -> throw new SolverInternalException("CP-SAT reported MODEL_INVALID");
            default -> throw new SolverInternalException("Unexpected CP-SAT status " + status);
        };

        if (run.status() == SolveStatus.TIMEOUT) {
            log.warn("CP-SAT stopped at the time limit after {}s: {} (incumbent: {})",
                    String.format("%.2f", run.wallTimeSeconds()), status, run.hasSolution());
        } else {
            log.info("CP-SAT finished: {} -> {} in {}s, objective {}, bound {}", status, run.status(),
                    String.format("%.2f", run.wallTimeSeconds()), run.objective(), run.bestBound());
        }
        return run;
    }
}
