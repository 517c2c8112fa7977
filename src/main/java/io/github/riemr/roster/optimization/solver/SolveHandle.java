package io.github.riemr.roster.optimization.solver;

import com.google.ortools.sat.CpSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller-side view of a running solve: current status and cooperative cancellation.
 * Safe to use from any thread. A cancelled solve still returns its best incumbent.
 */
@Slf4j
public class SolveHandle {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<CpSolver> solver = new AtomicReference<>();
    private final AtomicReference<SolveStatus> status = new AtomicReference<>(SolveStatus.BUILT);

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested (status {})", status.get());
            CpSolver running = solver.get();
            if (running != null) {
                running.stopSearch();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public SolveStatus getStatus() {
        return status.get();
    }

    void attach(CpSolver cpSolver) {
        solver.set(cpSolver);
        // cancel() may have run before the solver existed
        if (cancelled.get()) {
            cpSolver.stopSearch();
        }
    }

    void detach() {
        solver.set(null);
    }

    public void transitionTo(SolveStatus next) {
        SolveStatus current = status.get();
        if (current == next) {
            return;
        }
        if (!current.canTransitionTo(next) || !status.compareAndSet(current, next)) {
            throw new IllegalStateException("Illegal solve status transition " + current + " -> " + next);
        }
    }
}
