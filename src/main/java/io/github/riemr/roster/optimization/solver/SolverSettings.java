package io.github.riemr.roster.optimization.solver;

import io.github.riemr.roster.optimization.constraint.LegacyMinimumHoursMode;
import io.github.riemr.roster.optimization.constraint.ShiftTransition;
import io.github.riemr.roster.optimization.constraint.TeamRotationMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;

/**
 * Immutable tuning for one solve. Built once from {@code roster.solver.*} or handed in by the caller.
 */
@Value
@Builder(toBuilder = true)
public class SolverSettings {

    @Builder.Default
    Duration timeLimit = Duration.ofSeconds(30);
    @Builder.Default
    int numWorkers = 8;
    @Builder.Default
    int randomSeed = 0;
    /** Budget of each re-solve done while diagnosing an infeasible model. */
    @Builder.Default
    Duration diagnosticTimeLimit = Duration.ofSeconds(5);
    @Builder.Default
    int minRestHours = 11;
    /** Explicit forbidden transitions; when empty they are derived from shift times and {@link #minRestHours}. */
    @Singular
    List<ShiftTransition> forbiddenTransitions;
    @Builder.Default
    LegacyMinimumHoursMode legacyMinimumHours = LegacyMinimumHoursMode.DISABLED;
    @Builder.Default
    boolean reliefReserveEnabled = true;
    @Builder.Default
    TeamRotationMode teamRotation = TeamRotationMode.DISABLED;
    /** Weekly order of team shift types; the week after the last code starts over with the first. */
    @Builder.Default
    List<String> rotationPattern = List.of("F", "N", "S");
    /** Plan one day duty per week among qualified employees. */
    @Builder.Default
    boolean dayDutyEnabled = false;

    public static SolverSettings defaults() {
        return SolverSettings.builder().build();
    }

    /** Rejects settings the solver cannot run with; a solve without a time budget is never started. */
    public void validate() {
        if (timeLimit == null || timeLimit.isZero() || timeLimit.isNegative()) {
            throw new IllegalArgumentException("Solver time limit must be positive: " + timeLimit);
        }
        if (diagnosticTimeLimit == null || diagnosticTimeLimit.isNegative()) {
            throw new IllegalArgumentException("Diagnostic time limit must not be negative: " + diagnosticTimeLimit);
        }
        if (numWorkers < 1) {
            throw new IllegalArgumentException("Solver needs at least one worker: " + numWorkers);
        }
        if (minRestHours < 0) {
            throw new IllegalArgumentException("Minimum rest hours must not be negative: " + minRestHours);
        }
        if (legacyMinimumHours == null) {
            throw new IllegalArgumentException("Legacy minimum hours mode is required");
        }
        if (teamRotation == null) {
            throw new IllegalArgumentException("Team rotation mode is required");
        }
        if (teamRotation != TeamRotationMode.DISABLED) {
            if (rotationPattern == null || rotationPattern.size() < 2) {
                throw new IllegalArgumentException("Rotation pattern needs at least two shift codes: " + rotationPattern);
            }
            if (new HashSet<>(rotationPattern).size() != rotationPattern.size()) {
                throw new IllegalArgumentException("Rotation pattern repeats a shift code: " + rotationPattern);
            }
        }
    }

    public double timeLimitSeconds() {
        return timeLimit.toMillis() / 1000.0;
    }

    public double diagnosticTimeLimitSeconds() {
        return diagnosticTimeLimit.toMillis() / 1000.0;
    }
}
