package io.github.riemr.roster.optimization.solution;

import io.github.riemr.roster.domain.model.RosterViolation;
import io.github.riemr.roster.domain.model.ViolationSeverity;
import io.github.riemr.roster.optimization.service.ProblemKey;
import io.github.riemr.roster.optimization.solver.InfeasibilityReason;
import io.github.riemr.roster.optimization.solver.SolveStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class SolveReport {
    ProblemKey key;
    SolveStatus status;
    /** Proven optimal. */
    boolean optimal;
    boolean cancelled;
    @Singular
    List<InfeasibilityReason> reasons;
    /** {@code null} when no roster was found or no objective exists. */
    Double objective;
    Double bestBound;
    double wallTimeSeconds;
    @Singular
    List<PenaltySummary> penalties;
    @Singular
    List<RosterViolation> violations;
    String errorMessage;

    public boolean hasCriticalViolations() {
        return violations.stream().anyMatch(v -> v.severity() == ViolationSeverity.CRITICAL);
    }
}
