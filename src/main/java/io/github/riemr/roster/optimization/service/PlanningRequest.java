package io.github.riemr.roster.optimization.service;

import io.github.riemr.roster.domain.model.PlanningSnapshot;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import lombok.Builder;
import lombok.Value;

/**
 * Input of one solve. Weights and settings left {@code null} fall back to the configured defaults.
 */
@Value
@Builder
public class PlanningRequest {
    PlanningSnapshot snapshot;
    String scope;
    WeightTable weights;
    SolverSettings settings;

    public static PlanningRequest of(PlanningSnapshot snapshot) {
        return PlanningRequest.builder().snapshot(snapshot).build();
    }

    public ProblemKey key() {
        return new ProblemKey(snapshot.getStart(), snapshot.getEnd(), scope);
    }
}
