package io.github.riemr.roster.optimization.solution;

import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.optimization.solver.SolveStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything a solve returns. The three roster views are derived from one read of the solver values.
 *
 * @param scheduleView day, then shift code, then employee ids in planning order
 * @param completeGrid employee, then day: shift code, absence code or {@link SolutionExtractor#OFF}
 * @param dayDuties    Monday of each week to the employee holding its day duty
 */
public record SolveResult(SolveStatus status,
                          List<ShiftAssignment> assignments,
                          Map<LocalDate, Map<String, List<Long>>> scheduleView,
                          Map<Long, Map<LocalDate, String>> completeGrid,
                          Map<LocalDate, Long> dayDuties,
                          SolveReport report) {

    public static SolveResult withoutRoster(SolveReport report) {
        return new SolveResult(report.getStatus(), List.of(), Map.of(), Map.of(), Map.of(), report);
    }

    public boolean hasRoster() {
        return switch (status) {
            case OPTIMAL, FEASIBLE -> true;
            // a timeout without incumbent carries no views
            case TIMEOUT -> !scheduleView.isEmpty();
            default -> false;
        };
    }
}
