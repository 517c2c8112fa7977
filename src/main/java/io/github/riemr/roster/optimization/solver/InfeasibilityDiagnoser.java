package io.github.riemr.roster.optimization.solver;

import io.github.riemr.roster.optimization.constraint.HardConstraintFamily;
import io.github.riemr.roster.optimization.constraint.LegacyMinimumHoursMode;
import io.github.riemr.roster.optimization.constraint.TeamRotationMode;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Locates the rule family behind a proven infeasibility by re-solving with one relaxable
 * family dropped at a time. The report never relaxes anything in the returned roster.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InfeasibilityDiagnoser {

    private final RosterModelBuilder modelBuilder;
    private final CpSatSolverDriver driver;

    public List<InfeasibilityReason> diagnose(PlanningProblem problem, SolverSettings settings, WeightTable weights,
                                              SolveHandle handle) {
        if (settings.getDiagnosticTimeLimit().isZero()) {
            return List.of(InfeasibilityReason.global(InfeasibilityFamily.UNDETERMINED,
                    "No rule family could be isolated: diagnosis disabled"));
        }
        List<InfeasibilityReason> reasons = new ArrayList<>();
        boolean undetermined = false;
        String undeterminedMessage = "Diagnosis ran out of time";
        for (HardConstraintFamily family : HardConstraintFamily.values()) {
            if (!family.isRelaxable() || !isActive(family, settings)) {
                continue;
            }
            if (handle.isCancelled()) {
                // untested families allow no conclusion about a combined conflict
                undetermined = true;
                undeterminedMessage = "Diagnosis cancelled before " + family + " was checked";
                break;
            }
            RosterModel relaxed = modelBuilder.build(problem, settings, weights, EnumSet.of(family), false);
            // a private handle keeps the caller's status untouched
            SolverRun run = driver.solve(relaxed, settings, settings.diagnosticTimeLimitSeconds(), new SolveHandle());
            if (run.hasSolution()) {
                reasons.add(InfeasibilityReason.global(InfeasibilityFamily.of(family),
                        "A roster exists once " + family + " is dropped"));
            } else if (run.status() == SolveStatus.TIMEOUT) {
                undetermined = true;
            }
        }
        if (reasons.isEmpty()) {
            reasons.add(InfeasibilityReason.global(
                    undetermined ? InfeasibilityFamily.UNDETERMINED : InfeasibilityFamily.COMBINED,
                    undetermined ? undeterminedMessage
                            : "Dropping a single rule family does not restore feasibility"));
        }
        log.info("Infeasibility diagnosis: {}", reasons);
        return reasons;
    }

    /** Families switched off by the settings were never part of the model and cannot explain a conflict. */
    private static boolean isActive(HardConstraintFamily family, SolverSettings settings) {
        return switch (family) {
            case LEGACY_MINIMUM_HOURS -> settings.getLegacyMinimumHours() == LegacyMinimumHoursMode.HARD;
            case TEAM_ROTATION -> settings.getTeamRotation() == TeamRotationMode.HARD;
            default -> true;
        };
    }
}
