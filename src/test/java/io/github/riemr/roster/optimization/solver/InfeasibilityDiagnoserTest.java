package io.github.riemr.roster.optimization.solver;

import io.github.riemr.roster.domain.model.PlanningSnapshot;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.domain.model.StaffingBounds;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.problem.PlanningProblemFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.github.riemr.roster.RosterFixtures.MONDAY;
import static io.github.riemr.roster.RosterFixtures.early;
import static io.github.riemr.roster.RosterFixtures.employees;
import static io.github.riemr.roster.RosterFixtures.modelBuilder;
import static io.github.riemr.roster.RosterFixtures.team;
import static io.github.riemr.roster.RosterFixtures.testSettings;
import static org.assertj.core.api.Assertions.assertThat;

class InfeasibilityDiagnoserTest {

    InfeasibilityDiagnoser diagnoser;
    PlanningProblem problem;

    @BeforeEach
    void setup() {
        diagnoser = new InfeasibilityDiagnoser(modelBuilder(), new CpSatSolverDriver());
        // two fixed early shifts against a maximum of one
        var members = employees(2);
        problem = new PlanningProblemFactory().create(PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY)
                .employees(members)
                .shiftType(early(StaffingBounds.of(1, 1)))
                .team(team(1, members, "F"))
                .fixedAssignment(new ShiftAssignment(1, MONDAY, "F"))
                .fixedAssignment(new ShiftAssignment(2, MONDAY, "F"))
                .build());
    }

    @Test
    void diagnose_namesEveryFamilyWhoseRemovalRestoresFeasibility() {
        var reasons = diagnoser.diagnose(problem, testSettings(), WeightTable.defaults(), new SolveHandle());

        assertThat(reasons).extracting(InfeasibilityReason::family)
                .containsExactlyInAnyOrder(InfeasibilityFamily.STAFFING_MAXIMUM, InfeasibilityFamily.FIXED_ASSIGNMENTS);
    }

    @Test
    void diagnose_isUndeterminedWhenCancelledBeforeAnyCheck() {
        var handle = new SolveHandle();
        handle.cancel();

        var reasons = diagnoser.diagnose(problem, testSettings(), WeightTable.defaults(), handle);

        assertThat(reasons).extracting(InfeasibilityReason::family)
                .containsExactly(InfeasibilityFamily.UNDETERMINED);
        assertThat(reasons.get(0).message()).contains("cancelled");
    }

    @Test
    void diagnose_isUndeterminedWhenDisabled() {
        var settings = testSettings().toBuilder().diagnosticTimeLimit(Duration.ZERO).build();

        var reasons = diagnoser.diagnose(problem, settings, WeightTable.defaults(), new SolveHandle());

        assertThat(reasons).extracting(InfeasibilityReason::family)
                .containsExactly(InfeasibilityFamily.UNDETERMINED);
    }
}
