package io.github.riemr.roster.optimization.variable;

import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import io.github.riemr.roster.domain.model.Absence;
import io.github.riemr.roster.domain.model.AbsenceType;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.PlanningSnapshot;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.problem.PlanningProblemFactory;
import io.github.riemr.roster.optimization.constraint.TeamRotationMode;
import io.github.riemr.roster.optimization.solver.CpSatNativeLoader;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.riemr.roster.RosterFixtures.MONDAY;
import static io.github.riemr.roster.RosterFixtures.employee;
import static io.github.riemr.roster.RosterFixtures.employees;
import static io.github.riemr.roster.RosterFixtures.relief;
import static io.github.riemr.roster.RosterFixtures.rotation;
import static io.github.riemr.roster.RosterFixtures.team;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionVariableFabricTest {

    @BeforeAll
    static void loadNative() {
        CpSatNativeLoader.ensureLoaded();
    }

    private PlanningProblem problem() {
        var members = employees(2);
        return new PlanningProblemFactory().create(PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(2))
                .employees(members)
                .shiftTypes(rotation())
                .team(team(1, members, "F", "S"))
                .historyEntry(new ShiftAssignment(1, MONDAY.minusDays(1), "S"))
                .build());
    }

    @Test
    void build_createsIndicatorForEveryEmployeeDayAndShiftType() {
        var problem = problem();
        var registry = new DecisionVariableFabric().build(new CpModel(), problem, SolverSettings.defaults());

        int days = problem.getDays().size() + problem.getLookbackDays().size();
        assertThat(registry.assignmentCount()).isEqualTo(problem.getCandidates().size()).isEqualTo(2 * 3 * 2);
        assertThat(registry.indicatorCount()).isEqualTo(2 * days * 3);
        // lookback indicators plus the night shift the team never covers
        assertThat(registry.pinnedCount()).isEqualTo(2 * problem.getLookbackDays().size() * 3 + 2 * 3);
        assertThat(registry.isPinnedTrue(1, MONDAY.minusDays(1), "S")).isTrue();
        assertThat(registry.isPinnedFalse(2, MONDAY.minusDays(1), "S")).isTrue();
        assertThat(registry.isPinnedFalse(1, MONDAY, "N")).isTrue();
        assertThat(registry.isPinnedFalse(1, MONDAY, "F")).isFalse();
    }

    @Test
    void build_linksIndicatorToItsAssignment() {
        var problem = problem();
        var model = new CpModel();
        var registry = new DecisionVariableFabric().build(model, problem, SolverSettings.defaults());
        model.addEquality(registry.assignment(new AssignmentCandidate(2, MONDAY, "S")), 1);
        model.addEquality(registry.assignment(new AssignmentCandidate(2, MONDAY, "F")), 0);

        var solver = new CpSolver();
        solver.getParameters().setNumWorkers(1);
        var status = solver.solve(model);

        assertThat(status).isIn(CpSolverStatus.OPTIMAL, CpSolverStatus.FEASIBLE);
        assertThat(solver.booleanValue(registry.worksShift(2, MONDAY, "S"))).isTrue();
        assertThat(solver.booleanValue(registry.worksShift(2, MONDAY, "F"))).isFalse();
        assertThat(solver.booleanValue(registry.worksShift(1, MONDAY.minusDays(1), "S"))).isTrue();
    }

    @Test
    void assignment_rejectsUnknownCandidate() {
        var registry = new DecisionVariableFabric().build(new CpModel(), problem(), SolverSettings.defaults());

        assertThatThrownBy(() -> registry.assignment(new AssignmentCandidate(1, MONDAY, "N")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_createsTeamWeekShiftsOnlyWhenRotationIsOn() {
        var problem = problem();

        var off = new DecisionVariableFabric().build(new CpModel(), problem, SolverSettings.defaults());
        var on = new DecisionVariableFabric().build(new CpModel(), problem,
                SolverSettings.builder().teamRotation(TeamRotationMode.SOFT).build());

        assertThat(off.teamShiftCount()).isZero();
        // one week, the two shift types the team covers
        assertThat(on.teamShiftCount()).isEqualTo(2);
        assertThat(on.teamShift(1, MONDAY, "F")).isPresent();
        assertThat(on.teamShift(1, MONDAY, "N")).isEmpty();
    }

    @Test
    void build_skipsTeamWeekShiftsOfReliefOnlyTeams() {
        var floaters = List.of(relief(1), relief(2));
        var problem = new PlanningProblemFactory().create(PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY)
                .employees(floaters)
                .shiftTypes(rotation())
                .team(team(1, floaters, "F", "S"))
                .build());

        var registry = new DecisionVariableFabric().build(new CpModel(), problem,
                SolverSettings.builder().teamRotation(TeamRotationMode.HARD).build());

        assertThat(registry.teamShiftCount()).isZero();
    }

    @Test
    void build_offersDayDutyOnlyToQualifiedEmployeesPresentAllWeek() {
        Employee qualified = Employee.builder().id(3).name("Qualified").dayDutyQualified(true).build();
        Employee absentQualified = Employee.builder().id(4).name("Away").dayDutyQualified(true).build();
        var members = employees(2);
        var problem = new PlanningProblemFactory().create(PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(2))
                .employees(members)
                .employee(qualified)
                .employee(absentQualified)
                .employee(employee(5))
                .shiftTypes(rotation())
                .team(team(1, members, "F", "S"))
                .absence(Absence.of(4, AbsenceType.TRAINING, MONDAY.plusDays(1), MONDAY.plusDays(1)))
                .build());

        var registry = new DecisionVariableFabric().build(new CpModel(), problem,
                SolverSettings.builder().dayDutyEnabled(true).build());

        assertThat(registry.dayDutiesOf(MONDAY)).containsOnlyKeys(3L);
    }
}
