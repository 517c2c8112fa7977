package io.github.riemr.roster.optimization.service;

import io.github.riemr.roster.domain.model.Absence;
import io.github.riemr.roster.domain.model.AbsenceType;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.PlanningSnapshot;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.StaffingBounds;
import io.github.riemr.roster.domain.model.ViolationSeverity;
import io.github.riemr.roster.optimization.constraint.LegacyMinimumHoursMode;
import io.github.riemr.roster.optimization.constraint.PenaltyFamily;
import io.github.riemr.roster.optimization.constraint.TeamRotationMode;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.problem.PlanningProblemFactory;
import io.github.riemr.roster.optimization.solution.PenaltySummary;
import io.github.riemr.roster.optimization.solution.SolutionExtractor;
import io.github.riemr.roster.optimization.solution.SolveResult;
import io.github.riemr.roster.optimization.solver.InfeasibilityFamily;
import io.github.riemr.roster.optimization.solver.InfeasibilityReason;
import io.github.riemr.roster.optimization.solver.SolveHandle;
import io.github.riemr.roster.optimization.solver.SolveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.github.riemr.roster.RosterFixtures.MONDAY;
import static io.github.riemr.roster.RosterFixtures.early;
import static io.github.riemr.roster.RosterFixtures.employee;
import static io.github.riemr.roster.RosterFixtures.employees;
import static io.github.riemr.roster.RosterFixtures.late;
import static io.github.riemr.roster.RosterFixtures.night;
import static io.github.riemr.roster.RosterFixtures.planningService;
import static io.github.riemr.roster.RosterFixtures.relief;
import static io.github.riemr.roster.RosterFixtures.rotation;
import static io.github.riemr.roster.RosterFixtures.team;
import static io.github.riemr.roster.RosterFixtures.testSettings;
import static org.assertj.core.api.Assertions.assertThat;

class ShiftPlanningServiceTest {

    ShiftPlanningService service;

    @BeforeEach
    void setup() {
        service = planningService();
    }

    /** Two weeks, six employees, one team covering the full rotation. */
    private PlanningSnapshot.PlanningSnapshotBuilder twoWeeks() {
        var members = employees(6);
        return PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(13))
                .employees(members)
                .shiftTypes(rotation())
                .team(team(1, members, "F", "S", "N"));
    }

    @Test
    void solve_staffsEveryShiftWithinBoundsWithoutDoubleBooking() {
        var snapshot = twoWeeks().build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.hasRoster()).isTrue();
        var problem = new PlanningProblemFactory().create(snapshot);
        for (CalendarDay day : problem.getDays()) {
            for (String code : day.activeShiftCodes()) {
                int staffed = result.scheduleView().get(day.date()).get(code).size();
                assertThat(problem.staffingFor(day, code).admits(staffed))
                        .as("%s %s staffed %d", day.date(), code, staffed).isTrue();
            }
        }
        var employeeDays = result.assignments().stream()
                .map(a -> a.employeeId() + "@" + a.date())
                .collect(Collectors.toList());
        assertThat(new HashSet<>(employeeDays)).hasSameSizeAs(employeeDays);
        assertThat(result.report().hasCriticalViolations()).isFalse();
        assertThat(result.report().isOptimal()).isTrue();
    }

    @Test
    void solve_avoidsRestTimeViolationsWhenStaffingAllows() {
        var result = service.solve(PlanningRequest.of(twoWeeks().build()));

        assertThat(result.report().getPenalties())
                .filteredOn(p -> p.family() == PenaltyFamily.REST_TIME)
                .allMatch(p -> p.violations() == 0);
        assertThat(result.report().getViolations()).noneMatch(v -> v.rule().equals("REST_TIME"));
    }

    @Test
    void solve_neverAssignsAbsentEmployees() {
        var snapshot = twoWeeks()
                .absence(Absence.of(1, AbsenceType.VACATION, MONDAY, MONDAY.plusDays(6)))
                .absence(Absence.ofCode(2, "EZ", MONDAY.plusDays(3), MONDAY.plusDays(4)))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.hasRoster()).isTrue();
        assertThat(result.assignments())
                .noneMatch(a -> a.employeeId() == 1 && a.date().isBefore(MONDAY.plusDays(7)))
                .noneMatch(a -> a.employeeId() == 2 && (a.date().equals(MONDAY.plusDays(3))
                        || a.date().equals(MONDAY.plusDays(4))));
        assertThat(result.completeGrid().get(1L).get(MONDAY)).isEqualTo("U");
        assertThat(result.completeGrid().get(2L).get(MONDAY.plusDays(3))).isEqualTo("EZ");
    }

    @Test
    void solve_reproducesFixedAssignments() {
        var fixed = List.of(new ShiftAssignment(3, MONDAY, "N"), new ShiftAssignment(4, MONDAY.plusDays(5), "F"));
        var snapshot = twoWeeks().fixedAssignments(fixed).build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.assignments()).containsAll(fixed);
    }

    @Test
    void solve_reportsStructuralShortfallWithoutSolving() {
        var members = employees(2);
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(1))
                .employees(members)
                .shiftType(early(StaffingBounds.of(3, 3)))
                .team(team(1, members, "F"))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.status()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.hasRoster()).isFalse();
        assertThat(result.assignments()).isEmpty();
        assertThat(result.report().getReasons()).extracting(InfeasibilityReason::family)
                .contains(InfeasibilityFamily.STAFFING_SHORTFALL, InfeasibilityFamily.HEADCOUNT_SHORTFALL);
        assertThat(result.report().getWallTimeSeconds()).isZero();
    }

    @Test
    void solve_diagnosesConflictingRules() {
        var members = employees(2);
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY)
                .employees(members)
                .shiftType(early(StaffingBounds.of(1, 1)))
                .team(team(1, members, "F"))
                .fixedAssignment(new ShiftAssignment(1, MONDAY, "F"))
                .fixedAssignment(new ShiftAssignment(2, MONDAY, "F"))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.status()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.report().getReasons()).extracting(InfeasibilityReason::family)
                .contains(InfeasibilityFamily.STAFFING_MAXIMUM, InfeasibilityFamily.FIXED_ASSIGNMENTS)
                .doesNotContain(InfeasibilityFamily.STAFFING_MINIMUM);
    }

    @Test
    void solve_returnsEmptyRosterWhenNobodyIsPlannable() {
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(2))
                .employee(employee(1))
                .shiftType(early(StaffingBounds.of(0, 2)))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.assignments()).isEmpty();
        assertThat(result.completeGrid().get(1L)).containsValue(SolutionExtractor.OFF).hasSize(3);
    }

    @Test
    void solve_respectsRestTimeAcrossPlanningPeriods() {
        var members = employees(2);
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY)
                .employees(members)
                .shiftType(early(StaffingBounds.of(1, 1)))
                .shiftType(night(StaffingBounds.of(0, 0)))
                .team(team(1, members, "F", "N"))
                .historyEntry(new ShiftAssignment(1, MONDAY.minusDays(1), "N"))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.assignments()).containsExactly(new ShiftAssignment(2, MONDAY, "F"));
    }

    @Test
    void solve_keepsOneReliefWorkerFree() {
        var regular = employee(1);
        var relief = List.of(relief(2), relief(3));
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY)
                .employee(regular).employees(relief)
                .shiftType(early(StaffingBounds.of(2, 3)))
                .team(team(1, List.of(regular, relief.get(0), relief.get(1)), "F"))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.assignments()).hasSize(2).contains(new ShiftAssignment(1, MONDAY, "F"));
        assertThat(penalty(result, PenaltyFamily.RELIEF_RESERVE)).isZero();
    }

    @Test
    void solve_reportsOverlongRunsAsSoftViolations() {
        var members = employees(1);
        ShiftType early = ShiftType.builder()
                .code("F").name("Early").start(LocalTime.of(6, 0)).end(LocalTime.of(14, 0)).hours(8.0)
                .weekdayStaffing(StaffingBounds.of(1, 1)).weekendStaffing(StaffingBounds.of(1, 1))
                .weeklyHoursCeiling(60.0)
                .build();
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(7))
                .employees(members)
                .shiftType(early)
                .team(team(1, members, "F"))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.assignments()).hasSize(8);
        assertThat(penalty(result, PenaltyFamily.CONSECUTIVE_DAYS)).isEqualTo(2);
        assertThat(result.report().getViolations())
                .anyMatch(v -> v.rule().equals("CONSECUTIVE_DAYS") && v.severity() == ViolationSeverity.WARNING);
    }

    @Test
    void solve_enforcesWeeklyHoursCeiling() {
        var members = employees(2);
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(6))
                .employees(members)
                .shiftType(early(StaffingBounds.of(1, 1)))
                .team(team(1, members, "F"))
                .build();

        var result = service.solve(PlanningRequest.of(snapshot));

        assertThat(result.hasRoster()).isTrue();
        Map<Long, Long> shiftsPerEmployee = result.assignments().stream()
                .collect(Collectors.groupingBy(ShiftAssignment::employeeId, Collectors.counting()));
        assertThat(shiftsPerEmployee.values()).allMatch(n -> n * 8 <= 48);
    }

    @Test
    void solve_isDeterministicForIdenticalInput() {
        var snapshot = twoWeeks().build();

        var first = service.solve(PlanningRequest.of(snapshot));
        var second = service.solve(PlanningRequest.of(snapshot));

        assertThat(second.assignments()).isEqualTo(first.assignments());
        assertThat(second.report().getObjective()).isEqualTo(first.report().getObjective());
    }

    @Test
    void solve_returnsWithoutSearchWhenCancelledUpFront() {
        var handle = new SolveHandle();
        handle.cancel();

        var result = service.solve(PlanningRequest.of(twoWeeks().build()), handle);

        assertThat(result.status()).isEqualTo(SolveStatus.TIMEOUT);
        assertThat(result.report().isCancelled()).isTrue();
        assertThat(result.hasRoster()).isFalse();
        assertThat(handle.getStatus()).isEqualTo(SolveStatus.TIMEOUT);
    }

    @Test
    void solve_stopsPromptlyWhenCancelledDuringSearch() throws Exception {
        var members = employees(24);
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(27))
                .employees(members)
                .shiftTypes(List.of(early(StaffingBounds.of(3, 5)), night(StaffingBounds.of(2, 3)),
                        late(StaffingBounds.of(3, 5))))
                .team(team(1, members.subList(0, 12), "F", "S", "N"))
                .team(team(2, members.subList(12, 24), "F", "S", "N"))
                .build();
        var settings = testSettings().toBuilder().timeLimit(Duration.ofSeconds(60)).numWorkers(2).build();
        var handle = new SolveHandle();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(handle::cancel, 2, TimeUnit.SECONDS);
            long started = System.nanoTime();

            var result = service.solve(PlanningRequest.builder().snapshot(snapshot).settings(settings).build(), handle);

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(30));
            assertThat(result.status()).isIn(SolveStatus.OPTIMAL, SolveStatus.FEASIBLE, SolveStatus.TIMEOUT);
            assertThat(handle.getStatus()).isEqualTo(result.status());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void solve_fillsNominalWeeklyHoursWhenLegacyRuleIsSoft() {
        var members = employees(1);
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(6))
                .employees(members)
                .shiftType(early(StaffingBounds.of(0, 1)))
                .team(team(1, members, "F"))
                .build();
        var settings = testSettings().toBuilder().legacyMinimumHours(LegacyMinimumHoursMode.SOFT).build();

        var result = service.solve(PlanningRequest.builder().snapshot(snapshot).settings(settings).build());

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.assignments()).hasSizeBetween(5, 6);
        assertThat(penalty(result, PenaltyFamily.LEGACY_MINIMUM_HOURS)).isZero();
    }

    @Test
    void solve_proratesHardWeeklyMinimumForAbsenceDays() {
        var members = employees(1);
        var snapshot = PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(6))
                .employees(members)
                .shiftType(early(StaffingBounds.of(0, 1)))
                .team(team(1, members, "F"))
                .absence(Absence.of(1, AbsenceType.SICK, MONDAY, MONDAY.plusDays(2)))
                .build();
        var settings = testSettings().toBuilder().legacyMinimumHours(LegacyMinimumHoursMode.HARD).build();

        var result = service.solve(PlanningRequest.builder().snapshot(snapshot).settings(settings).build());

        // 40h * 4/7 available days rounds up to three shifts
        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.assignments()).hasSizeGreaterThanOrEqualTo(3)
                .allMatch(a -> !a.date().isBefore(MONDAY.plusDays(3)));
    }

    /**
     * Monday needs one early shift. Employee 1 comes off a late shift, employee 2 off an early shift
     * that allows no second day in a row; employee 1 is away on Tuesday.
     */
    private static PlanningSnapshot restOrRunConflict() {
        var members = employees(2);
        ShiftType early = ShiftType.builder()
                .code("F").name("Early").start(LocalTime.of(6, 0)).end(LocalTime.of(14, 0)).hours(8.0)
                .weekdayStaffing(StaffingBounds.of(1, 1)).weekendStaffing(StaffingBounds.of(1, 1))
                .maxConsecutiveDays(1)
                .build();
        return PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(1))
                .employees(members)
                .shiftType(early)
                .shiftType(late(StaffingBounds.of(0, 0)))
                .team(team(1, members, "F", "S"))
                .historyEntry(new ShiftAssignment(1, MONDAY.minusDays(1), "S"))
                .historyEntry(new ShiftAssignment(2, MONDAY.minusDays(1), "F"))
                .absence(Absence.of(1, AbsenceType.VACATION, MONDAY.plusDays(1), MONDAY.plusDays(1)))
                .build();
    }

    @Test
    void solve_restViolationsNeverGrowWhenRestTimeWeightRises() {
        var snapshot = restOrRunConflict();

        long relaxed = restViolations(snapshot, WeightTable.defaults()
                .withOverrides(Map.of(PenaltyFamily.REST_TIME, 150_000L)));
        long standard = restViolations(snapshot, WeightTable.defaults());
        long raised = restViolations(snapshot, WeightTable.defaults()
                .withOverrides(Map.of(PenaltyFamily.REST_TIME, 10_000_000L)));

        // one short rest is cheaper than two overlong runs only under the lowered weight
        assertThat(relaxed).isEqualTo(1);
        assertThat(standard).isZero();
        assertThat(raised).isZero();
        assertThat(relaxed).isGreaterThanOrEqualTo(standard);
        assertThat(standard).isGreaterThanOrEqualTo(raised);
    }

    private long restViolations(PlanningSnapshot snapshot, WeightTable weights) {
        var result = service.solve(PlanningRequest.builder().snapshot(snapshot).weights(weights).build());
        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        return penalty(result, PenaltyFamily.REST_TIME);
    }

    /** Two weeks, three teams of two, each team able to work every shift type. */
    private static PlanningSnapshot threeTeams() {
        var members = employees(6);
        var shifts = List.of(early(StaffingBounds.of(1, 2)), late(StaffingBounds.of(1, 2)),
                night(StaffingBounds.of(1, 2)));
        return PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(13))
                .employees(members)
                .shiftTypes(shifts)
                .team(team(1, members.subList(0, 2), "F", "S", "N"))
                .team(team(2, members.subList(2, 4), "F", "S", "N"))
                .team(team(3, members.subList(4, 6), "F", "S", "N"))
                .build();
    }

    @Test
    void solve_rotatesTeamsWeeklyWhenRotationIsHard() {
        var settings = testSettings().toBuilder().teamRotation(TeamRotationMode.HARD).build();

        var result = service.solve(PlanningRequest.builder().snapshot(threeTeams()).settings(settings).build());

        assertThat(result.status()).isIn(SolveStatus.OPTIMAL, SolveStatus.FEASIBLE);
        Map<Long, Map<LocalDate, Set<String>>> codes = new TreeMap<>();
        for (ShiftAssignment a : result.assignments()) {
            long teamId = (a.employeeId() + 1) / 2;
            codes.computeIfAbsent(teamId, k -> new TreeMap<>())
                    .computeIfAbsent(PlanningProblem.weekStartOf(a.date()), k -> new TreeSet<>())
                    .add(a.shiftCode());
        }
        Map<String, String> successor = Map.of("F", "N", "N", "S", "S", "F");
        assertThat(codes).hasSize(3);
        codes.forEach((teamId, weeks) -> {
            assertThat(weeks.values()).as("team %d", teamId).allMatch(week -> week.size() == 1);
            String first = weeks.get(MONDAY).iterator().next();
            assertThat(weeks.get(MONDAY.plusDays(7))).as("team %d", teamId).containsExactly(successor.get(first));
        });
        assertThat(result.report().getViolations()).noneMatch(v -> v.rule().equals("TEAM_ROTATION"));
    }

    /** One team of two has to staff an early and a late shift on the same day. */
    private static PlanningSnapshot teamSplitAcrossShifts() {
        var members = employees(2);
        return PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY)
                .employees(members)
                .shiftType(early(StaffingBounds.of(1, 1)))
                .shiftType(late(StaffingBounds.of(1, 1)))
                .team(team(1, members, "F", "S"))
                .build();
    }

    @Test
    void solve_namesTeamRotationWhenItMakesTheRosterImpossible() {
        var settings = testSettings().toBuilder().teamRotation(TeamRotationMode.HARD).build();

        var result = service.solve(PlanningRequest.builder()
                .snapshot(teamSplitAcrossShifts()).settings(settings).build());

        assertThat(result.status()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.report().getReasons()).extracting(InfeasibilityReason::family)
                .contains(InfeasibilityFamily.TEAM_ROTATION);
    }

    @Test
    void solve_penalisesBrokenTeamWeeksWhenRotationIsSoft() {
        var settings = testSettings().toBuilder().teamRotation(TeamRotationMode.SOFT).build();

        var result = service.solve(PlanningRequest.builder()
                .snapshot(teamSplitAcrossShifts()).settings(settings).build());

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.assignments()).hasSize(2);
        assertThat(penalty(result, PenaltyFamily.TEAM_ROTATION)).isEqualTo(1);
        assertThat(result.report().getViolations())
                .anyMatch(v -> v.rule().equals("TEAM_ROTATION") && v.severity() == ViolationSeverity.WARNING);
    }

    /** Four employees, the first two qualified for the day duty. */
    private static PlanningSnapshot.PlanningSnapshotBuilder dayDutyTeam(int days) {
        var members = List.of(qualified(1), qualified(2), employee(3), employee(4));
        return PlanningSnapshot.builder()
                .start(MONDAY).end(MONDAY.plusDays(days - 1))
                .employees(members)
                .shiftType(early(StaffingBounds.of(1, 2)))
                .team(team(1, members, "F"));
    }

    private static Employee qualified(long id) {
        return Employee.builder().id(id).name("Employee " + id).dayDutyQualified(true).build();
    }

    @Test
    void solve_assignsOneQualifiedDayDutyPerWeek() {
        var settings = testSettings().toBuilder().dayDutyEnabled(true).build();

        var result = service.solve(PlanningRequest.builder().snapshot(dayDutyTeam(5).build()).settings(settings).build());

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.dayDuties()).containsOnlyKeys(MONDAY);
        assertThat(result.dayDuties().get(MONDAY)).isIn(1L, 2L);
        assertThat(result.report().getViolations()).noneMatch(v -> v.rule().equals("DAY_DUTY"));
    }

    @Test
    void solve_skipsDayDutyCandidatesAbsentDuringTheWeek() {
        var settings = testSettings().toBuilder().dayDutyEnabled(true).build();
        var snapshot = dayDutyTeam(5)
                .absence(Absence.of(1, AbsenceType.TRAINING, MONDAY.plusDays(2), MONDAY.plusDays(2)))
                .build();

        var result = service.solve(PlanningRequest.builder().snapshot(snapshot).settings(settings).build());

        assertThat(result.dayDuties()).containsEntry(MONDAY, 2L);
    }

    @Test
    void solve_sharesDayDutiesAmongQualifiedEmployees() {
        var settings = testSettings().toBuilder().dayDutyEnabled(true).build();

        var result = service.solve(PlanningRequest.builder().snapshot(dayDutyTeam(12).build()).settings(settings).build());

        assertThat(result.status()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.dayDuties()).containsOnlyKeys(MONDAY, MONDAY.plusDays(7));
        assertThat(new HashSet<>(result.dayDuties().values())).containsExactlyInAnyOrder(1L, 2L);
    }

    private static long penalty(SolveResult result, PenaltyFamily family) {
        return result.report().getPenalties().stream()
                .filter(p -> p.family() == family)
                .mapToLong(PenaltySummary::violations)
                .sum();
    }
}
