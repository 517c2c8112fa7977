package io.github.riemr.roster.optimization.service;

import io.github.riemr.roster.domain.model.Absence;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.RosterViolation;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.StaffingBounds;
import io.github.riemr.roster.domain.model.Team;
import io.github.riemr.roster.domain.model.ViolationSeverity;
import io.github.riemr.roster.optimization.constraint.RestTimeRules;
import io.github.riemr.roster.optimization.constraint.RotationPattern;
import io.github.riemr.roster.optimization.constraint.ShiftTransition;
import io.github.riemr.roster.optimization.constraint.TeamRotationMode;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Re-checks a concrete roster against all rules, independent of the model that produced it.
 * Works for solver output as well as for manually edited rosters.
 */
@Service
@Slf4j
public class RosterValidationService {

    public List<RosterViolation> validate(PlanningProblem problem, List<ShiftAssignment> assignments,
                                          SolverSettings settings) {
        List<RosterViolation> violations = new ArrayList<>();

        Map<Long, Map<LocalDate, String>> worked = new HashMap<>();
        List<ShiftAssignment> known = new ArrayList<>();
        for (ShiftAssignment a : assignments) {
            if (!checkAssignment(problem, a, violations)) {
                continue;
            }
            known.add(a);
            String previous = worked.computeIfAbsent(a.employeeId(), k -> new HashMap<>()).put(a.date(), a.shiftCode());
            if (previous != null) {
                violations.add(critical("ONE_SHIFT_PER_DAY", a.employeeId(), a.date(),
                        "Employee " + a.employeeId() + " works " + previous + " and " + a.shiftCode() + " on " + a.date()));
            }
        }
        checkStaffing(problem, known, violations);
        checkFixedAssignments(problem, assignments, violations);

        Map<Long, Map<LocalDate, String>> timeline = withHistory(problem, worked);
        checkWeeklyCeiling(problem, timeline, violations);
        checkRestTime(problem, timeline, settings, violations);
        checkConsecutiveDays(problem, timeline, violations);
        if (settings.getTeamRotation() != TeamRotationMode.DISABLED) {
            checkTeamRotation(problem, worked, settings, violations);
        }

        if (!violations.isEmpty()) {
            log.info("Roster validation found {} violations ({} critical)", violations.size(),
                    violations.stream().filter(v -> v.severity() == ViolationSeverity.CRITICAL).count());
        }
        return violations;
    }

    /** @return false when the assignment names an employee or shift type the problem does not know */
    private boolean checkAssignment(PlanningProblem problem, ShiftAssignment a, List<RosterViolation> violations) {
        Employee e = problem.getEmployeesById().get(a.employeeId());
        if (e == null || !problem.hasShiftType(a.shiftCode())) {
            violations.add(critical("UNKNOWN_REFERENCE", a.employeeId(), a.date(),
                    "Assignment references unknown employee " + a.employeeId() + " or shift type " + a.shiftCode()));
            return false;
        }
        Optional<Absence> absence = problem.absenceOn(a.employeeId(), a.date());
        if (absence.isPresent()) {
            violations.add(critical("ABSENCE_BLOCKING", a.employeeId(), a.date(),
                    "Employee " + a.employeeId() + " is absent (" + absence.get().displayCode() + ") on " + a.date()));
        }
        boolean eligible = e.isActive() && problem.teamOf(a.employeeId()).map(t -> t.covers(a.shiftCode())).orElse(false);
        if (!eligible) {
            violations.add(critical("TEAM_ELIGIBILITY", a.employeeId(), a.date(),
                    "Employee " + a.employeeId() + " may not work shift " + a.shiftCode()));
        }
        boolean active = problem.day(a.date()).map(d -> d.isActive(a.shiftCode())).orElse(false);
        if (!active) {
            violations.add(critical("SHIFT_NOT_STAFFED", a.employeeId(), a.date(),
                    "Shift " + a.shiftCode() + " is not staffed on " + a.date()));
        }
        return true;
    }

    private void checkStaffing(PlanningProblem problem, List<ShiftAssignment> assignments,
                               List<RosterViolation> violations) {
        Map<LocalDate, Map<String, Integer>> staffed = new HashMap<>();
        for (ShiftAssignment a : assignments) {
            staffed.computeIfAbsent(a.date(), k -> new HashMap<>()).merge(a.shiftCode(), 1, Integer::sum);
        }
        for (CalendarDay day : problem.getDays()) {
            for (String code : day.activeShiftCodes()) {
                StaffingBounds bounds = problem.staffingFor(day, code);
                int count = staffed.getOrDefault(day.date(), Map.of()).getOrDefault(code, 0);
                if (!bounds.admits(count)) {
                    violations.add(critical(count < bounds.min() ? "STAFFING_MINIMUM" : "STAFFING_MAXIMUM", null,
                            day.date(), "Shift " + code + " on " + day.date() + " has " + count + " employees, expected "
                                    + bounds));
                }
            }
        }
    }

    private void checkFixedAssignments(PlanningProblem problem, List<ShiftAssignment> assignments,
                                       List<RosterViolation> violations) {
        Set<ShiftAssignment> present = new HashSet<>(assignments);
        for (ShiftAssignment f : problem.getFixedAssignments()) {
            if (!present.contains(f)) {
                violations.add(critical("FIXED_ASSIGNMENTS", f.employeeId(), f.date(),
                        "Fixed shift " + f.shiftCode() + " of employee " + f.employeeId() + " on " + f.date()
                                + " is missing"));
            }
        }
    }

    /** Published history merged with the roster, per employee. */
    private static Map<Long, Map<LocalDate, String>> withHistory(PlanningProblem problem,
                                                                 Map<Long, Map<LocalDate, String>> worked) {
        Map<Long, Map<LocalDate, String>> timeline = new HashMap<>();
        for (ShiftAssignment h : problem.getHistory()) {
            timeline.computeIfAbsent(h.employeeId(), k -> new HashMap<>()).put(h.date(), h.shiftCode());
        }
        worked.forEach((id, days) -> timeline.computeIfAbsent(id, k -> new HashMap<>()).putAll(days));
        return timeline;
    }

    private void checkWeeklyCeiling(PlanningProblem problem, Map<Long, Map<LocalDate, String>> timeline,
                                    List<RosterViolation> violations) {
        Set<LocalDate> weeks = problem.horizonWeeks().keySet();
        timeline.forEach((employeeId, days) -> {
            if (problem.teamOf(employeeId).isEmpty()) {
                return;
            }
            double ceiling = problem.weeklyHoursCeilingOf(employeeId);
            Map<LocalDate, Double> hoursByWeek = new HashMap<>();
            days.forEach((date, code) -> hoursByWeek.merge(PlanningProblem.weekStartOf(date),
                    problem.shiftType(code).getHours(), Double::sum));
            hoursByWeek.forEach((monday, hours) -> {
                if (weeks.contains(monday) && hours > ceiling) {
                    violations.add(critical("WEEKLY_HOURS_CEILING", employeeId, monday,
                            "Employee " + employeeId + " works " + hours + "h in week of " + monday
                                    + ", ceiling " + ceiling + "h"));
                }
            });
        });
    }

    private void checkRestTime(PlanningProblem problem, Map<Long, Map<LocalDate, String>> timeline,
                               SolverSettings settings, List<RosterViolation> violations) {
        Set<ShiftTransition> forbidden = new HashSet<>(RestTimeRules.forbiddenTransitions(
                problem.getShiftTypes(), settings.getForbiddenTransitions(), settings.getMinRestHours()));
        timeline.forEach((employeeId, days) -> days.forEach((date, code) -> {
            String previous = days.get(date.minusDays(1));
            if (previous != null && problem.isInHorizon(date) && forbidden.contains(new ShiftTransition(previous, code))) {
                violations.add(warning("REST_TIME", employeeId, date,
                        "Employee " + employeeId + " works " + previous + " then " + code + " on " + date
                                + " with too little rest"));
            }
        }));
    }

    /** One violation per run that is longer than allowed and reaches into the horizon. */
    private void checkConsecutiveDays(PlanningProblem problem, Map<Long, Map<LocalDate, String>> timeline,
                                      List<RosterViolation> violations) {
        timeline.forEach((employeeId, days) -> days.forEach((date, code) -> {
            if (code.equals(days.get(date.minusDays(1)))) {
                return;
            }
            ShiftType st = problem.shiftType(code);
            LocalDate last = date;
            while (code.equals(days.get(last.plusDays(1)))) {
                last = last.plusDays(1);
            }
            long length = last.toEpochDay() - date.toEpochDay() + 1;
            if (length > st.getMaxConsecutiveDays() && !last.isBefore(problem.getStart())) {
                violations.add(warning("CONSECUTIVE_DAYS", employeeId, date,
                        "Employee " + employeeId + " works " + code + " on " + length + " consecutive days from "
                                + date + ", at most " + st.getMaxConsecutiveDays() + " allowed"));
            }
        }));
    }

    /**
     * Checks the weekly day duty: every week with weekdays in the horizon is held by a qualified employee
     * who is present on all of them.
     *
     * @param dayDuties Monday of each week to the employee holding its duty
     * @return CRITICAL for an uncovered or wrongly held duty, WARNING where nobody could hold it
     */
    public List<RosterViolation> validateDayDuties(PlanningProblem problem, Map<LocalDate, Long> dayDuties) {
        List<RosterViolation> violations = new ArrayList<>();
        problem.dayDutyWeeks().forEach((monday, weekdays) -> {
            Set<Long> available = new HashSet<>();
            problem.dayDutyCandidates(weekdays).forEach(e -> available.add(e.getId()));
            Long holder = dayDuties.get(monday);
            if (holder == null && available.isEmpty()) {
                violations.add(warning("DAY_DUTY", null, monday,
                        "No qualified employee is available for the day duty of week " + monday));
            } else if (holder == null) {
                violations.add(critical("DAY_DUTY", null, monday, "Day duty of week " + monday + " is uncovered"));
            } else if (!available.contains(holder)) {
                violations.add(critical("DAY_DUTY", holder, monday,
                        "Employee " + holder + " is not qualified or not present for the day duty of week " + monday));
            }
        });
        return violations;
    }

    /**
     * Regular members of a team share one shift type per week, and the team's weeks follow the rotation
     * pattern. Weeks in which nobody of the team works are skipped.
     */
    private void checkTeamRotation(PlanningProblem problem, Map<Long, Map<LocalDate, String>> worked,
                                   SolverSettings settings, List<RosterViolation> violations) {
        RotationPattern pattern = RotationPattern.resolve(settings.getRotationPattern(), problem.getShiftTypes());
        ViolationSeverity severity = settings.getTeamRotation() == TeamRotationMode.HARD
                ? ViolationSeverity.CRITICAL : ViolationSeverity.WARNING;
        for (Team team : problem.getTeams()) {
            Map<LocalDate, Set<String>> codesByWeek = new LinkedHashMap<>();
            for (LocalDate monday : problem.horizonWeeks().keySet()) {
                codesByWeek.put(monday, new TreeSet<>());
            }
            for (Employee e : problem.plannableMembers(team)) {
                if (e.isRelief()) {
                    continue;
                }
                worked.getOrDefault(e.getId(), Map.of()).forEach((date, code) -> {
                    if (problem.isInHorizon(date)) {
                        codesByWeek.get(PlanningProblem.weekStartOf(date)).add(code);
                    }
                });
            }
            String previous = null;
            for (Map.Entry<LocalDate, Set<String>> week : codesByWeek.entrySet()) {
                Set<String> codes = week.getValue();
                if (codes.size() > 1) {
                    violations.add(new RosterViolation(severity, "TEAM_ROTATION", null, week.getKey(),
                            "Team " + team.getId() + " works " + codes + " in week of " + week.getKey()));
                }
                String current = codes.size() == 1 ? codes.iterator().next() : null;
                if (previous != null && current != null) {
                    Optional<String> expected = pattern.successorFor(team, previous);
                    if (expected.isPresent() && !expected.get().equals(current)) {
                        violations.add(new RosterViolation(severity, "TEAM_ROTATION", null, week.getKey(),
                                "Team " + team.getId() + " works " + current + " in week of " + week.getKey()
                                        + " after " + previous + ", rotation " + pattern + " expects " + expected.get()));
                    }
                }
                previous = current;
            }
        }
    }

    private static RosterViolation critical(String rule, Long employeeId, LocalDate date, String message) {
        return new RosterViolation(ViolationSeverity.CRITICAL, rule, employeeId, date, message);
    }

    private static RosterViolation warning(String rule, Long employeeId, LocalDate date, String message) {
        return new RosterViolation(ViolationSeverity.WARNING, rule, employeeId, date, message);
    }
}
