package io.github.riemr.roster.optimization.constraint;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.StaffingBounds;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import io.github.riemr.roster.optimization.variable.VariableRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adds the rules no roster may break. Absence blocking and team eligibility need no constraint:
 * the candidates for them were never created.
 */
@Component
@Slf4j
public class HardConstraintBuilder {

    /**
     * Adds every active hard rule family except the relaxed ones.
     *
     * @param model    target model
     * @param problem  the validated problem
     * @param vars     variables created for this model
     * @param settings decide which optional families are active
     * @param relaxed  families left out while diagnosing an infeasible model
     * @return number of constraints added per family
     */
    public Map<HardConstraintFamily, Integer> build(CpModel model,
                                                    PlanningProblem problem,
                                                    VariableRegistry vars,
                                                    SolverSettings settings,
                                                    Set<HardConstraintFamily> relaxed) {
        Map<HardConstraintFamily, Integer> counts = new EnumMap<>(HardConstraintFamily.class);

        counts.put(HardConstraintFamily.ONE_SHIFT_PER_DAY, addOneShiftPerDay(model, problem, vars));
        if (!relaxed.contains(HardConstraintFamily.STAFFING_MINIMUM)
                || !relaxed.contains(HardConstraintFamily.STAFFING_MAXIMUM)) {
            addStaffing(model, problem, vars, relaxed, counts);
        }
        if (!relaxed.contains(HardConstraintFamily.WEEKLY_HOURS_CEILING)) {
            counts.put(HardConstraintFamily.WEEKLY_HOURS_CEILING, addWeeklyCeiling(model, problem, vars));
        }
        if (!relaxed.contains(HardConstraintFamily.FIXED_ASSIGNMENTS)) {
            counts.put(HardConstraintFamily.FIXED_ASSIGNMENTS, addFixedAssignments(model, problem, vars));
        }
        if (settings.getLegacyMinimumHours() == LegacyMinimumHoursMode.HARD
                && !relaxed.contains(HardConstraintFamily.LEGACY_MINIMUM_HOURS)) {
            counts.put(HardConstraintFamily.LEGACY_MINIMUM_HOURS, addLegacyMinimumHours(model, problem, vars));
        }
        if (settings.getTeamRotation() == TeamRotationMode.HARD
                && !relaxed.contains(HardConstraintFamily.TEAM_ROTATION)) {
            RotationPattern pattern = RotationPattern.resolve(settings.getRotationPattern(), problem.getShiftTypes());
            counts.put(HardConstraintFamily.TEAM_ROTATION, addTeamRotation(model, problem, vars, pattern));
        }
        if (settings.isDayDutyEnabled()) {
            counts.put(HardConstraintFamily.DAY_DUTY, addDayDuty(model, problem, vars));
        }

        counts.forEach((family, n) -> log.debug("Hard constraints {}: {}", family, n));
        if (!relaxed.isEmpty()) {
            log.debug("Relaxed hard constraint families: {}", relaxed);
        }
        return counts;
    }

    // ===== one shift per day =====

    /**
     * At most one shift per employee and day.
     *
     * @return number of constraints added
     */
    private int addOneShiftPerDay(CpModel model, PlanningProblem problem, VariableRegistry vars) {
        int n = 0;
        for (Employee e : problem.getPlannableEmployees()) {
            for (CalendarDay day : problem.getDays()) {
                List<BoolVar> daily = vars.assignmentsOf(e.getId(), day.date());
                if (daily.size() > 1) {
                    model.addLessOrEqual(LinearExpr.sum(daily.toArray(new BoolVar[0])), 1);
                    n++;
                }
            }
        }
        return n;
    }

    // ===== staffing =====

    /**
     * Minimum and maximum head count of every active shift on every day. A maximum no roster can exceed
     * is left out.
     *
     * @param relaxed the staffing family left out, if any
     * @param counts  receives the count of both staffing families
     */
    private void addStaffing(CpModel model, PlanningProblem problem, VariableRegistry vars,
                             Set<HardConstraintFamily> relaxed, Map<HardConstraintFamily, Integer> counts) {
        int minimums = 0;
        int maximums = 0;
        for (CalendarDay day : problem.getDays()) {
            for (String code : day.activeShiftCodes()) {
                StaffingBounds bounds = problem.staffingFor(day, code);
                List<AssignmentCandidate> candidates = problem.candidatesFor(day.date(), code);
                LinearExpr staffed = LinearExpr.sum(candidates.stream().map(vars::assignment).toArray(BoolVar[]::new));
                if (!relaxed.contains(HardConstraintFamily.STAFFING_MINIMUM) && bounds.min() > 0) {
                    model.addGreaterOrEqual(staffed, bounds.min());
                    minimums++;
                }
                if (!relaxed.contains(HardConstraintFamily.STAFFING_MAXIMUM) && candidates.size() > bounds.max()) {
                    model.addLessOrEqual(staffed, bounds.max());
                    maximums++;
                }
            }
        }
        counts.put(HardConstraintFamily.STAFFING_MINIMUM, minimums);
        counts.put(HardConstraintFamily.STAFFING_MAXIMUM, maximums);
    }

    // ===== working hours =====

    /**
     * Hours of one ISO week, published lookback shifts of the same week included, stay under the
     * employee's weekly ceiling. Weeks that cannot reach the ceiling get no constraint.
     *
     * @return number of constraints added
     */
    private int addWeeklyCeiling(CpModel model, PlanningProblem problem, VariableRegistry vars) {
        int n = 0;
        Map<LocalDate, List<LocalDate>> weeks = problem.horizonWeeks();
        for (Employee e : problem.getPlannableEmployees()) {
            long ceiling = Math.round(problem.weeklyHoursCeilingOf(e.getId()) * ShiftType.HOUR_SCALE);
            for (Map.Entry<LocalDate, List<LocalDate>> week : weeks.entrySet()) {
                long carried = carriedOverHours(problem, e.getId(), week.getKey());
                LinearExprBuilder hours = LinearExpr.newBuilder();
                long maxPossible = carried;
                for (LocalDate date : week.getValue()) {
                    long busiest = 0;
                    for (ShiftType st : problem.getShiftTypes()) {
                        if (problem.hasCandidate(e.getId(), date, st.getCode())) {
                            hours.addTerm(vars.assignment(new AssignmentCandidate(e.getId(), date, st.getCode())),
                                    st.scaledHours());
                            busiest = Math.max(busiest, st.scaledHours());
                        }
                    }
                    maxPossible += busiest;
                }
                if (maxPossible <= ceiling) {
                    continue;
                }
                hours.add(carried);
                model.addLessOrEqual(hours, ceiling);
                n++;
            }
        }
        return n;
    }

    /**
     * @return scaled hours the employee already worked in the history part of the week
     */
    private static long carriedOverHours(PlanningProblem problem, long employeeId, LocalDate monday) {
        long carried = 0;
        for (ShiftAssignment h : problem.getHistory()) {
            if (h.employeeId() == employeeId && PlanningProblem.weekStartOf(h.date()).equals(monday)) {
                carried += problem.shiftType(h.shiftCode()).scaledHours();
            }
        }
        return carried;
    }

    /**
     * Worked hours of every full horizon week reach the pro-rated nominal target.
     *
     * @return number of constraints added
     */
    private int addLegacyMinimumHours(CpModel model, PlanningProblem problem, VariableRegistry vars) {
        int n = 0;
        for (Employee e : problem.getPlannableEmployees()) {
            for (Map.Entry<LocalDate, List<LocalDate>> week : problem.horizonWeeks().entrySet()) {
                if (!problem.isFullWeek(week.getKey())) {
                    continue;
                }
                long target = WeeklyHourTargets.scaledTarget(problem, e.getId(), week.getValue());
                if (target <= 0) {
                    continue;
                }
                model.addGreaterOrEqual(WeeklyHourTargets.workedHours(problem, vars, e.getId(), week.getValue()), target);
                n++;
            }
        }
        return n;
    }

    // ===== manual planning =====

    /**
     * Every retained fixed assignment is part of the roster.
     *
     * @return number of constraints added
     */
    private int addFixedAssignments(CpModel model, PlanningProblem problem, VariableRegistry vars) {
        int n = 0;
        for (ShiftAssignment f : problem.getFixedAssignments()) {
            model.addEquality(vars.assignment(new AssignmentCandidate(f.employeeId(), f.date(), f.shiftCode())), 1);
            n++;
        }
        return n;
    }

    // ===== team rotation =====

    /**
     * Regular team members only work the team's shift type of the week, and a team's shift type of one
     * week determines the next week's through the rotation pattern.
     *
     * @param pattern resolved rotation order
     * @return number of constraints added
     */
    private int addTeamRotation(CpModel model, PlanningProblem problem, VariableRegistry vars,
                                RotationPattern pattern) {
        int n = 0;
        for (AssignmentCandidate c : problem.getCandidates()) {
            Optional<BoolVar> teamWeek = TeamWeekLinks.teamWeekOf(problem, vars, c);
            if (teamWeek.isPresent()) {
                model.addImplication(vars.assignment(c), teamWeek.get());
                n++;
            }
        }
        for (TeamWeekLinks.RotationStep step : TeamWeekLinks.rotationSteps(problem, vars, pattern)) {
            model.addImplication(step.current(), step.next());
            n++;
        }
        return n;
    }

    // ===== day duty =====

    /**
     * Exactly one available qualified employee holds the day duty of each week with weekdays in the
     * horizon. Weeks without such an employee stay uncovered.
     *
     * @return number of constraints added
     */
    private int addDayDuty(CpModel model, PlanningProblem problem, VariableRegistry vars) {
        int n = 0;
        for (LocalDate monday : problem.dayDutyWeeks().keySet()) {
            Map<Long, BoolVar> duties = vars.dayDutiesOf(monday);
            if (duties.isEmpty()) {
                log.warn("No qualified employee available for the day duty of week {}", monday);
                continue;
            }
            model.addExactlyOne(duties.values().toArray(new BoolVar[0]));
            n++;
        }
        return n;
    }
}
