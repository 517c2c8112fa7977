package io.github.riemr.roster.optimization.constraint;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.Team;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import io.github.riemr.roster.optimization.variable.VariableRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adds the preferences a roster should satisfy and registers one penalty term per possible violation.
 * <p>
 * Violation indicators of rest time, consecutive days and team rotation are the exact conjunction of
 * their literals, so they are true exactly when the roster breaks the rule.
 */
@Component
@Slf4j
public class SoftConstraintBuilder {

    /**
     * Adds every active soft rule family.
     *
     * @param model    target model
     * @param problem  the validated problem
     * @param vars     variables created for this model
     * @param settings decide which optional families are active
     * @param weights  weight of each family
     * @return all penalty terms, ready for the objective
     */
    public PenaltyPool build(CpModel model,
                             PlanningProblem problem,
                             VariableRegistry vars,
                             SolverSettings settings,
                             WeightTable weights) {
        PenaltyPool pool = new PenaltyPool();
        List<LocalDate> timeline = timeline(problem);

        List<ShiftTransition> forbidden = RestTimeRules.forbiddenTransitions(
                problem.getShiftTypes(), settings.getForbiddenTransitions(), settings.getMinRestHours());
        log.debug("Forbidden shift transitions: {}", forbidden);

        addRestTime(model, problem, vars, timeline, forbidden, weights.weightOf(PenaltyFamily.REST_TIME), pool);
        addConsecutiveDays(model, problem, vars, timeline, weights.weightOf(PenaltyFamily.CONSECUTIVE_DAYS), pool);
        addFairness(model, problem, vars, weights.weightOf(PenaltyFamily.FAIRNESS), pool);
        if (settings.isDayDutyEnabled()) {
            addDayDutyFairness(model, problem, vars, weights.weightOf(PenaltyFamily.FAIRNESS), pool);
        }
        if (settings.getLegacyMinimumHours() == LegacyMinimumHoursMode.SOFT) {
            addLegacyMinimumHours(model, problem, vars, weights.weightOf(PenaltyFamily.LEGACY_MINIMUM_HOURS), pool);
        }
        if (settings.isReliefReserveEnabled()) {
            addReliefReserve(model, problem, vars, weights.weightOf(PenaltyFamily.RELIEF_RESERVE), pool);
        }
        if (settings.getTeamRotation() == TeamRotationMode.SOFT) {
            RotationPattern pattern = RotationPattern.resolve(settings.getRotationPattern(), problem.getShiftTypes());
            addTeamRotation(model, problem, vars, pattern, weights.weightOf(PenaltyFamily.TEAM_ROTATION), pool);
        }

        log.info("Soft constraints: {} penalty terms {}", pool.size(), pool.countByFamily());
        return pool;
    }

    /** Lookback days followed by horizon days, without gaps. */
    private static List<LocalDate> timeline(PlanningProblem problem) {
        List<LocalDate> dates = new ArrayList<>(problem.getLookbackDays());
        for (CalendarDay d : problem.getDays()) {
            dates.add(d.date());
        }
        return dates;
    }

    // ===== rest time =====

    /**
     * One indicator per employee, adjacent day pair and forbidden transition, the last lookback day
     * included. Pairs that cannot both be worked are skipped.
     *
     * @param timeline  lookback and horizon days
     * @param forbidden transitions leaving too little rest
     */
    private void addRestTime(CpModel model, PlanningProblem problem, VariableRegistry vars, List<LocalDate> timeline,
                             List<ShiftTransition> forbidden, long weight, PenaltyPool pool) {
        for (Employee e : problem.getPlannableEmployees()) {
            for (int i = 1; i < timeline.size(); i++) {
                LocalDate prev = timeline.get(i - 1);
                LocalDate next = timeline.get(i);
                if (!problem.isInHorizon(next)) {
                    continue;
                }
                for (ShiftTransition t : forbidden) {
                    if (vars.isPinnedFalse(e.getId(), prev, t.from()) || vars.isPinnedFalse(e.getId(), next, t.to())) {
                        continue;
                    }
                    BoolVar violation = model.newBoolVar("rest_e" + e.getId() + "_" + prev + "_" + t.from() + "_" + t.to());
                    exactAnd(model, violation, List.of(
                            vars.worksShift(e.getId(), prev, t.from()),
                            vars.worksShift(e.getId(), next, t.to())));
                    pool.add(PenaltyFamily.REST_TIME, violation.getName(), violation, weight, 1);
                }
            }
        }
    }

    // ===== consecutive days =====

    /**
     * One indicator per employee, shift type and window of {@code maxConsecutiveDays + 1} days ending in
     * the horizon. Windows containing a day that cannot be worked are skipped.
     *
     * @param timeline lookback and horizon days
     */
    private void addConsecutiveDays(CpModel model, PlanningProblem problem, VariableRegistry vars,
                                    List<LocalDate> timeline, long weight, PenaltyPool pool) {
        int firstHorizonIndex = problem.getLookbackDays().size();
        for (Employee e : problem.getPlannableEmployees()) {
            for (ShiftType st : problem.getShiftTypes()) {
                int window = st.getMaxConsecutiveDays() + 1;
                for (int from = 0; from + window <= timeline.size(); from++) {
                    int to = from + window - 1;
                    if (to < firstHorizonIndex) {
                        continue;
                    }
                    List<BoolVar> members = new ArrayList<>(window);
                    boolean possible = true;
                    for (int i = from; i <= to && possible; i++) {
                        LocalDate date = timeline.get(i);
                        possible = !vars.isPinnedFalse(e.getId(), date, st.getCode());
                        members.add(vars.worksShift(e.getId(), date, st.getCode()));
                    }
                    if (!possible) {
                        continue;
                    }
                    BoolVar violation = model.newBoolVar("run_e" + e.getId() + "_" + st.getCode() + "_" + timeline.get(from));
                    exactAnd(model, violation, members);
                    pool.add(PenaltyFamily.CONSECUTIVE_DAYS, violation.getName(), violation, weight, 1);
                }
            }
        }
    }

    // ===== fairness =====

    /**
     * Shift count balance inside every team with at least two plannable members.
     */
    private void addFairness(CpModel model, PlanningProblem problem, VariableRegistry vars, long weight,
                             PenaltyPool pool) {
        Map<Long, List<BoolVar>> shiftsByMember = new HashMap<>();
        for (Map.Entry<AssignmentCandidate, BoolVar> entry : vars.getAssignmentVars().entrySet()) {
            shiftsByMember.computeIfAbsent(entry.getKey().employeeId(), k -> new ArrayList<>()).add(entry.getValue());
        }
        for (Team team : problem.getTeams()) {
            Map<Long, List<BoolVar>> group = new LinkedHashMap<>();
            for (Employee e : problem.plannableMembers(team)) {
                group.put(e.getId(), shiftsByMember.getOrDefault(e.getId(), List.of()));
            }
            addDeviations(model, group, problem.getDays().size(), "fair_e", weight, pool);
        }
    }

    /**
     * Day duty count balance among the qualified employees who could take at least one duty.
     */
    private void addDayDutyFairness(CpModel model, PlanningProblem problem, VariableRegistry vars, long weight,
                                    PenaltyPool pool) {
        Map<Long, List<BoolVar>> dutiesByEmployee = new LinkedHashMap<>();
        for (LocalDate monday : problem.dayDutyWeeks().keySet()) {
            vars.dayDutiesOf(monday).forEach((employeeId, duty) ->
                    dutiesByEmployee.computeIfAbsent(employeeId, k -> new ArrayList<>()).add(duty));
        }
        addDeviations(model, dutiesByEmployee, problem.dayDutyWeeks().size(), "fair_td_e", weight, pool);
    }

    /**
     * Deviation of each member's count from the group mean, scaled by the group size to stay integral:
     * {@code D_e >= |n * C_e - sum C|}. Groups of fewer than two members get no term.
     *
     * @param group       counted literals per member
     * @param maxPerMember largest count one member can reach
     * @param prefix      variable name prefix
     */
    private static void addDeviations(CpModel model, Map<Long, List<BoolVar>> group, int maxPerMember, String prefix,
                                      long weight, PenaltyPool pool) {
        int n = group.size();
        if (n < 2) {
            return;
        }
        for (Long member : group.keySet()) {
            LinearExprBuilder above = LinearExpr.newBuilder();
            LinearExprBuilder below = LinearExpr.newBuilder();
            group.forEach((other, literals) -> {
                long coefficient = other.equals(member) ? n - 1 : -1;
                for (BoolVar literal : literals) {
                    above.addTerm(literal, coefficient);
                    below.addTerm(literal, -coefficient);
                }
            });
            long upper = (long) (n - 1) * maxPerMember;
            IntVar deviation = model.newIntVar(0, upper, prefix + member);
            model.addGreaterOrEqual(deviation, above);
            model.addGreaterOrEqual(deviation, below);
            pool.add(PenaltyFamily.FAIRNESS, deviation.getName(), deviation, weight, upper);
        }
    }

    // ===== working hours =====

    /**
     * Shortfall in whole hours below the pro-rated nominal target of every full horizon week.
     */
    private void addLegacyMinimumHours(CpModel model, PlanningProblem problem, VariableRegistry vars, long weight,
                                       PenaltyPool pool) {
        for (Employee e : problem.getPlannableEmployees()) {
            for (Map.Entry<LocalDate, List<LocalDate>> week : problem.horizonWeeks().entrySet()) {
                if (!problem.isFullWeek(week.getKey())) {
                    continue;
                }
                long target = WeeklyHourTargets.scaledTarget(problem, e.getId(), week.getValue());
                if (target <= 0) {
                    continue;
                }
                long maxShortfall = (target + ShiftType.HOUR_SCALE - 1) / ShiftType.HOUR_SCALE;
                IntVar shortfall = model.newIntVar(0, maxShortfall, "short_e" + e.getId() + "_" + week.getKey());
                LinearExprBuilder covered = LinearExpr.newBuilder()
                        .add(WeeklyHourTargets.workedHours(problem, vars, e.getId(), week.getValue()))
                        .addTerm(shortfall, ShiftType.HOUR_SCALE);
                model.addGreaterOrEqual(covered, target);
                pool.add(PenaltyFamily.LEGACY_MINIMUM_HOURS, shortfall.getName(), shortfall, weight, maxShortfall);
            }
        }
    }

    // ===== relief reserve =====

    /**
     * At least one relief worker should stay free on every day. Needs two or more plannable relief
     * workers; days on which one of them cannot work anyway are skipped.
     */
    private void addReliefReserve(CpModel model, PlanningProblem problem, VariableRegistry vars, long weight,
                                  PenaltyPool pool) {
        List<Employee> relief = problem.getPlannableEmployees().stream().filter(Employee::isRelief).toList();
        if (relief.size() < 2) {
            return;
        }
        for (CalendarDay day : problem.getDays()) {
            LinearExprBuilder working = LinearExpr.newBuilder();
            boolean allCanWork = true;
            for (Employee e : relief) {
                List<BoolVar> daily = vars.assignmentsOf(e.getId(), day.date());
                if (daily.isEmpty()) {
                    allCanWork = false;
                    break;
                }
                for (BoolVar v : daily) {
                    working.addTerm(v, 1);
                }
            }
            if (!allCanWork) {
                continue;
            }
            BoolVar violation = model.newBoolVar("relief_" + day.date());
            working.addTerm(violation, -1);
            model.addLessOrEqual(working, relief.size() - 1);
            pool.add(PenaltyFamily.RELIEF_RESERVE, violation.getName(), violation, weight, 1);
        }
    }

    // ===== team rotation =====

    /**
     * One indicator per regular member's candidate off the team's shift type of the week, and one per
     * team week whose successor week breaks the rotation pattern.
     *
     * @param pattern resolved rotation order
     */
    private void addTeamRotation(CpModel model, PlanningProblem problem, VariableRegistry vars,
                                 RotationPattern pattern, long weight, PenaltyPool pool) {
        for (AssignmentCandidate c : problem.getCandidates()) {
            Optional<BoolVar> teamWeek = TeamWeekLinks.teamWeekOf(problem, vars, c);
            if (teamWeek.isEmpty()) {
                continue;
            }
            BoolVar violation = model.newBoolVar("offteam_" + c);
            exactAnd(model, violation, List.of(vars.assignment(c), teamWeek.get().not()));
            pool.add(PenaltyFamily.TEAM_ROTATION, violation.getName(), violation, weight, 1);
        }
        for (TeamWeekLinks.RotationStep step : TeamWeekLinks.rotationSteps(problem, vars, pattern)) {
            BoolVar violation = model.newBoolVar(
                    "rot_t" + step.team().getId() + "_" + step.monday() + "_" + step.shiftCode());
            exactAnd(model, violation, List.of(step.current(), step.next().not()));
            pool.add(PenaltyFamily.TEAM_ROTATION, violation.getName(), violation, weight, 1);
        }
    }

    /** {@code result <=> AND(members)}. */
    static void exactAnd(CpModel model, BoolVar result, List<? extends Literal> members) {
        Literal[] clause = new Literal[members.size() + 1];
        for (int i = 0; i < members.size(); i++) {
            model.addImplication(result, members.get(i));
            clause[i] = members.get(i).not();
        }
        clause[members.size()] = result;
        model.addBoolOr(clause);
    }
}
