package io.github.riemr.roster.optimization.variable;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.Literal;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.Team;
import io.github.riemr.roster.optimization.constraint.TeamRotationMode;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the boolean decision variables and the auxiliary "works shift" indicators.
 * <p>
 * Indicators take part in sums and window thresholds next to each other, so every one of them is a real
 * model variable: fixed values are expressed as a variable pinned by an equality constraint, never as a
 * literal constant mixed into the same collection.
 */
@Component
@Slf4j
public class DecisionVariableFabric {

    /**
     * Creates every variable of one model.
     *
     * @param model    the model receiving variables and linking constraints
     * @param problem  the validated problem
     * @param settings decide whether team week and day duty variables are needed
     * @return lookup of all created variables
     */
    public VariableRegistry build(CpModel model, PlanningProblem problem, SolverSettings settings) {
        VariableRegistry registry = new VariableRegistry();

        for (AssignmentCandidate c : problem.getCandidates()) {
            registry.registerAssignment(c, model.newBoolVar("x_" + c));
        }
        addWorksShiftIndicators(model, problem, registry);
        if (settings.getTeamRotation() != TeamRotationMode.DISABLED) {
            addTeamWeekShifts(model, problem, registry);
        }
        if (settings.isDayDutyEnabled()) {
            addDayDuties(model, problem, registry);
        }

        log.info("Variable fabric: {} decision variables, {} indicators ({} pinned), {} team week shifts, {} day duties",
                registry.assignmentCount(), registry.indicatorCount(), registry.pinnedCount(),
                registry.teamShiftCount(), registry.dayDutyCount());
        return registry;
    }

    // ===== works-shift indicators =====

    /**
     * One indicator per plannable employee, shift type and day. Lookback days are pinned from history,
     * horizon days are linked to the candidates.
     *
     * @param model    target model
     * @param problem  the validated problem
     * @param registry receives the indicators
     */
    private void addWorksShiftIndicators(CpModel model, PlanningProblem problem, VariableRegistry registry) {
        List<ShiftType> shiftTypes = problem.getShiftTypes();
        for (Employee e : problem.getPlannableEmployees()) {
            for (LocalDate date : problem.getLookbackDays()) {
                for (ShiftType st : shiftTypes) {
                    boolean worked = problem.workedInHistory(e.getId(), date, st.getCode());
                    BoolVar indicator = model.newBoolVar(indicatorName(e.getId(), date, st.getCode()));
                    model.addEquality(indicator, worked ? 1 : 0);
                    registry.registerWorksShift(e.getId(), date, st.getCode(), indicator, worked);
                }
            }
            for (CalendarDay day : problem.getDays()) {
                for (ShiftType st : shiftTypes) {
                    AssignmentCandidate key = new AssignmentCandidate(e.getId(), day.date(), st.getCode());
                    List<Literal> underlying = new ArrayList<>();
                    if (problem.hasCandidate(e.getId(), day.date(), st.getCode())) {
                        underlying.add(registry.assignment(key));
                    }
                    BoolVar indicator = model.newBoolVar(indicatorName(e.getId(), day.date(), st.getCode()));
                    Boolean pinned = link(model, indicator, underlying);
                    registry.registerWorksShift(e.getId(), day.date(), st.getCode(), indicator, pinned);
                }
            }
        }
    }

    /**
     * Makes {@code indicator} equivalent to the disjunction of {@code underlying}.
     *
     * @return {@code false} when the indicator had to be pinned, otherwise {@code null}
     */
    static Boolean link(CpModel model, BoolVar indicator, List<Literal> underlying) {
        if (underlying.isEmpty()) {
            model.addEquality(indicator, 0);
            return Boolean.FALSE;
        }
        for (Literal l : underlying) {
            model.addImplication(l, indicator);
        }
        Literal[] clause = new Literal[underlying.size() + 1];
        clause[0] = indicator.not();
        for (int i = 0; i < underlying.size(); i++) {
            clause[i + 1] = underlying.get(i);
        }
        model.addBoolOr(clause);
        return null;
    }

    // ===== team level =====

    /**
     * One variable per team, horizon week and covered shift type; each team works exactly one shift
     * type per week. Teams whose plannable members are all relief workers get none.
     *
     * @param model    target model
     * @param problem  the validated problem
     * @param registry receives the team week variables
     */
    private void addTeamWeekShifts(CpModel model, PlanningProblem problem, VariableRegistry registry) {
        for (Team team : problem.getTeams()) {
            if (problem.plannableMembers(team).stream().allMatch(Employee::isRelief)) {
                continue;
            }
            for (LocalDate monday : problem.horizonWeeks().keySet()) {
                List<BoolVar> week = new ArrayList<>();
                for (ShiftType st : problem.getShiftTypes()) {
                    if (team.covers(st.getCode())) {
                        BoolVar var = model.newBoolVar("t" + team.getId() + "_" + monday + "_" + st.getCode());
                        registry.registerTeamShift(team.getId(), monday, st.getCode(), var);
                        week.add(var);
                    }
                }
                if (!week.isEmpty()) {
                    model.addExactlyOne(week.toArray(new BoolVar[0]));
                }
            }
        }
    }

    /**
     * One variable per day duty week and available qualified employee.
     *
     * @param model    target model
     * @param problem  the validated problem
     * @param registry receives the day duty variables
     */
    private void addDayDuties(CpModel model, PlanningProblem problem, VariableRegistry registry) {
        problem.dayDutyWeeks().forEach((monday, weekdays) -> {
            for (Employee e : problem.dayDutyCandidates(weekdays)) {
                registry.registerDayDuty(e.getId(), monday, model.newBoolVar("td_e" + e.getId() + "_" + monday));
            }
        });
    }

    private static String indicatorName(long employeeId, LocalDate date, String shiftCode) {
        return "w_e" + employeeId + "_" + date + "_" + shiftCode;
    }
}
