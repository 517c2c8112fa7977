package io.github.riemr.roster.optimization.solution;

import com.google.ortools.sat.BoolVar;
import io.github.riemr.roster.domain.model.Absence;
import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.Employee;
import io.github.riemr.roster.domain.model.ShiftAssignment;
import io.github.riemr.roster.optimization.constraint.PenaltyFamily;
import io.github.riemr.roster.optimization.constraint.PenaltyTerm;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.solver.RosterModel;
import io.github.riemr.roster.optimization.solver.SolverRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the solver values and builds all roster views from a single pass over the decision variables.
 */
@Component
@Slf4j
public class SolutionExtractor {

    public static final String OFF = "OFF";

    public ExtractedRoster extract(RosterModel model, SolverRun run) {
        PlanningProblem problem = model.problem();

        List<ShiftAssignment> assignments = new ArrayList<>();
        for (Map.Entry<AssignmentCandidate, BoolVar> entry : model.variables().getAssignmentVars().entrySet()) {
            if (run.booleanValue(entry.getValue())) {
                AssignmentCandidate c = entry.getKey();
                assignments.add(new ShiftAssignment(c.employeeId(), c.date(), c.shiftCode()));
            }
        }

        Map<LocalDate, Map<String, List<Long>>> scheduleView = scheduleView(problem, assignments);
        Map<Long, Map<LocalDate, String>> grid = completeGrid(problem, assignments);
        Map<LocalDate, Long> dayDuties = dayDuties(model, run);
        List<PenaltySummary> penalties = penalties(model, run);

        log.info("Extracted {} assignments, {} day duties, penalties {}", assignments.size(), dayDuties.size(),
                penalties);
        return new ExtractedRoster(Collections.unmodifiableList(assignments), scheduleView, grid, dayDuties,
                penalties);
    }

    /** Views of a problem that needs no decision: every day off or absent. */
    public ExtractedRoster emptyRoster(PlanningProblem problem) {
        return new ExtractedRoster(List.of(), scheduleView(problem, List.of()), completeGrid(problem, List.of()),
                Map.of(), List.of());
    }

    private static Map<LocalDate, Map<String, List<Long>>> scheduleView(PlanningProblem problem,
                                                                        List<ShiftAssignment> assignments) {
        Map<LocalDate, Map<String, List<Long>>> view = new LinkedHashMap<>();
        for (CalendarDay day : problem.getDays()) {
            Map<String, List<Long>> shifts = new LinkedHashMap<>();
            for (String code : day.activeShiftCodes()) {
                shifts.put(code, new ArrayList<>());
            }
            view.put(day.date(), shifts);
        }
        // assignments come in candidate order: day, shift, planning order of employees
        for (ShiftAssignment a : assignments) {
            view.get(a.date()).get(a.shiftCode()).add(a.employeeId());
        }
        return view;
    }

    private static Map<Long, Map<LocalDate, String>> completeGrid(PlanningProblem problem,
                                                                 List<ShiftAssignment> assignments) {
        Map<Long, Map<LocalDate, String>> grid = new LinkedHashMap<>();
        for (Employee e : problem.getEmployeesById().values()) {
            Map<LocalDate, String> row = new LinkedHashMap<>();
            for (CalendarDay day : problem.getDays()) {
                Optional<Absence> absence = problem.absenceOn(e.getId(), day.date());
                row.put(day.date(), absence.map(Absence::displayCode).orElse(OFF));
            }
            grid.put(e.getId(), row);
        }
        for (ShiftAssignment a : assignments) {
            grid.get(a.employeeId()).put(a.date(), a.shiftCode());
        }
        return grid;
    }

    /** Weeks whose duty stayed uncovered have no entry. */
    private static Map<LocalDate, Long> dayDuties(RosterModel model, SolverRun run) {
        Map<LocalDate, Long> duties = new LinkedHashMap<>();
        for (LocalDate monday : model.problem().dayDutyWeeks().keySet()) {
            model.variables().dayDutiesOf(monday).forEach((employeeId, duty) -> {
                if (run.booleanValue(duty)) {
                    duties.put(monday, employeeId);
                }
            });
        }
        return duties;
    }

    private static List<PenaltySummary> penalties(RosterModel model, SolverRun run) {
        Map<PenaltyFamily, long[]> totals = new EnumMap<>(PenaltyFamily.class);
        for (PenaltyTerm term : model.penalties().getTerms()) {
            long value = run.value(term.variable());
            long[] t = totals.computeIfAbsent(term.family(), k -> new long[2]);
            t[0] += value;
            t[1] += value * term.weight();
        }
        List<PenaltySummary> summaries = new ArrayList<>();
        totals.forEach((family, t) -> summaries.add(new PenaltySummary(family, t[0], t[1])));
        return summaries;
    }
}
