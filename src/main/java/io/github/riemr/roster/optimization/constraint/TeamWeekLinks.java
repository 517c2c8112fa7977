package io.github.riemr.roster.optimization.constraint;

import com.google.ortools.sat.BoolVar;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.domain.model.Team;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.variable.VariableRegistry;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pairs of variables the team rotation rule relates, shared by its hard and soft form.
 */
final class TeamWeekLinks {

    /** A team week and the team week the rotation requires after it. */
    record RotationStep(Team team, LocalDate monday, String shiftCode, BoolVar current, BoolVar next) {
    }

    private TeamWeekLinks() {
    }

    /**
     * @return the team week variable a candidate is bound to; empty for relief workers
     */
    static Optional<BoolVar> teamWeekOf(PlanningProblem problem, VariableRegistry vars, AssignmentCandidate c) {
        if (problem.getEmployeesById().get(c.employeeId()).isRelief()) {
            return Optional.empty();
        }
        return problem.teamOf(c.employeeId())
                .flatMap(t -> vars.teamShift(t.getId(), PlanningProblem.weekStartOf(c.date()), c.shiftCode()));
    }

    /**
     * @return every pair of consecutive team weeks the rotation pattern links
     */
    static List<RotationStep> rotationSteps(PlanningProblem problem, VariableRegistry vars, RotationPattern pattern) {
        List<RotationStep> steps = new ArrayList<>();
        List<LocalDate> mondays = new ArrayList<>(problem.horizonWeeks().keySet());
        for (Team team : problem.getTeams()) {
            for (int i = 0; i + 1 < mondays.size(); i++) {
                LocalDate monday = mondays.get(i);
                LocalDate following = mondays.get(i + 1);
                for (ShiftType st : problem.getShiftTypes()) {
                    Optional<BoolVar> current = vars.teamShift(team.getId(), monday, st.getCode());
                    Optional<BoolVar> next = pattern.successorFor(team, st.getCode())
                            .flatMap(code -> vars.teamShift(team.getId(), following, code));
                    if (current.isPresent() && next.isPresent()) {
                        steps.add(new RotationStep(team, monday, st.getCode(), current.get(), next.get()));
                    }
                }
            }
        }
        return steps;
    }
}
