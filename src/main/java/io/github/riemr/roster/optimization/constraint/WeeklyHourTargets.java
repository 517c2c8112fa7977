package io.github.riemr.roster.optimization.constraint;

import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.optimization.problem.AssignmentCandidate;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.variable.VariableRegistry;

import java.time.LocalDate;
import java.util.List;

/** Weekly minimum hours, pro-rated for absence days. All values in tenths of an hour. */
final class WeeklyHourTargets {

    private WeeklyHourTargets() {
    }

    static long scaledTarget(PlanningProblem problem, long employeeId, List<LocalDate> week) {
        long available = week.stream().filter(d -> !problem.isAbsent(employeeId, d)).count();
        double target = problem.nominalWeeklyHoursOf(employeeId) * available / 7.0;
        return Math.round(target * ShiftType.HOUR_SCALE);
    }

    static LinearExpr workedHours(PlanningProblem problem, VariableRegistry vars, long employeeId,
                                  List<LocalDate> week) {
        LinearExprBuilder hours = LinearExpr.newBuilder();
        for (LocalDate date : week) {
            for (ShiftType st : problem.getShiftTypes()) {
                if (problem.hasCandidate(employeeId, date, st.getCode())) {
                    hours.addTerm(vars.assignment(new AssignmentCandidate(employeeId, date, st.getCode())),
                            st.scaledHours());
                }
            }
        }
        return hours.build();
    }
}
