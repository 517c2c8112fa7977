package io.github.riemr.roster.optimization.solver;

import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.StaffingBounds;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks that prove infeasibility without calling the solver.
 */
@Component
@Slf4j
public class FeasibilityAnalyzer {

    public List<InfeasibilityReason> analyze(PlanningProblem problem) {
        List<InfeasibilityReason> reasons = new ArrayList<>();
        for (CalendarDay day : problem.getDays()) {
            int minimums = 0;
            for (String code : day.activeShiftCodes()) {
                StaffingBounds bounds = problem.staffingFor(day, code);
                int eligible = problem.candidatesFor(day.date(), code).size();
                minimums += bounds.min();
                if (eligible < bounds.min()) {
                    reasons.add(new InfeasibilityReason(InfeasibilityFamily.STAFFING_SHORTFALL, day.date(), code,
                            "Shift " + code + " on " + day.date() + " needs " + bounds.min()
                                    + " employees but only " + eligible + " are eligible and not absent"));
                }
            }
            int available = problem.employeesAvailableOn(day.date()).size();
            if (minimums > available) {
                reasons.add(new InfeasibilityReason(InfeasibilityFamily.HEADCOUNT_SHORTFALL, day.date(), null,
                        "Shifts on " + day.date() + " need " + minimums + " employees in total but only "
                                + available + " are available"));
            }
        }
        if (!reasons.isEmpty()) {
            log.info("Pre-solve analysis found {} structural shortfalls, first: {}", reasons.size(),
                    reasons.get(0).message());
        }
        return reasons;
    }
}
