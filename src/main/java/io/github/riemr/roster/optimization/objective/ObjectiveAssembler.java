package io.github.riemr.roster.optimization.objective;

import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import io.github.riemr.roster.optimization.constraint.PenaltyFamily;
import io.github.riemr.roster.optimization.constraint.PenaltyPool;
import io.github.riemr.roster.optimization.constraint.PenaltyTerm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns the penalty pool into a single minimization objective: the plain weighted sum of all terms.
 */
@Component
@Slf4j
public class ObjectiveAssembler {

    /**
     * @return the largest objective value the pool can reach
     */
    public long assemble(CpModel model, PenaltyPool pool) {
        List<PenaltyTerm> terms = pool.getTerms();
        if (terms.isEmpty()) {
            log.info("Objective: no penalty terms, pure feasibility problem");
            return 0;
        }
        IntVar[] variables = new IntVar[terms.size()];
        long[] weights = new long[terms.size()];
        long maxObjective = 0;
        for (int i = 0; i < terms.size(); i++) {
            PenaltyTerm t = terms.get(i);
            variables[i] = t.variable();
            weights[i] = t.weight();
            maxObjective = Math.addExact(maxObjective, t.maxContribution());
        }
        model.minimize(LinearExpr.weightedSum(variables, weights));
        checkFairnessDominance(pool);
        log.info("Objective: {} terms {}, upper bound {}", terms.size(), pool.countByFamily(), maxObjective);
        return maxObjective;
    }

    private void checkFairnessDominance(PenaltyPool pool) {
        List<PenaltyTerm> rest = pool.termsOf(PenaltyFamily.REST_TIME);
        if (rest.isEmpty()) {
            return;
        }
        long restWeight = rest.get(0).weight();
        long fairnessMax = pool.termsOf(PenaltyFamily.FAIRNESS).stream().mapToLong(PenaltyTerm::maxContribution).sum();
        if (fairnessMax >= restWeight) {
            log.warn("Fairness penalty can reach {}, which is not dominated by one rest-time violation ({})",
                    fairnessMax, restWeight);
        }
    }
}
