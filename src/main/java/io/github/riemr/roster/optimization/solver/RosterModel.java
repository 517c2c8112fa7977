package io.github.riemr.roster.optimization.solver;

import com.google.ortools.sat.CpModel;
import io.github.riemr.roster.optimization.constraint.HardConstraintFamily;
import io.github.riemr.roster.optimization.constraint.PenaltyPool;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.variable.VariableRegistry;

import java.util.Map;
import java.util.Set;

/**
 * A fully built CP-SAT model with the lookups needed to read a solution back.
 */
public record RosterModel(CpModel model,
                          PlanningProblem problem,
                          VariableRegistry variables,
                          PenaltyPool penalties,
                          Map<HardConstraintFamily, Integer> hardConstraintCounts,
                          Set<HardConstraintFamily> relaxed) {
}
