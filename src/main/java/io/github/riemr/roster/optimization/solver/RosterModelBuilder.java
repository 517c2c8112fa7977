package io.github.riemr.roster.optimization.solver;

import com.google.ortools.sat.CpModel;
import io.github.riemr.roster.optimization.constraint.HardConstraintBuilder;
import io.github.riemr.roster.optimization.constraint.HardConstraintFamily;
import io.github.riemr.roster.optimization.constraint.PenaltyPool;
import io.github.riemr.roster.optimization.constraint.SoftConstraintBuilder;
import io.github.riemr.roster.optimization.objective.ObjectiveAssembler;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.variable.DecisionVariableFabric;
import io.github.riemr.roster.optimization.variable.VariableRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Runs variables, hard rules, soft rules and objective in order on a fresh {@link CpModel}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RosterModelBuilder {

    private final DecisionVariableFabric variableFabric;
    private final HardConstraintBuilder hardConstraintBuilder;
    private final SoftConstraintBuilder softConstraintBuilder;
    private final ObjectiveAssembler objectiveAssembler;

    public RosterModel build(PlanningProblem problem, SolverSettings settings, WeightTable weights) {
        return build(problem, settings, weights, EnumSet.noneOf(HardConstraintFamily.class), true);
    }

    /**
     * @param relaxed       hard families left out (diagnosis only)
     * @param withObjective whether soft rules and the objective are added
     */
    public RosterModel build(PlanningProblem problem, SolverSettings settings, WeightTable weights,
                             Set<HardConstraintFamily> relaxed, boolean withObjective) {
        CpSatNativeLoader.ensureLoaded();
        CpModel model = new CpModel();
        VariableRegistry vars = variableFabric.build(model, problem, settings);
        Map<HardConstraintFamily, Integer> hard = hardConstraintBuilder.build(model, problem, vars, settings, relaxed);
        PenaltyPool pool = new PenaltyPool();
        if (withObjective) {
            pool = softConstraintBuilder.build(model, problem, vars, settings, weights);
            objectiveAssembler.assemble(model, pool);
        }
        log.info("Model built: {} variables, {} constraints, hard families {}",
                model.model().getVariablesCount(), model.model().getConstraintsCount(), hard);
        return new RosterModel(model, problem, vars, pool, hard, Set.copyOf(relaxed));
    }
}
