package io.github.riemr.roster.optimization.service;

import io.github.riemr.roster.domain.model.RosterViolation;
import io.github.riemr.roster.exception.SolverInternalException;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.problem.PlanningProblem;
import io.github.riemr.roster.optimization.problem.PlanningProblemFactory;
import io.github.riemr.roster.optimization.solution.ExtractedRoster;
import io.github.riemr.roster.optimization.solution.SolutionExtractor;
import io.github.riemr.roster.optimization.solution.SolveReport;
import io.github.riemr.roster.optimization.solution.SolveResult;
import io.github.riemr.roster.optimization.solver.CpSatSolverDriver;
import io.github.riemr.roster.optimization.solver.FeasibilityAnalyzer;
import io.github.riemr.roster.optimization.solver.InfeasibilityDiagnoser;
import io.github.riemr.roster.optimization.solver.InfeasibilityReason;
import io.github.riemr.roster.optimization.solver.RosterModel;
import io.github.riemr.roster.optimization.solver.RosterModelBuilder;
import io.github.riemr.roster.optimization.solver.SolveHandle;
import io.github.riemr.roster.optimization.solver.SolveStatus;
import io.github.riemr.roster.optimization.solver.SolverRun;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the engine: validate, analyze, build, solve, extract, re-check, report.
 * <p>
 * Keeps no state between calls, so solves with different settings may run concurrently.
 * A failing solver is reported as {@link SolveStatus#ERROR} and never retried here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ShiftPlanningService {

    private final PlanningProblemFactory problemFactory;
    private final FeasibilityAnalyzer feasibilityAnalyzer;
    private final RosterModelBuilder modelBuilder;
    private final CpSatSolverDriver driver;
    private final InfeasibilityDiagnoser diagnoser;
    private final SolutionExtractor extractor;
    private final RosterValidationService validationService;
    private final SolverSettings defaultSettings;
    private final WeightTable defaultWeights;

    public SolveResult solve(PlanningRequest request) {
        return solve(request, new SolveHandle());
    }

    public SolveResult solve(PlanningRequest request, SolveHandle handle) {
        if (request == null || request.getSnapshot() == null) {
            throw new IllegalArgumentException("Planning request with snapshot is required");
        }
        SolverSettings settings = Optional.ofNullable(request.getSettings()).orElse(defaultSettings);
        settings.validate();
        WeightTable weights = Optional.ofNullable(request.getWeights()).orElse(defaultWeights);
        ProblemKey key = request.key();
        log.info("Starting solve {} (limit {}, legacy minimum hours {}, team rotation {}, day duty {})", key,
                settings.getTimeLimit(), settings.getLegacyMinimumHours(), settings.getTeamRotation(),
                settings.isDayDutyEnabled());

        PlanningProblem problem = problemFactory.create(request.getSnapshot());

        List<InfeasibilityReason> shortfalls = feasibilityAnalyzer.analyze(problem);
        if (!shortfalls.isEmpty()) {
            handle.transitionTo(SolveStatus.INFEASIBLE);
            log.info("Solve {} is infeasible before solving: {} shortfalls", key, shortfalls.size());
            return SolveResult.withoutRoster(SolveReport.builder()
                    .key(key).status(SolveStatus.INFEASIBLE).reasons(shortfalls).build());
        }

        if (problem.isEmpty()) {
            handle.transitionTo(SolveStatus.OPTIMAL);
            log.info("Solve {} has nothing to decide, returning an empty roster", key);
            return toResult(SolveStatus.OPTIMAL, extractor.emptyRoster(problem), SolveReport.builder()
                    .key(key).status(SolveStatus.OPTIMAL).optimal(true).objective(0.0).bestBound(0.0));
        }

        try {
            RosterModel model = modelBuilder.build(problem, settings, weights);
            handle.transitionTo(SolveStatus.SOLVING);
            SolverRun run = driver.solve(model, settings, settings.timeLimitSeconds(), handle);

            SolveReport.SolveReportBuilder report = SolveReport.builder()
                    .key(key)
                    .status(run.status())
                    .optimal(run.status() == SolveStatus.OPTIMAL)
                    .cancelled(run.cancelled())
                    .wallTimeSeconds(run.wallTimeSeconds());

            if (!run.hasSolution()) {
                if (run.status() == SolveStatus.INFEASIBLE) {
                    report.reasons(diagnoser.diagnose(problem, settings, weights, handle));
                }
                handle.transitionTo(run.status());
                log.info("Solve {} finished without roster: {}", key, run.status());
                return SolveResult.withoutRoster(report.build());
            }

            ExtractedRoster roster = extractor.extract(model, run);
            List<RosterViolation> violations = new ArrayList<>(
                    validationService.validate(problem, roster.assignments(), settings));
            if (settings.isDayDutyEnabled()) {
                violations.addAll(validationService.validateDayDuties(problem, roster.dayDuties()));
            }
            report.objective(run.objective())
                    .bestBound(run.bestBound())
                    .penalties(roster.penalties())
                    .violations(violations);
            handle.transitionTo(run.status());
            log.info("Solve {} finished: {} with {} assignments, objective {}, {} roster violations", key,
                    run.status(), roster.assignments().size(), run.objective(), violations.size());
            return toResult(run.status(), roster, report);
        } catch (SolverInternalException e) {
            log.error("Solve {} failed inside the solver", key, e);
            handle.transitionTo(SolveStatus.ERROR);
            return SolveResult.withoutRoster(SolveReport.builder()
                    .key(key).status(SolveStatus.ERROR).cancelled(handle.isCancelled())
                    .errorMessage(e.getMessage()).build());
        }
    }

    private static SolveResult toResult(SolveStatus status, ExtractedRoster roster,
                                        SolveReport.SolveReportBuilder report) {
        return new SolveResult(status, roster.assignments(), roster.scheduleView(), roster.completeGrid(),
                roster.dayDuties(), report.build());
    }
}
