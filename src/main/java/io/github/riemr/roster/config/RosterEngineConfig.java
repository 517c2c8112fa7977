package io.github.riemr.roster.config;

import io.github.riemr.roster.optimization.constraint.ShiftTransition;
import io.github.riemr.roster.optimization.objective.WeightTable;
import io.github.riemr.roster.optimization.solver.SolverSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Converts the bound properties once into the immutable objects every solve uses by default.
 */
@Configuration
@EnableConfigurationProperties({RosterSolverProperties.class, RosterAccountingProperties.class})
@Slf4j
public class RosterEngineConfig {

    @Bean
    public SolverSettings defaultSolverSettings(RosterSolverProperties properties) {
        SolverSettings.SolverSettingsBuilder builder = SolverSettings.builder()
                .timeLimit(properties.getTimeLimit())
                .numWorkers(properties.getNumWorkers())
                .randomSeed(properties.getRandomSeed())
                .diagnosticTimeLimit(properties.getDiagnosticTimeLimit())
                .minRestHours(properties.getMinRestHours())
                .legacyMinimumHours(properties.getLegacyMinimumHours())
                .reliefReserveEnabled(properties.isReliefReserveEnabled())
                .teamRotation(properties.getTeamRotation())
                .rotationPattern(List.copyOf(properties.getRotationPattern()))
                .dayDutyEnabled(properties.isDayDutyEnabled());
        for (String raw : properties.getForbiddenTransitions()) {
            builder.forbiddenTransition(ShiftTransition.parse(raw));
        }
        SolverSettings settings = builder.build();
        settings.validate();
        log.info("Default solver settings: {}", settings);
        return settings;
    }

    @Bean
    public WeightTable defaultWeightTable(RosterSolverProperties properties) {
        WeightTable weights = WeightTable.defaults().withOverrides(properties.getWeights());
        log.info("Objective weights: {}", weights.asMap());
        return weights;
    }
}
