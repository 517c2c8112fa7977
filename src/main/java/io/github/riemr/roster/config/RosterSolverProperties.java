package io.github.riemr.roster.config;

import io.github.riemr.roster.optimization.constraint.LegacyMinimumHoursMode;
import io.github.riemr.roster.optimization.constraint.PenaltyFamily;
import io.github.riemr.roster.optimization.constraint.TeamRotationMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@code roster.solver.*}
 */
@ConfigurationProperties(prefix = "roster.solver")
@Validated
@Getter
@Setter
public class RosterSolverProperties {

    /** Time budget of one solve (ISO-8601). */
    @NotNull
    private Duration timeLimit = Duration.ofSeconds(30);

    @Min(1)
    private int numWorkers = 8;

    private int randomSeed = 0;

    /** Budget of each re-solve while diagnosing infeasibility; PT0S disables diagnosis. */
    @NotNull
    private Duration diagnosticTimeLimit = Duration.ofSeconds(5);

    @Min(0)
    private int minRestHours = 11;

    /** Forbidden day-to-day transitions such as {@code S->F}; empty derives them from shift times. */
    private List<String> forbiddenTransitions = new ArrayList<>();

    @NotNull
    private LegacyMinimumHoursMode legacyMinimumHours = LegacyMinimumHoursMode.DISABLED;

    private boolean reliefReserveEnabled = true;

    @NotNull
    private TeamRotationMode teamRotation = TeamRotationMode.DISABLED;

    /** Weekly team shift order, e.g. {@code F, N, S}. */
    private List<String> rotationPattern = new ArrayList<>(List.of("F", "N", "S"));

    private boolean dayDutyEnabled = false;

    /** Overrides of the default objective weights. */
    private Map<PenaltyFamily, Long> weights = new EnumMap<>(PenaltyFamily.class);
}
