package io.github.riemr.roster.optimization.constraint;

/**
 * Policy for weekly team rotation. In {@code HARD} mode all regular members of a team work the team's
 * shift type of the week and consecutive weeks follow the rotation pattern; {@code SOFT} penalizes
 * departures instead. Relief employees are never bound to their team's week.
 */
public enum TeamRotationMode {
    DISABLED,
    SOFT,
    HARD
}
