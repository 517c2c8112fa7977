package io.github.riemr.roster.optimization.constraint;

/**
 * Policy for the weekly minimum hours rule. A hard floor over-constrains teams that are provisioned
 * above minimum staffing, so it is opt-in.
 */
public enum LegacyMinimumHoursMode {
    DISABLED,
    SOFT,
    HARD
}
