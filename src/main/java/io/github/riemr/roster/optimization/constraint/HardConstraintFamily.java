package io.github.riemr.roster.optimization.constraint;

/**
 * Rules that must never be violated. Absence blocking and team eligibility are enforced
 * by candidate generation and therefore cannot be relaxed.
 */
public enum HardConstraintFamily {
    ONE_SHIFT_PER_DAY(false),
    ABSENCE_BLOCKING(false),
    TEAM_ELIGIBILITY(false),
    STAFFING_MINIMUM(true),
    STAFFING_MAXIMUM(true),
    WEEKLY_HOURS_CEILING(true),
    FIXED_ASSIGNMENTS(true),
    LEGACY_MINIMUM_HOURS(true),
    TEAM_ROTATION(true),
    /** Exactly one day duty per week; the duty variables touch no other rule. */
    DAY_DUTY(false);

    private final boolean relaxable;

    HardConstraintFamily(boolean relaxable) {
        this.relaxable = relaxable;
    }

    /** Whether the infeasibility diagnoser may drop this family to locate a conflict. */
    public boolean isRelaxable() {
        return relaxable;
    }
}
