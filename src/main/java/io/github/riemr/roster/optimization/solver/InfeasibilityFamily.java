package io.github.riemr.roster.optimization.solver;

import io.github.riemr.roster.optimization.constraint.HardConstraintFamily;

public enum InfeasibilityFamily {
    /** Fewer eligible, unblocked employees than the minimum staffing of one shift. */
    STAFFING_SHORTFALL,
    /** The minimums of one day together need more people than are available that day. */
    HEADCOUNT_SHORTFALL,
    STAFFING_MINIMUM,
    STAFFING_MAXIMUM,
    WEEKLY_HOURS_CEILING,
    FIXED_ASSIGNMENTS,
    LEGACY_MINIMUM_HOURS,
    TEAM_ROTATION,
    /** Only several rule families together are contradictory. */
    COMBINED,
    /** Diagnosis was skipped or ran out of time. */
    UNDETERMINED;

    public static InfeasibilityFamily of(HardConstraintFamily family) {
        return switch (family) {
            case STAFFING_MINIMUM -> STAFFING_MINIMUM;
            case STAFFING_MAXIMUM -> STAFFING_MAXIMUM;
            case WEEKLY_HOURS_CEILING -> WEEKLY_HOURS_CEILING;
            case FIXED_ASSIGNMENTS -> FIXED_ASSIGNMENTS;
            case LEGACY_MINIMUM_HOURS -> LEGACY_MINIMUM_HOURS;
            case TEAM_ROTATION -> TEAM_ROTATION;
            default -> throw new IllegalArgumentException(family + " is never relaxed");
        };
    }
}
