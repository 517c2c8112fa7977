package io.github.riemr.roster.optimization.constraint;

public enum PenaltyFamily {
    /** Less than the legal minimum rest between two consecutive shifts. */
    REST_TIME,
    /** Same shift type worked on more consecutive days than allowed. */
    CONSECUTIVE_DAYS,
    /** A team member off the team's shift type of the week, or a team week breaking the rotation order. */
    TEAM_ROTATION,
    /** Weekly hours under the nominal weekly figure (only when the legacy rule runs in SOFT mode). */
    LEGACY_MINIMUM_HOURS,
    /** Every relief worker is busy on the same day. */
    RELIEF_RESERVE,
    /** Shift count deviating from the team average. */
    FAIRNESS
}
