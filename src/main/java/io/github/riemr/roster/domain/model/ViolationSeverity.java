package io.github.riemr.roster.domain.model;

public enum ViolationSeverity {
    /** Breaks a hard rule; the roster must not be published. */
    CRITICAL,
    /** Breaks a soft rule. */
    WARNING
}
