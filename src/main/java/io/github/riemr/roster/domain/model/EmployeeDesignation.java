package io.github.riemr.roster.domain.model;

public enum EmployeeDesignation {
    NONE,
    ADMINISTRATOR,
    /** Floating worker who covers gaps in any shift of the team. */
    RELIEF;
}
