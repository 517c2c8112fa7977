package io.github.riemr.roster.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Employee as delivered by HR management. Read-only for the engine.
 * Team membership is owned by {@link Team}.
 */
@Value
@Builder
public class Employee {
    long id;
    String name;
    @Builder.Default
    boolean active = true;
    @Builder.Default
    EmployeeDesignation designation = EmployeeDesignation.NONE;
    /** May take the weekly day duty (fire alarm technician or fire safety officer). */
    @Builder.Default
    boolean dayDutyQualified = false;

    public boolean isRelief() {
        return designation == EmployeeDesignation.RELIEF;
    }
}
