package io.github.riemr.roster.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Frozen problem instance handed in by the caller for exactly one solve.
 */
@Value
@Builder(toBuilder = true)
public class PlanningSnapshot {
    LocalDate start;
    LocalDate end;
    @Singular
    List<Employee> employees;
    @Singular
    List<Team> teams;
    @Singular
    List<ShiftType> shiftTypes;
    @Singular
    List<Absence> absences;
    /** Public holidays, staffed with weekend bounds. */
    @Singular
    Set<LocalDate> holidays;
    /** Manually locked shifts inside the horizon that every solve must reproduce. */
    @Singular
    List<ShiftAssignment> fixedAssignments;
    /** Published shifts before {@code start}, for rest-time and consecutive-day continuity. */
    @Singular("historyEntry")
    List<ShiftAssignment> history;
}
