package io.github.riemr.roster.domain.model;

import java.time.LocalDate;

/** (employee, day, shift type) triple confirmed by the solver, or fixed/published beforehand. */
public record ShiftAssignment(long employeeId, LocalDate date, String shiftCode) {
}
