package io.github.riemr.roster.optimization.problem;

import java.time.LocalDate;

/**
 * (employee, day, shift type) triple eligible for a decision variable: the employee's team covers the
 * shift, the shift is staffed that day and the employee is not absent.
 */
public record AssignmentCandidate(long employeeId, LocalDate date, String shiftCode) {

    @Override
    public String toString() {
        return "e" + employeeId + "_" + date + "_" + shiftCode;
    }
}
