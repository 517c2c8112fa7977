package io.github.riemr.roster.application.dto;

/**
 * Credited hours of one employee in a reporting window.
 *
 * @param shiftHours           nominal hours of assignments on days without absence
 * @param creditedAbsenceHours hours credited for training absence days
 * @param retractedAssignments assignments ignored because an absence covers their day
 */
public record EmployeeHours(long employeeId, double shiftHours, double creditedAbsenceHours,
                            int retractedAssignments) {

    public double total() {
        return shiftHours + creditedAbsenceHours;
    }
}
