package io.github.riemr.roster.application.dto;

import java.util.Map;
import java.util.Optional;

public record HourAccountingSummary(ReportingWindow window,
                                    Map<Long, EmployeeHours> employeeHours,
                                    ActivityBuckets activity) {

    public Optional<EmployeeHours> hoursOf(long employeeId) {
        return Optional.ofNullable(employeeHours.get(employeeId));
    }

    public double totalHours() {
        return employeeHours.values().stream().mapToDouble(EmployeeHours::total).sum();
    }
}
