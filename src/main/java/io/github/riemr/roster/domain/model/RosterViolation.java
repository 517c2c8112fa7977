package io.github.riemr.roster.domain.model;

import java.time.LocalDate;

/**
 * A rule broken by a concrete roster.
 *
 * @param employeeId {@code null} for day-level violations such as understaffing
 */
public record RosterViolation(ViolationSeverity severity, String rule, Long employeeId, LocalDate date,
                              String message) {
}
