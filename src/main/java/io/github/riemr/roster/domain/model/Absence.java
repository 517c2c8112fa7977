package io.github.riemr.roster.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Employee absence over an inclusive date range.
 *
 * @param code the code as recorded (custom types keep their own code, e.g. "EZ")
 */
public record Absence(long employeeId, AbsenceType type, String code, LocalDate start, LocalDate end) {

    public static Absence of(long employeeId, AbsenceType type, LocalDate start, LocalDate end) {
        return new Absence(employeeId, type, type.getCode(), start, end);
    }

    public static Absence ofCode(long employeeId, String code, LocalDate start, LocalDate end) {
        return new Absence(employeeId, AbsenceType.fromCode(code), code, start, end);
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /** Number of days of this absence inside [from, to], both inclusive. */
    public long overlapDays(LocalDate from, LocalDate to) {
        LocalDate clippedStart = start.isAfter(from) ? start : from;
        LocalDate clippedEnd = end.isBefore(to) ? end : to;
        if (clippedEnd.isBefore(clippedStart)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(clippedStart, clippedEnd) + 1;
    }

    public String displayCode() {
        return code != null ? code : type.name();
    }
}
