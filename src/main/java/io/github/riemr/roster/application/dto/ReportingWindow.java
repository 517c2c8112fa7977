package io.github.riemr.roster.application.dto;

import java.time.LocalDate;
import java.time.YearMonth;

/** Inclusive date range of a report. */
public record ReportingWindow(LocalDate from, LocalDate to) {

    public ReportingWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Reporting window needs from and to");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Reporting window " + from + ".." + to + " is inverted");
        }
    }

    public static ReportingWindow ofMonth(YearMonth month) {
        return new ReportingWindow(month.atDay(1), month.atEndOfMonth());
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }
}
