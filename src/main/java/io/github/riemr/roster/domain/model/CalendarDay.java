package io.github.riemr.roster.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * One day of the planning horizon.
 *
 * @param activeShiftCodes shift types staffed on this day, in shift declaration order
 */
public record CalendarDay(LocalDate date, DayClass dayClass, List<String> activeShiftCodes) {

    public CalendarDay {
        activeShiftCodes = List.copyOf(activeShiftCodes);
    }

    public boolean isActive(String shiftCode) {
        return activeShiftCodes.contains(shiftCode);
    }
}
