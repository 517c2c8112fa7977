package io.github.riemr.roster.optimization.problem;

import io.github.riemr.roster.domain.model.CalendarDay;
import io.github.riemr.roster.domain.model.DayClass;
import io.github.riemr.roster.domain.model.ShiftType;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public final class PlanningCalendar {

    private PlanningCalendar() {
    }

    public static List<CalendarDay> build(LocalDate start, LocalDate end,
                                          Collection<ShiftType> shiftTypes,
                                          Set<LocalDate> holidays) {
        List<CalendarDay> days = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            List<String> active = new ArrayList<>();
            for (ShiftType st : shiftTypes) {
                if (st.isActiveOn(d.getDayOfWeek())) {
                    active.add(st.getCode());
                }
            }
            days.add(new CalendarDay(d, classify(d, holidays), active));
        }
        return days;
    }

    public static DayClass classify(LocalDate date, Set<LocalDate> holidays) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return DayClass.WEEKEND;
        }
        return holidays != null && holidays.contains(date) ? DayClass.WEEKEND : DayClass.WEEKDAY;
    }

    /** Days {@code count} back from {@code start}, oldest first, excluding {@code start}. */
    public static List<LocalDate> lookback(LocalDate start, int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        for (int i = count; i >= 1; i--) {
            dates.add(start.minusDays(i));
        }
        return dates;
    }
}
