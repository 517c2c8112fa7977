package io.github.riemr.roster.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * A named work period (early/late/night...) with its own hours and staffing rules.
 */
@Value
@Builder
public class ShiftType {

    /** Hours are handed to the solver in tenths so that 9.5h shifts stay integral. */
    public static final int HOUR_SCALE = 10;

    String code;
    String name;
    LocalTime start;
    LocalTime end;
    /** Nominal duration in hours. */
    double hours;
    StaffingBounds weekdayStaffing;
    StaffingBounds weekendStaffing;
    @Builder.Default
    double weeklyHoursCeiling = 48.0;
    @Builder.Default
    double nominalWeeklyHours = 40.0;
    @Builder.Default
    int maxConsecutiveDays = 6;
    @Builder.Default
    Set<DayOfWeek> activeDays = EnumSet.allOf(DayOfWeek.class);

    public StaffingBounds staffingFor(DayClass dayClass) {
        return dayClass == DayClass.WEEKEND ? weekendStaffing : weekdayStaffing;
    }

    public boolean isActiveOn(DayOfWeek dayOfWeek) {
        return activeDays.contains(dayOfWeek);
    }

    /** Night shifts end on the following calendar day. */
    public boolean endsNextDay() {
        return !end.isAfter(start);
    }

    public LocalDateTime startOn(LocalDate day) {
        return day.atTime(start);
    }

    public LocalDateTime endOn(LocalDate day) {
        LocalDate endDay = endsNextDay() ? day.plusDays(1) : day;
        return endDay.atTime(end);
    }

    public int scaledHours() {
        return (int) Math.round(hours * HOUR_SCALE);
    }
}
