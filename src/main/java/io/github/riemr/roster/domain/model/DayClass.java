package io.github.riemr.roster.domain.model;

public enum DayClass {
    WEEKDAY,
    WEEKEND
}
