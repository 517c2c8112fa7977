package io.github.riemr.roster.optimization.solution;

import io.github.riemr.roster.domain.model.ShiftAssignment;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record ExtractedRoster(List<ShiftAssignment> assignments,
                              Map<LocalDate, Map<String, List<Long>>> scheduleView,
                              Map<Long, Map<LocalDate, String>> completeGrid,
                              Map<LocalDate, Long> dayDuties,
                              List<PenaltySummary> penalties) {
}
