package io.github.riemr.roster.optimization.constraint;

import io.github.riemr.roster.domain.model.ShiftType;
import io.github.riemr.roster.exception.RosterModelException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Shift transitions from one day to the next that leave less than the legal rest period.
 */
public final class RestTimeRules {

    /** Any Monday works, only the time of day matters. */
    private static final LocalDate REFERENCE_DAY = LocalDate.of(2024, 1, 1);

    private RestTimeRules() {
    }

    /**
     * Configured transitions win; otherwise every pair whose rest (end of the first shift to start of the
     * next-day shift) is shorter than {@code minRestHours} is forbidden.
     */
    public static List<ShiftTransition> forbiddenTransitions(Collection<ShiftType> shiftTypes,
                                                             List<ShiftTransition> configured,
                                                             int minRestHours) {
        Map<String, ShiftType> byCode = shiftTypes.stream()
                .collect(Collectors.toMap(ShiftType::getCode, Function.identity()));
        if (configured != null && !configured.isEmpty()) {
            List<String> problems = new ArrayList<>();
            for (ShiftTransition t : configured) {
                if (!byCode.containsKey(t.from()) || !byCode.containsKey(t.to())) {
                    problems.add("Forbidden transition " + t + " references an unknown shift type");
                }
            }
            if (!problems.isEmpty()) {
                throw new RosterModelException(problems);
            }
            return List.copyOf(configured);
        }
        Duration minRest = Duration.ofHours(minRestHours);
        List<ShiftTransition> forbidden = new ArrayList<>();
        for (ShiftType from : shiftTypes) {
            for (ShiftType to : shiftTypes) {
                if (restBetween(from, to).compareTo(minRest) < 0) {
                    forbidden.add(new ShiftTransition(from.getCode(), to.getCode()));
                }
            }
        }
        return forbidden;
    }

    /** Rest between {@code from} on one day and {@code to} on the following day; negative when they overlap. */
    public static Duration restBetween(ShiftType from, ShiftType to) {
        return Duration.between(from.endOn(REFERENCE_DAY), to.startOn(REFERENCE_DAY.plusDays(1)));
    }
}
