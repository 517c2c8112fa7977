package io.github.riemr.roster.optimization.solver;

import java.time.LocalDate;

/**
 * Why no roster exists.
 *
 * @param date      affected day, {@code null} for model-wide reasons
 * @param shiftCode affected shift type, {@code null} when not shift specific
 */
public record InfeasibilityReason(InfeasibilityFamily family, LocalDate date, String shiftCode, String message) {

    public static InfeasibilityReason global(InfeasibilityFamily family, String message) {
        return new InfeasibilityReason(family, null, null, message);
    }
}
