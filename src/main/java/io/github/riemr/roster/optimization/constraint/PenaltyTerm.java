package io.github.riemr.roster.optimization.constraint;

import com.google.ortools.sat.IntVar;

/**
 * One weighted contribution to the objective.
 *
 * @param variable   violation indicator (boolean) or violation amount (integer)
 * @param upperBound largest value {@code variable} can take
 */
public record PenaltyTerm(PenaltyFamily family, String name, IntVar variable, long weight, long upperBound) {

    public long maxContribution() {
        return weight * upperBound;
    }
}
