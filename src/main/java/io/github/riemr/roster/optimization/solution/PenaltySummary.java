package io.github.riemr.roster.optimization.solution;

import io.github.riemr.roster.optimization.constraint.PenaltyFamily;

/**
 * @param violations    number of violations (or hours short, for weekly minimum hours)
 * @param weightedTotal contribution to the objective
 */
public record PenaltySummary(PenaltyFamily family, long violations, long weightedTotal) {
}
