package io.github.riemr.roster.optimization.objective;

import io.github.riemr.roster.exception.RosterModelException;
import io.github.riemr.roster.optimization.constraint.PenaltyFamily;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Objective weights per soft rule. Immutable; overrides produce a new table.
 * <p>
 * The families are ranked: one violation of a higher family must outweigh anything a lower family
 * normally accumulates, so every table keeps the ranking strictly decreasing.
 */
public final class WeightTable {

    /** Highest priority first. */
    public static final List<PenaltyFamily> RANKING = List.of(
            PenaltyFamily.REST_TIME,
            PenaltyFamily.CONSECUTIVE_DAYS,
            PenaltyFamily.TEAM_ROTATION,
            PenaltyFamily.LEGACY_MINIMUM_HOURS,
            PenaltyFamily.RELIEF_RESERVE,
            PenaltyFamily.FAIRNESS);

    private static final WeightTable DEFAULTS = new WeightTable(Map.of(
            PenaltyFamily.REST_TIME, 1_000_000L,
            PenaltyFamily.CONSECUTIVE_DAYS, 100_000L,
            PenaltyFamily.TEAM_ROTATION, 10_000L,
            PenaltyFamily.LEGACY_MINIMUM_HOURS, 1_000L,
            PenaltyFamily.RELIEF_RESERVE, 100L,
            PenaltyFamily.FAIRNESS, 1L));

    private final Map<PenaltyFamily, Long> weights;

    private WeightTable(Map<PenaltyFamily, Long> weights) {
        EnumMap<PenaltyFamily, Long> copy = new EnumMap<>(PenaltyFamily.class);
        copy.putAll(weights);
        validate(copy);
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static WeightTable defaults() {
        return DEFAULTS;
    }

    public WeightTable withOverrides(Map<PenaltyFamily, Long> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        EnumMap<PenaltyFamily, Long> merged = new EnumMap<>(weights);
        merged.putAll(overrides);
        return new WeightTable(merged);
    }

    public long weightOf(PenaltyFamily family) {
        return weights.get(family);
    }

    public Map<PenaltyFamily, Long> asMap() {
        return weights;
    }

    private static void validate(Map<PenaltyFamily, Long> weights) {
        List<String> problems = new ArrayList<>();
        for (PenaltyFamily family : RANKING) {
            Long w = weights.get(family);
            if (w == null) {
                problems.add("Missing weight for " + family);
            } else if (w <= 0) {
                problems.add("Weight of " + family + " must be positive: " + w);
            }
        }
        if (problems.isEmpty()) {
            for (int i = 1; i < RANKING.size(); i++) {
                PenaltyFamily higher = RANKING.get(i - 1);
                PenaltyFamily lower = RANKING.get(i);
                if (weights.get(higher) <= weights.get(lower)) {
                    problems.add("Weight of " + higher + " (" + weights.get(higher) + ") must exceed weight of "
                            + lower + " (" + weights.get(lower) + ")");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new RosterModelException(problems);
        }
    }

    @Override
    public String toString() {
        return "WeightTable" + weights;
    }
}
