package io.github.riemr.roster.application.dto;

/**
 * Employee head counts. Only {@code activeWithTeam} is available for shift planning.
 */
public record ActivityBuckets(int activeWithTeam, int activeWithoutTeam, int inactive) {

    /** Active in the system, with or without team. */
    public int systemActive() {
        return activeWithTeam + activeWithoutTeam;
    }

    public int total() {
        return systemActive() + inactive;
    }
}
