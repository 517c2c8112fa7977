package io.github.riemr.roster.optimization.constraint;

/**
 * Shift {@code from} on one day followed by shift {@code to} on the next day.
 */
public record ShiftTransition(String from, String to) {

    /** Parses {@code "S->F"}. */
    public static ShiftTransition parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("transition must not be null");
        }
        String[] parts = raw.split("->");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Transition must look like FROM->TO: " + raw);
        }
        return new ShiftTransition(parts[0].trim(), parts[1].trim());
    }

    @Override
    public String toString() {
        return from + "->" + to;
    }
}
