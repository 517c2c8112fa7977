package io.github.riemr.roster.domain.model;

public record StaffingBounds(int min, int max) {

    public static StaffingBounds of(int min, int max) {
        return new StaffingBounds(min, max);
    }

    public boolean isValid() {
        return min >= 0 && max >= 0 && min <= max;
    }

    public boolean admits(int count) {
        return count >= min && count <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ".." + max + "]";
    }
}
