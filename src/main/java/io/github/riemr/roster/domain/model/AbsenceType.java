package io.github.riemr.roster.domain.model;

/**
 * Absence type tags. All types block shift assignment; only {@link #TRAINING}
 * is credited like a worked shift day in hour accounting.
 */
public enum AbsenceType {
    SICK("AU", false),
    VACATION("U", false),
    TRAINING("L", true),
    CUSTOM(null, false);

    private final String code;
    private final boolean creditEquivalent;

    AbsenceType(String code, boolean creditEquivalent) {
        this.code = code;
        this.creditEquivalent = creditEquivalent;
    }

    public String getCode() {
        return code;
    }

    public boolean isCreditEquivalent() {
        return creditEquivalent;
    }

    public static AbsenceType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return CUSTOM;
        }
        String normalized = code.trim().toUpperCase();
        for (AbsenceType type : values()) {
            if (normalized.equals(type.code)) {
                return type;
            }
        }
        return CUSTOM;
    }
}
