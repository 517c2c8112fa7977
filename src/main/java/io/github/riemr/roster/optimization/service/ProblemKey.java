package io.github.riemr.roster.optimization.service;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identifies a solve: planning horizon plus the organizational scope it was requested for.
 */
public final class ProblemKey {
    private final LocalDate start;
    private final LocalDate end;
    private final String scope;

    public ProblemKey(LocalDate start, LocalDate end, String scope) {
        this.start = start;
        this.end = end;
        this.scope = scope;
    }

    public LocalDate getStart() { return start; }
    public LocalDate getEnd() { return end; }
    public String getScope() { return scope; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProblemKey that = (ProblemKey) o;
        return Objects.equals(start, that.start) &&
               Objects.equals(end, that.end) &&
               Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, scope);
    }

    @Override
    public String toString() {
        return start + ".." + end + (scope != null ? ":" + scope : "");
    }
}
