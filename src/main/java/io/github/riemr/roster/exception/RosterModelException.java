package io.github.riemr.roster.exception;

import java.util.List;

/**
 * Malformed planning input detected before solving. Carries every problem found,
 * nothing is corrected silently.
 */
public class RosterModelException extends RuntimeException {

    private final List<String> problems;

    public RosterModelException(List<String> problems) {
        super("Invalid planning model: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public RosterModelException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
