package io.github.riemr.roster.exception;

/**
 * The optimizer itself failed (native error, invalid model). Fatal for the solve;
 * retry policy belongs to the caller.
 */
public class SolverInternalException extends RuntimeException {

    public SolverInternalException(String message) {
        super(message);
    }

    public SolverInternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
