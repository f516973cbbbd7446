package org.carball.compadvisor.execution;

/**
 * A reason an execution must not go ahead. Recorded as the error detail of a FAILED execution;
 * the object is untouched and the change can be queued again later.
 */
public record PreconditionViolation(Reason reason, String message) {

    public enum Reason {
        OBJECT_MISSING,
        ENCODING_CHANGED,
        LOCKED,
        INSUFFICIENT_SPACE,
        EXECUTION_IN_PROGRESS,
        INVALID_STATEMENT,
        NOT_ACTIONABLE,
        ENGINE_ERROR
    }

    @Override
    public String toString() {
        return reason + ": " + message;
    }
}
