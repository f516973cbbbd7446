package org.carball.compadvisor.model;

/**
 * States of one execution attempt: PENDING, PRECHECK, then DRY_RUN or APPLYING, ending in
 * SUCCEEDED or FAILED. ROLLED_BACK marks a succeeded change that was later reverted.
 */
public enum ExecutionStatus {
    PENDING,
    PRECHECK,
    DRY_RUN,
    APPLYING,
    SUCCEEDED,
    FAILED,
    ROLLED_BACK;

    public boolean isInFlight() {
        return this == PENDING || this == PRECHECK || this == DRY_RUN || this == APPLYING;
    }

    public boolean isTerminal() {
        return !isInFlight();
    }
}
