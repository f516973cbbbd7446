package org.carball.compadvisor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * Audit trail of one attempt to apply a storage change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExecutionRecord {
    long executionId;
    long recommendationId;
    ObjectRef ref;
    ExecutionOperation operation;
    Encoding encodingBefore;
    Encoding encodingAfter;
    String statement;
    boolean dryRun;
    boolean online;
    ExecutionStatus status;
    Instant startedAt;
    Instant endedAt;
    Long sizeBeforeBytes;
    Long sizeAfterBytes;
    String errorDetail;
    /** For REVERT operations and ROLLED_BACK markers, the execution being undone. */
    Long revertOf;

    public long spaceSavedBytes() {
        if (sizeBeforeBytes == null || sizeAfterBytes == null) {
            return 0;
        }
        return sizeBeforeBytes - sizeAfterBytes;
    }

    public Duration elapsed() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }
}
