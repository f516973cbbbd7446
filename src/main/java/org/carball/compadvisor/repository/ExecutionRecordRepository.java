package org.carball.compadvisor.repository;

import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.ExecutionStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Audit trail of execution attempts. A record may move through its in-flight states; once it
 * reaches a terminal state it is never changed again.
 */
public interface ExecutionRecordRepository {

    /**
     * Stores {@code pending} only if no in-flight record exists for the same object lock key.
     * The check and the insert are atomic.
     *
     * @return the stored record with its id, or empty when another execution holds the object
     */
    Optional<ExecutionRecord> beginIfIdle(ExecutionRecord pending);

    /**
     * Replaces an in-flight record with its next state.
     *
     * @throws IllegalStateException if the record is unknown or already terminal
     */
    ExecutionRecord update(ExecutionRecord record);

    /**
     * Stores a new record regardless of other in-flight work, assigning its id.
     */
    ExecutionRecord append(ExecutionRecord record);

    Optional<ExecutionRecord> findById(long executionId);

    List<ExecutionRecord> findAll();

    Optional<ExecutionRecord> findInFlight(String lockKey);

    /**
     * Records started at or after {@code since}, newest first, optionally narrowed by owner and status.
     */
    List<ExecutionRecord> history(Instant since, String owner, ExecutionStatus status);

    Set<Long> referencedRecommendationIds();

    void restore(Collection<ExecutionRecord> records);
}
