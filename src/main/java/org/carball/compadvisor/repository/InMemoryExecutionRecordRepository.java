package org.carball.compadvisor.repository;

import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.ExecutionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public class InMemoryExecutionRecordRepository implements ExecutionRecordRepository {

    private final Map<Long, ExecutionRecord> records = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized Optional<ExecutionRecord> beginIfIdle(ExecutionRecord pending) {
        if (findInFlight(pending.getRef().lockKey()).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(append(pending));
    }

    @Override
    public synchronized ExecutionRecord update(ExecutionRecord record) {
        ExecutionRecord existing = records.get(record.getExecutionId());
        if (existing == null) {
            throw new IllegalStateException("Unknown execution: " + record.getExecutionId());
        }
        if (existing.getStatus().isTerminal()) {
            throw new IllegalStateException("Execution " + record.getExecutionId() + " is already "
                    + existing.getStatus() + " and cannot change");
        }
        records.put(record.getExecutionId(), record);
        return record;
    }

    @Override
    public synchronized ExecutionRecord append(ExecutionRecord record) {
        ExecutionRecord stored = record.toBuilder().executionId(nextId++).build();
        records.put(stored.getExecutionId(), stored);
        return stored;
    }

    @Override
    public synchronized Optional<ExecutionRecord> findById(long executionId) {
        return Optional.ofNullable(records.get(executionId));
    }

    @Override
    public synchronized List<ExecutionRecord> findAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public synchronized Optional<ExecutionRecord> findInFlight(String lockKey) {
        return records.values().stream()
                .filter(r -> r.getStatus().isInFlight())
                .filter(r -> r.getRef().lockKey().equals(lockKey))
                .findFirst();
    }

    @Override
    public synchronized List<ExecutionRecord> history(Instant since, String owner, ExecutionStatus status) {
        return records.values().stream()
                .filter(r -> since == null || !r.getStartedAt().isBefore(since))
                .filter(r -> owner == null || r.getRef().owner().equalsIgnoreCase(owner))
                .filter(r -> status == null || r.getStatus() == status)
                .sorted(Comparator.comparing(ExecutionRecord::getStartedAt).reversed()
                        .thenComparing(Comparator.comparingLong(ExecutionRecord::getExecutionId).reversed()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Set<Long> referencedRecommendationIds() {
        return records.values().stream()
                .map(ExecutionRecord::getRecommendationId)
                .filter(id -> id > 0)
                .collect(Collectors.toSet());
    }

    @Override
    public synchronized void restore(Collection<ExecutionRecord> restored) {
        for (ExecutionRecord record : restored) {
            records.put(record.getExecutionId(), record);
            nextId = Math.max(nextId, record.getExecutionId() + 1);
        }
    }
}
