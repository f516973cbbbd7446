package org.carball.compadvisor.repository;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.Recommendation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class InMemoryRecommendationRepository implements RecommendationRepository {

    static final Comparator<Recommendation> BY_SAVINGS = Comparator
            .comparingLong(Recommendation::getProjectedSavingsBytes).reversed()
            .thenComparing(Comparator.comparingDouble(Recommendation::getSavingsPct).reversed())
            .thenComparingLong(Recommendation::getId);

    private final Map<Long, Recommendation> rows = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized Recommendation save(Recommendation recommendation) {
        Recommendation stored = recommendation;
        if (stored.getId() == 0) {
            stored = stored.toBuilder().id(nextId).build();
        } else if (rows.containsKey(stored.getId())) {
            throw new IllegalStateException("Recommendation " + stored.getId() + " already exists; recommendations are append-only");
        }
        if (stored.getCreatedAt() == null) {
            stored = stored.toBuilder().createdAt(Instant.now()).build();
        }
        nextId = Math.max(nextId, stored.getId() + 1);
        rows.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public synchronized Optional<Recommendation> findById(long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized List<Recommendation> findByRun(long runId) {
        return rows.values().stream()
                .filter(r -> r.getRunId() == runId)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Recommendation> findAll() {
        return new ArrayList<>(rows.values());
    }

    @Override
    public synchronized List<Recommendation> query(RecommendationFilter filter) {
        Collection<Recommendation> candidates = filter.isLatestOnly() ? latestPerObject() : rows.values();
        return candidates.stream()
                .filter(filter::accepts)
                .sorted(BY_SAVINGS)
                .collect(Collectors.toList());
    }

    @Override
    public long totalProjectedSavings(RecommendationFilter filter) {
        return query(filter).stream()
                .filter(Recommendation::isActionable)
                .mapToLong(Recommendation::getProjectedSavingsBytes)
                .sum();
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff, Set<Long> protectedIds, Set<Long> protectedRunIds) {
        int before = rows.size();
        rows.values().removeIf(r -> r.getCreatedAt().isBefore(cutoff)
                && !protectedIds.contains(r.getId())
                && !protectedRunIds.contains(r.getRunId()));
        int removed = before - rows.size();
        log.info("Purged {} recommendations created before {}", removed, cutoff);
        return removed;
    }

    @Override
    public synchronized void restore(Collection<Recommendation> recommendations) {
        for (Recommendation recommendation : recommendations) {
            rows.put(recommendation.getId(), recommendation);
            nextId = Math.max(nextId, recommendation.getId() + 1);
        }
    }

    // Per strategy and object, the row from the most recent run
    private Collection<Recommendation> latestPerObject() {
        Map<String, Recommendation> latest = new HashMap<>();
        for (Recommendation r : rows.values()) {
            String key = r.getStrategyId() + "|" + key(r.getRef());
            latest.merge(key, r, (a, b) -> b.getRunId() >= a.getRunId() ? b : a);
        }
        return latest.values();
    }

    private static String key(ObjectRef ref) {
        return ref.objectType() + ":" + ref.qualifiedName() + ":" + (ref.isPartition() ? ref.partitionName() : "");
    }
}
