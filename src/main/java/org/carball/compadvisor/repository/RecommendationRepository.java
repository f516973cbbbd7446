package org.carball.compadvisor.repository;

import org.carball.compadvisor.model.Recommendation;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only store of recommendations. A re-analysis adds rows under a new run; existing rows are never changed.
 */
public interface RecommendationRepository {

    /**
     * Stores a new recommendation, assigning its id and creation time when unset.
     *
     * @throws IllegalStateException if a recommendation with the same id already exists
     */
    Recommendation save(Recommendation recommendation);

    Optional<Recommendation> findById(long id);

    List<Recommendation> findByRun(long runId);

    List<Recommendation> findAll();

    /**
     * Matching recommendations ordered by projected savings, then savings percentage, both descending.
     */
    List<Recommendation> query(RecommendationFilter filter);

    long totalProjectedSavings(RecommendationFilter filter);

    /**
     * Removes recommendations created before {@code cutoff}, except those whose id or run is protected.
     *
     * @return number of rows removed
     */
    int purgeOlderThan(Instant cutoff, Set<Long> protectedIds, Set<Long> protectedRunIds);

    void restore(Collection<Recommendation> recommendations);
}
