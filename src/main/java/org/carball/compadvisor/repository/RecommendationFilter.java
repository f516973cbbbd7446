package org.carball.compadvisor.repository;

import lombok.Builder;
import lombok.Value;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Recommendation;

/**
 * Criteria for recommendation queries. Unset criteria do not constrain.
 * <p>
 * By default only actionable recommendations (encoding other than NONE and different from the
 * current one) from the latest run that analyzed each object are returned.
 */
@Value
@Builder(toBuilder = true)
public class RecommendationFilter {
    Integer strategyId;
    Double minSavingsPct;
    ObjectType objectType;
    String owner;
    Long runId;
    @Builder.Default
    boolean actionableOnly = true;
    @Builder.Default
    boolean latestOnly = true;

    public static RecommendationFilter actionable() {
        return RecommendationFilter.builder().build();
    }

    public static RecommendationFilter everything() {
        return RecommendationFilter.builder().actionableOnly(false).latestOnly(false).build();
    }

    boolean accepts(Recommendation recommendation) {
        if (strategyId != null && recommendation.getStrategyId() != strategyId) {
            return false;
        }
        if (minSavingsPct != null && recommendation.getSavingsPct() < minSavingsPct) {
            return false;
        }
        if (objectType != null && recommendation.getRef().objectType() != objectType) {
            return false;
        }
        if (owner != null && !recommendation.getRef().owner().equalsIgnoreCase(owner)) {
            return false;
        }
        if (runId != null && recommendation.getRunId() != runId) {
            return false;
        }
        return !actionableOnly || recommendation.isActionable();
    }
}
