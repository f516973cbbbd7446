package org.carball.compadvisor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * The advisor's decision for one object (or partition) under one analysis run. Never mutated once saved.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Recommendation {
    long id;
    long runId;
    int strategyId;
    ObjectRef ref;
    String storageArea;
    long sizeBytes;
    /** Null when the object could not be analyzed. */
    Encoding currentEncoding;
    /** Ratio per tested candidate; untestable candidates are recorded as 1.0. */
    Map<Encoding, Double> candidateRatios;
    Encoding recommendedEncoding;
    double compressionRatio;
    double hotnessScore;
    double accessScore;
    double writeRatio;
    String rationale;
    long projectedSizeBytes;
    long projectedSavingsBytes;
    double savingsPct;
    RecommendationPriority priority;
    boolean analysisFailed;
    Instant createdAt;

    /**
     * True when applying the recommendation would change the object's storage.
     */
    public boolean isActionable() {
        return recommendedEncoding != null
                && recommendedEncoding != Encoding.NONE
                && recommendedEncoding != currentEncoding;
    }
}
