package org.carball.compadvisor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One invocation of the advisor against a scope with a chosen strategy.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisRun {
    long runId;
    int strategyId;
    String strategyName;
    String scopeOwner;
    int parallelism;
    RunStatus status;
    Instant startedAt;
    Instant finishedAt;
    int objectsAnalyzed;
    int objectsFailed;
    int recommendationsCreated;
    String errorDetail;
}
