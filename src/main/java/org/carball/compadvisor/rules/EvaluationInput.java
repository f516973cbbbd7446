package org.carball.compadvisor.rules;

import lombok.Builder;
import lombok.Value;
import org.carball.compadvisor.model.ObjectType;

/**
 * Signals the rule engine decides on. {@code sizeBytes} is negative when unknown; {@code monitored}
 * is false when the engine had no DML counters for the object.
 */
@Value
@Builder
public class EvaluationInput {
    ObjectType objectType;
    @Builder.Default
    long sizeBytes = -1;
    double hotness;
    double access;
    double writeRatio;
    double ratio;
    @Builder.Default
    boolean monitored = true;
    String partitionName;
}
