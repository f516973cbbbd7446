package org.carball.compadvisor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Facts about one object as reported by the database engine.
 * <p>
 * {@code writeCounters} and {@code readCounters} are null when the engine has no monitoring data
 * for the object yet, which is different from counters that are present and zero.
 */
@Value
@Builder(toBuilder = true)
public class ObjectMetrics {
    ObjectRef ref;
    long sizeBytes;
    long rowCount;
    long blockCount;
    ModificationCounters writeCounters;
    ReadCounters readCounters;
    @Builder.Default
    Encoding currentEncoding = Encoding.NONE;
    String storageArea;
    @Builder.Default
    List<PartitionMetrics> partitions = List.of();

    public boolean isPartitioned() {
        return partitions != null && !partitions.isEmpty();
    }
}
