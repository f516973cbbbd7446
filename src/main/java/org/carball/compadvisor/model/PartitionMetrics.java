package org.carball.compadvisor.model;

public record PartitionMetrics(
        String partitionName,
        long sizeBytes,
        Encoding currentEncoding,
        String storageArea
) {}
