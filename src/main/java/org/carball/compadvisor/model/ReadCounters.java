package org.carball.compadvisor.model;

/**
 * Segment-level read statistics.
 */
public record ReadCounters(long logicalReads, long physicalReads) {

    public static final ReadCounters ZERO = new ReadCounters(0, 0);

    public long total() {
        return Math.max(0, logicalReads) + Math.max(0, physicalReads);
    }
}
