package org.carball.compadvisor.model;

/**
 * DML counters recorded by the database's table monitoring since the last statistics window.
 */
public record ModificationCounters(long inserts, long updates, long deletes) {

    public static final ModificationCounters ZERO = new ModificationCounters(0, 0, 0);

    public long total() {
        return Math.max(0, inserts) + Math.max(0, updates) + Math.max(0, deletes);
    }
}
