package org.carball.compadvisor.scoring;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.engine.EngineException;
import org.carball.compadvisor.model.ModificationCounters;
import org.carball.compadvisor.model.ObjectMetrics;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ReadCounters;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns raw write and read counters into bounded hotness and access scores.
 * <p>
 * The score of an activity count {@code n} is {@code min(100, log10(n + 1) / log10(cap) * 100)},
 * rounded to two decimals, so an object touched once and one touched millions of times land on one
 * comparable scale. Lookup failures never propagate: they are logged and score 0.
 */
@Slf4j
public class ActivityScorer {

    private final long hotnessCap;
    private final long accessCap;

    public ActivityScorer(long hotnessCap, long accessCap) {
        if (hotnessCap <= 1 || accessCap <= 1) {
            throw new IllegalArgumentException("Scoring caps must be greater than 1");
        }
        this.hotnessCap = hotnessCap;
        this.accessCap = accessCap;
    }

    public static double score(long activity, long cap) {
        if (activity <= 0) {
            return 0;
        }
        double raw = Math.log10(activity + 1.0) / Math.log10(cap) * 100.0;
        return Math.round(Math.min(100.0, raw) * 100.0) / 100.0;
    }

    public double hotness(ModificationCounters counters) {
        return counters == null ? 0 : score(counters.total(), hotnessCap);
    }

    public double access(ReadCounters counters) {
        return counters == null ? 0 : score(counters.total(), accessCap);
    }

    /**
     * Share of writes in the object's total activity, 0..1. Zero when there is no activity at all.
     */
    public static double writeRatio(long writes, long reads) {
        long total = Math.max(0, writes) + Math.max(0, reads);
        if (total == 0) {
            return 0;
        }
        return Math.round((double) Math.max(0, writes) / total * 10000.0) / 10000.0;
    }

    /**
     * Reads the object's DML counters from the engine and scores them.
     */
    public ActivityScore scoreHotness(DatabaseEngine engine, ObjectRef ref, Duration window) {
        try {
            Optional<ModificationCounters> counters = engine.listModificationCounters(ref, window);
            if (counters.isEmpty()) {
                log.info("No DML monitoring data yet for {}; hotness scored as 0", ref);
                return ActivityScore.unmonitored();
            }
            long total = counters.get().total();
            return new ActivityScore(score(total, hotnessCap), total, true, false);
        } catch (EngineException | RuntimeException e) {
            log.warn("Error reading DML counters for {}; hotness scored as 0: {}", ref, e.getMessage());
            return ActivityScore.failure();
        }
    }

    /**
     * Scores the read counters carried by the object's metrics.
     */
    public ActivityScore scoreAccess(ObjectMetrics metrics) {
        ReadCounters counters = metrics.getReadCounters();
        if (counters == null) {
            log.info("No segment read statistics yet for {}; access scored as 0", metrics.getRef());
            return ActivityScore.unmonitored();
        }
        long total = counters.total();
        return new ActivityScore(score(total, accessCap), total, true, false);
    }
}
