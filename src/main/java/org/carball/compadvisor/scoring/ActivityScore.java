package org.carball.compadvisor.scoring;

/**
 * A 0..100 activity score.
 *
 * @param monitored false when the engine had no counters for the object; the score is then 0
 *                  but does not mean the object is known to be cold
 * @param failed    true when the counters could not be read at all
 */
public record ActivityScore(double score, long activity, boolean monitored, boolean failed) {

    public static ActivityScore unmonitored() {
        return new ActivityScore(0, 0, false, false);
    }

    public static ActivityScore failure() {
        return new ActivityScore(0, 0, false, true);
    }
}
