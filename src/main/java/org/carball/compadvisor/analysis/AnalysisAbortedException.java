package org.carball.compadvisor.analysis;

/**
 * Thrown when an analysis run cannot continue at all, for instance because the database is
 * unreachable. The run is recorded as FAILED; earlier runs are unaffected.
 */
public class AnalysisAbortedException extends Exception {

    private final long runId;

    public AnalysisAbortedException(long runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public long getRunId() {
        return runId;
    }
}
