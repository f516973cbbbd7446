package org.carball.compadvisor.model;

import java.util.List;

/**
 * Outcome of a batch execution. Batches report partial success rather than all-or-nothing.
 */
public record BatchSummary(
        int processed,
        int succeeded,
        int failed,
        long totalSavingsBytes,
        List<ExecutionRecord> executions
) {}
