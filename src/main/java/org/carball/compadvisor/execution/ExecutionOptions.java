package org.carball.compadvisor.execution;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * How to run a storage change. Dry run is the default; real execution must be asked for.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionOptions {
    @Builder.Default
    boolean dryRun = true;
    @Builder.Default
    boolean online = false;
    /** Statement timeout; null uses the configured default. */
    Duration timeout;
    @Builder.Default
    boolean rebuildIndexes = true;

    public static ExecutionOptions dryRun() {
        return ExecutionOptions.builder().build();
    }

    public static ExecutionOptions apply() {
        return ExecutionOptions.builder().dryRun(false).build();
    }
}
