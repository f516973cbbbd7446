package org.carball.compadvisor.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AdvisorSettings {

    private static final long MIB = 1024L * 1024L;

    // Analysis
    @Builder.Default
    private int analysisParallelism = 4;

    @Builder.Default
    private int objectTimeoutSeconds = 60;

    @Builder.Default
    private long sampleSize = 1_000_000L;

    @Builder.Default
    private int modificationWindowDays = 7;

    // Scoring caps ("maximally hot / accessed")
    @Builder.Default
    private long hotnessCap = 1_000_000L;

    @Builder.Default
    private long accessCap = 100_000_000L;

    // Scope filters
    @Builder.Default
    private long minTableSizeBytes = MIB;

    @Builder.Default
    private long minSegmentSizeBytes = 10 * MIB;

    @Builder.Default
    private List<String> excludedSchemas = List.of(
            "SYS", "SYSTEM", "AUDSYS", "OUTLN", "DBSNMP", "GSMADMIN_INTERNAL", "XDB", "WMSYS",
            "CTXSYS", "MDSYS", "ORDSYS", "ORDDATA", "OLAPSYS", "APPQOSSYS", "DBSFWUSER", "GGSYS",
            "SPATIAL_CSW_ADMIN_USR", "SPATIAL_WFS_ADMIN_USR", "ANONYMOUS", "APEX_PUBLIC_USER", "DIP",
            "FLOWS_FILES", "MDDATA", "ORACLE_OCM", "XS$NULL", "REMOTE_SCHEDULER_AGENT",
            "APEX_INSTANCE_ADMIN_USER");

    @Builder.Default
    private List<String> excludedSchemaPrefixes = List.of("APEX_", "ORACLE", "FLOWS_");

    // Execution
    @Builder.Default
    private int executionParallelism = 2;

    @Builder.Default
    private int executionTimeoutMinutes = 30;

    @Builder.Default
    private double spaceSafetyFactor = 2.0;

    /** How long a timed-out statement may take to stop after cancellation before it is left running. */
    @Builder.Default
    private long statementCancelGraceMillis = 60_000L;

    // Reporting
    @Builder.Default
    private double minSavingsPct = 20.0;

    @Builder.Default
    private int historyRetentionDays = 90;

    // Wiring
    @Builder.Default
    private String stateFile = "compadvisor-state.json";

    private String strategiesFile;

    private String connectionString;

    public static AdvisorSettings defaults() {
        return AdvisorSettings.builder().build();
    }

    public Duration getObjectTimeout() {
        return Duration.ofSeconds(objectTimeoutSeconds);
    }

    public Duration getExecutionTimeout() {
        return Duration.ofMinutes(executionTimeoutMinutes);
    }

    public Duration getStatementCancelGrace() {
        return Duration.ofMillis(statementCancelGraceMillis);
    }

    public Duration getModificationWindow() {
        return Duration.ofDays(modificationWindowDays);
    }

    /**
     * True for system schemas that are never analyzed.
     */
    public boolean isExcludedSchema(String owner) {
        if (owner == null) {
            return false;
        }
        String upper = owner.toUpperCase();
        if (excludedSchemas.contains(upper)) {
            return true;
        }
        return excludedSchemaPrefixes.stream().anyMatch(upper::startsWith);
    }

    /**
     * Logs warnings for values that are legal but probably not what the operator meant.
     */
    public void validate() {
        if (analysisParallelism < 1) {
            log.warn("Analysis parallelism ({}) should be at least 1; using 1", analysisParallelism);
        }
        if (executionParallelism < 1) {
            log.warn("Execution parallelism ({}) should be at least 1; using 1", executionParallelism);
        }
        if (hotnessCap <= 1 || accessCap <= 1) {
            log.warn("Scoring caps should be greater than 1 (hotness: {}, access: {})", hotnessCap, accessCap);
        }
        if (objectTimeoutSeconds <= 0) {
            log.warn("Per-object timeout ({}s) should be positive", objectTimeoutSeconds);
        }
        if (spaceSafetyFactor < 1.0) {
            log.warn("Space safety factor ({}) below 1.0 allows moves into a nearly full storage area", spaceSafetyFactor);
        }
        if (minSavingsPct < 0 || minSavingsPct > 100) {
            log.warn("Minimum savings percentage ({}) should be between 0 and 100", minSavingsPct);
        }

        log.debug("Using settings - Parallelism: {}, Timeout: {}s, Sample: {}, Caps: {}/{}",
                analysisParallelism, objectTimeoutSeconds, sampleSize, hotnessCap, accessCap);
    }

    public String getConfigurationSummary() {
        return String.format("Parallelism: %d | Object timeout: %ds | Sample rows: %d | Exec parallelism: %d | Min savings: %.1f%%",
                analysisParallelism, objectTimeoutSeconds, sampleSize, executionParallelism, minSavingsPct);
    }
}
