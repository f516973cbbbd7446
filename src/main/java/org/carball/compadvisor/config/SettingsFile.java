package org.carball.compadvisor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * YAML representation of {@link AdvisorSettings}. Absent keys keep the built-in defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingsFile {

    @JsonProperty("analysis_parallelism")
    private Integer analysisParallelism;

    @JsonProperty("object_timeout_seconds")
    private Integer objectTimeoutSeconds;

    @JsonProperty("sample_size")
    private Long sampleSize;

    @JsonProperty("modification_window_days")
    private Integer modificationWindowDays;

    @JsonProperty("hotness_cap")
    private Long hotnessCap;

    @JsonProperty("access_cap")
    private Long accessCap;

    @JsonProperty("min_table_size_bytes")
    private Long minTableSizeBytes;

    @JsonProperty("min_segment_size_bytes")
    private Long minSegmentSizeBytes;

    @JsonProperty("excluded_schemas")
    private List<String> excludedSchemas;

    @JsonProperty("execution_parallelism")
    private Integer executionParallelism;

    @JsonProperty("execution_timeout_minutes")
    private Integer executionTimeoutMinutes;

    @JsonProperty("space_safety_factor")
    private Double spaceSafetyFactor;

    @JsonProperty("min_savings_pct")
    private Double minSavingsPct;

    @JsonProperty("history_retention_days")
    private Integer historyRetentionDays;

    @JsonProperty("state_file")
    private String stateFile;

    @JsonProperty("strategies_file")
    private String strategiesFile;

    @JsonProperty("connection_string")
    private String connectionString;

    void applyTo(AdvisorSettings.AdvisorSettingsBuilder builder) {
        if (analysisParallelism != null) builder.analysisParallelism(analysisParallelism);
        if (objectTimeoutSeconds != null) builder.objectTimeoutSeconds(objectTimeoutSeconds);
        if (sampleSize != null) builder.sampleSize(sampleSize);
        if (modificationWindowDays != null) builder.modificationWindowDays(modificationWindowDays);
        if (hotnessCap != null) builder.hotnessCap(hotnessCap);
        if (accessCap != null) builder.accessCap(accessCap);
        if (minTableSizeBytes != null) builder.minTableSizeBytes(minTableSizeBytes);
        if (minSegmentSizeBytes != null) builder.minSegmentSizeBytes(minSegmentSizeBytes);
        if (excludedSchemas != null) builder.excludedSchemas(List.copyOf(excludedSchemas));
        if (executionParallelism != null) builder.executionParallelism(executionParallelism);
        if (executionTimeoutMinutes != null) builder.executionTimeoutMinutes(executionTimeoutMinutes);
        if (spaceSafetyFactor != null) builder.spaceSafetyFactor(spaceSafetyFactor);
        if (minSavingsPct != null) builder.minSavingsPct(minSavingsPct);
        if (historyRetentionDays != null) builder.historyRetentionDays(historyRetentionDays);
        if (stateFile != null) builder.stateFile(stateFile);
        if (strategiesFile != null) builder.strategiesFile(strategiesFile);
        if (connectionString != null) builder.connectionString(connectionString);
    }
}
