package org.carball.compadvisor.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.ExecutionStatus;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.model.RecommendationPriority;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class AdvisorReport {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final List<Recommendation> recommendations;
    private final List<ExecutionRecord> executions;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AdvisorReport(List<Recommendation> recommendations, List<ExecutionRecord> executions) {
        this.recommendations = recommendations;
        this.executions = executions;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Compression Advisor Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Recommendations | ").append(recommendations.size()).append(" |\n");
        md.append("| Current Size | ").append(mb(totalSize())).append(" |\n");
        md.append("| Projected Savings | ").append(mb(totalSavings())).append(" |\n");
        for (Map.Entry<RecommendationPriority, Long> entry : countByPriority().entrySet()) {
            md.append("| ").append(priorityBadge(entry.getKey())).append(" | ").append(entry.getValue()).append(" |\n");
        }
        md.append("| Executions | ").append(executions.size()).append(" |\n\n");

        // Recommendations
        md.append("## Recommendations\n\n");
        if (recommendations.isEmpty()) {
            md.append("**No actionable recommendations.**\n\n");
        } else {
            md.append("| # | Object | Type | Current | Recommended | Ratio | Size | Savings | Priority |\n");
            md.append("|---|--------|------|---------|-------------|-------|------|---------|----------|\n");
            int row = 1;
            for (Recommendation rec : recommendations) {
                md.append("| ").append(row++)
                        .append(" | `").append(rec.getRef()).append("`")
                        .append(" | ").append(rec.getRef().objectType().getDisplayName())
                        .append(" | ").append(rec.getCurrentEncoding() == null ? "unknown" : rec.getCurrentEncoding())
                        .append(" | ").append(rec.getRecommendedEncoding())
                        .append(" | ").append(format("%.2f:1", rec.getCompressionRatio()))
                        .append(" | ").append(mb(rec.getSizeBytes()))
                        .append(" | ").append(mb(rec.getProjectedSavingsBytes()))
                        .append(format(" (%.1f%%)", rec.getSavingsPct()))
                        .append(" | ").append(priorityBadge(rec.getPriority()))
                        .append(" |\n");
            }
            md.append("\n### Rationale\n\n");
            for (Recommendation rec : recommendations) {
                md.append("- **").append(rec.getRef()).append(":** ").append(rec.getRationale()).append("\n");
            }
            md.append("\n");
        }

        // Executions
        if (!executions.isEmpty()) {
            md.append("## Execution History\n\n");
            md.append("| Id | Object | Operation | Status | Dry Run | Saved | Error |\n");
            md.append("|----|--------|-----------|--------|---------|-------|-------|\n");
            for (ExecutionRecord exec : executions) {
                md.append("| ").append(exec.getExecutionId())
                        .append(" | `").append(exec.getRef()).append("`")
                        .append(" | ").append(exec.getOperation())
                        .append(" | ").append(statusBadge(exec.getStatus()))
                        .append(" | ").append(exec.isDryRun() ? "yes" : "no")
                        .append(" | ").append(mb(exec.spaceSavedBytes()))
                        .append(" | ").append(exec.getErrorDetail() == null ? "" : exec.getErrorDetail().replace("|", "\\|"))
                        .append(" |\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private ReportData buildReportData() {
        Map<ObjectType, Long> savingsByType = new EnumMap<>(ObjectType.class);
        for (Recommendation rec : recommendations) {
            savingsByType.merge(rec.getRef().objectType(), rec.getProjectedSavingsBytes(), Long::sum);
        }
        return ReportData.builder()
                .generatedAt(timestamp)
                .recommendationCount(recommendations.size())
                .totalSizeBytes(totalSize())
                .totalProjectedSavingsBytes(totalSavings())
                .savingsByObjectType(savingsByType)
                .countByPriority(countByPriority())
                .recommendations(recommendations)
                .executions(executions.isEmpty() ? null : executions)
                .build();
    }

    private long totalSize() {
        return recommendations.stream().mapToLong(Recommendation::getSizeBytes).sum();
    }

    private long totalSavings() {
        return recommendations.stream().mapToLong(Recommendation::getProjectedSavingsBytes).sum();
    }

    private Map<RecommendationPriority, Long> countByPriority() {
        Map<RecommendationPriority, Long> counts = new EnumMap<>(RecommendationPriority.class);
        for (Recommendation rec : recommendations) {
            counts.merge(rec.getPriority(), 1L, Long::sum);
        }
        return counts;
    }

    private static String priorityBadge(RecommendationPriority priority) {
        switch (priority) {
            case HIGH: return "🔴 High";
            case MEDIUM: return "🟡 Medium";
            default: return "🟢 Low";
        }
    }

    private static String statusBadge(ExecutionStatus status) {
        switch (status) {
            case SUCCEEDED: return "✅ SUCCEEDED";
            case FAILED: return "❌ FAILED";
            case ROLLED_BACK: return "↩️ ROLLED_BACK";
            default: return status.name();
        }
    }

    static String mb(long bytes) {
        return format("%.2f MB", bytes / BYTES_PER_MB);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    @Data
    @Builder
    private static class ReportData {
        private LocalDateTime generatedAt;
        private int recommendationCount;
        private long totalSizeBytes;
        private long totalProjectedSavingsBytes;
        private Map<ObjectType, Long> savingsByObjectType;
        private Map<RecommendationPriority, Long> countByPriority;
        private List<Recommendation> recommendations;
        private List<ExecutionRecord> executions;
    }
}
