package org.carball.compadvisor.rules;

import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Rule;

import java.util.Locale;

/**
 * Builds the audit text stored with a recommendation. Output depends only on the arguments, with a
 * fixed number format, so identical inputs always give identical text.
 */
public final class RationaleBuilder {

    private static final double HIGH_THRESHOLD = 70;
    private static final double MODERATE_THRESHOLD = 30;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private RationaleBuilder() {
    }

    public static String hotnessLabel(double hotness) {
        if (hotness > HIGH_THRESHOLD) return "High DML";
        if (hotness > MODERATE_THRESHOLD) return "Moderate DML";
        return "Low DML";
    }

    public static String accessLabel(double access) {
        if (access > HIGH_THRESHOLD) return "Frequently accessed";
        if (access > MODERATE_THRESHOLD) return "Moderately accessed";
        return "Rarely accessed";
    }

    public static String build(EvaluationInput input, Encoding encoding, Rule matchedRule) {
        StringBuilder text = new StringBuilder();

        if (input.getSizeBytes() >= 0) {
            text.append(format("Size: %.2f MB; ", input.getSizeBytes() / BYTES_PER_MB));
        }

        if (input.getObjectType() == ObjectType.TABLE) {
            text.append(format("Hotness: %.2f/100 (%s", input.getHotness(), hotnessLabel(input.getHotness())));
            if (!input.isMonitored()) {
                text.append(", no monitoring data");
            }
            text.append("); ");
        }

        text.append(format("Access: %.2f/100", input.getAccess()));
        if (input.getAccess() > HIGH_THRESHOLD) {
            text.append(" (").append(accessLabel(input.getAccess())).append(")");
        }
        text.append("; ");

        if (input.getObjectType() == ObjectType.TABLE && input.getWriteRatio() > 0) {
            text.append(format("Write ratio: %.2f; ", input.getWriteRatio()));
        }

        text.append(format("Compression ratio: %.2f:1; ", input.getRatio()));
        text.append(explain(encoding, input.getRatio()));

        if (matchedRule != null) {
            text.append(" [rule ").append(matchedRule.getRuleId());
            if (matchedRule.getDescription() != null && !matchedRule.getDescription().isBlank()) {
                text.append(": ").append(matchedRule.getDescription());
            }
            text.append("]");
        } else if (encoding != Encoding.NONE) {
            text.append(" [default ratio thresholds]");
        }

        if (input.getPartitionName() != null && !input.getPartitionName().isBlank()) {
            text.append(" (Partition: ").append(input.getPartitionName()).append(")");
        }
        return text.toString();
    }

    private static String explain(Encoding encoding, double ratio) {
        switch (encoding) {
            case NONE:
                return ratio <= 1.0
                        ? "Compression not worthwhile, no estimated savings"
                        : "Compression not recommended for this activity profile";
            case BASIC:
                return "Basic compression suits read-mostly data loaded in bulk";
            case OLTP:
                return "OLTP compression keeps conventional DML compressed";
            case QUERY_LOW:
            case QUERY_HIGH:
                return "Columnar compression for query-heavy data with little DML";
            case ARCHIVE_LOW:
            case ARCHIVE_HIGH:
                return "Archive compression for cold, rarely modified data";
            case INDEX_ADVANCED_LOW:
            case INDEX_ADVANCED_HIGH:
                return "Advanced index compression reduces leaf block count";
            case LOB_LOW:
            case LOB_MEDIUM:
            case LOB_HIGH:
                return "SecureFiles LOB compression";
            default:
                return encoding.getDescription();
        }
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
