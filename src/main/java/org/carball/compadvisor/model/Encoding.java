package org.carball.compadvisor.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Storage encodings the advisor can recommend.
 * <p>
 * Each encoding knows the storage clause the database expects, the object types it can be applied to
 * and a relative CPU overhead rank (lower is cheaper) used to break ties between equal ratios.
 */
@Getter
public enum Encoding {

    NONE("NOCOMPRESS", 0, EnumSet.allOf(ObjectType.class), "No compression"),

    // Row-store table encodings
    BASIC("COMPRESS BASIC", 1, EnumSet.of(ObjectType.TABLE), "Basic table compression"),
    OLTP("COMPRESS FOR OLTP", 2, EnumSet.of(ObjectType.TABLE), "OLTP (advanced row) compression"),

    // Hybrid columnar encodings
    QUERY_LOW("COMPRESS FOR QUERY LOW", 3, EnumSet.of(ObjectType.TABLE), "Columnar query low"),
    QUERY_HIGH("COMPRESS FOR QUERY HIGH", 4, EnumSet.of(ObjectType.TABLE), "Columnar query high"),
    ARCHIVE_LOW("COMPRESS FOR ARCHIVE LOW", 5, EnumSet.of(ObjectType.TABLE), "Columnar archive low"),
    ARCHIVE_HIGH("COMPRESS FOR ARCHIVE HIGH", 6, EnumSet.of(ObjectType.TABLE), "Columnar archive high"),

    // Index encodings
    INDEX_ADVANCED_LOW("COMPRESS ADVANCED LOW", 1, EnumSet.of(ObjectType.INDEX), "Index advanced low"),
    INDEX_ADVANCED_HIGH("COMPRESS ADVANCED HIGH", 2, EnumSet.of(ObjectType.INDEX), "Index advanced high"),

    // SecureFiles LOB encodings
    LOB_LOW("COMPRESS LOW", 1, EnumSet.of(ObjectType.LOB), "LOB low"),
    LOB_MEDIUM("COMPRESS MEDIUM", 2, EnumSet.of(ObjectType.LOB), "LOB medium"),
    LOB_HIGH("COMPRESS HIGH", 3, EnumSet.of(ObjectType.LOB), "LOB high");

    private final String storageClause;
    private final int cpuOverheadRank;
    private final Set<ObjectType> applicableTypes;
    private final String description;

    Encoding(String storageClause, int cpuOverheadRank, Set<ObjectType> applicableTypes, String description) {
        this.storageClause = storageClause;
        this.cpuOverheadRank = cpuOverheadRank;
        this.applicableTypes = applicableTypes;
        this.description = description;
    }

    public boolean appliesTo(ObjectType type) {
        return applicableTypes.contains(type);
    }

    public boolean isColumnar() {
        return this == QUERY_LOW || this == QUERY_HIGH || this == ARCHIVE_LOW || this == ARCHIVE_HIGH;
    }

    /**
     * Compression candidates for an object type, in declaration order. NONE is never a candidate.
     */
    public static List<Encoding> candidatesFor(ObjectType type) {
        List<Encoding> candidates = new ArrayList<>();
        for (Encoding encoding : values()) {
            if (encoding != NONE && encoding.appliesTo(type)) {
                candidates.add(encoding);
            }
        }
        return candidates;
    }

    /**
     * Resolves an encoding from its enum name. Null, blank, "NOCOMPRESS" and "DISABLED" map to NONE.
     */
    public static Encoding fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        String normalized = name.trim().toUpperCase().replaceAll("[\\s-]+", "_");
        if (normalized.equals("NOCOMPRESS") || normalized.equals("DISABLED")) {
            return NONE;
        }
        for (Encoding encoding : values()) {
            if (encoding.name().equals(normalized)) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("Unknown encoding: " + name + ". Available encodings: " + availableEncodings());
    }

    /**
     * Maps the compression attribute reported by the data dictionary for an object of the given type
     * ("ADVANCED", "QUERY HIGH", "ENABLED", "MEDIUM", ...) to an encoding.
     */
    public static Encoding fromDictionary(String value, ObjectType type) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase()
                .replaceAll("^COMPRESS\\s+", "")
                .replaceAll("^FOR\\s+", "")
                .replaceAll("[\\s-]+", "_");
        if (normalized.equals("NONE") || normalized.equals("NO") || normalized.equals("NOCOMPRESS")
                || normalized.equals("DISABLED")) {
            return NONE;
        }

        switch (type) {
            case TABLE:
                if (normalized.equals("ADVANCED") || normalized.equals("OLTP") || normalized.equals("ENABLED")) {
                    return OLTP;
                }
                break;
            case INDEX:
                if (normalized.equals("ENABLED") || normalized.equals("ADVANCED_LOW")) {
                    return INDEX_ADVANCED_LOW;
                }
                if (normalized.equals("ADVANCED_HIGH")) {
                    return INDEX_ADVANCED_HIGH;
                }
                break;
            case LOB:
                if (normalized.equals("LOW") || normalized.equals("MEDIUM") || normalized.equals("HIGH")) {
                    return valueOf("LOB_" + normalized);
                }
                break;
            default:
                break;
        }

        Encoding encoding = fromName(normalized);
        if (!encoding.appliesTo(type)) {
            throw new IllegalArgumentException("Encoding " + encoding + " does not apply to " + type);
        }
        return encoding;
    }

    public static String availableEncodings() {
        StringBuilder sb = new StringBuilder();
        for (Encoding encoding : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(encoding.name());
        }
        return sb.toString();
    }
}
