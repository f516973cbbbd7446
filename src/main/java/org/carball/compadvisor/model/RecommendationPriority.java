package org.carball.compadvisor.model;

public enum RecommendationPriority {
    HIGH,
    MEDIUM,
    LOW;

    public static RecommendationPriority fromSavingsPct(double savingsPct) {
        if (savingsPct >= 50) return HIGH;
        if (savingsPct >= 30) return MEDIUM;
        return LOW;
    }
}
