package org.carball.compadvisor.rules;

import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectType;

/**
 * Ratio thresholds applied when none of a strategy's rules match, so evaluation always yields a decision.
 */
public final class DefaultDecisionTable {

    public static final double MODERATE_RATIO = 2.0;
    public static final double LIGHT_RATIO = 1.5;
    public static final double HEAVY_LOB_RATIO = 3.0;

    private DefaultDecisionTable() {
    }

    public static Encoding decide(ObjectType objectType, double ratio) {
        switch (objectType) {
            case TABLE:
                if (ratio >= MODERATE_RATIO) return Encoding.OLTP;
                if (ratio >= LIGHT_RATIO) return Encoding.BASIC;
                return Encoding.NONE;
            case INDEX:
                if (ratio >= LIGHT_RATIO) return Encoding.INDEX_ADVANCED_LOW;
                return Encoding.NONE;
            case LOB:
                if (ratio >= HEAVY_LOB_RATIO) return Encoding.LOB_HIGH;
                if (ratio >= MODERATE_RATIO) return Encoding.LOB_MEDIUM;
                if (ratio >= LIGHT_RATIO) return Encoding.LOB_LOW;
                return Encoding.NONE;
            default:
                return Encoding.NONE;
        }
    }
}
