package org.carball.compadvisor.model;

import lombok.Builder;
import lombok.Value;

/**
 * One decision rule of a strategy. Every populated bound is inclusive; a missing bound does not constrain.
 */
@Value
@Builder(toBuilder = true)
public class Rule {
    String ruleId;
    int strategyId;
    ObjectType objectType;
    int priority;
    Double hotnessMin;
    Double hotnessMax;
    Double accessMin;
    Double accessMax;
    Double writeRatioMin;
    Double writeRatioMax;
    Encoding encoding;
    String description;

    public boolean matches(double hotness, double access, double writeRatio) {
        return within(hotness, hotnessMin, hotnessMax)
                && within(access, accessMin, accessMax)
                && within(writeRatio, writeRatioMin, writeRatioMax);
    }

    private static boolean within(double value, Double min, Double max) {
        return (min == null || value >= min) && (max == null || value <= max);
    }

    /**
     * Checks the rule's own consistency.
     *
     * @throws RuleConfigurationException if a range is inverted or out of scale, or the encoding
     *                                    does not apply to the rule's object type
     */
    public void validate() {
        String label = "Rule " + (ruleId != null ? ruleId : "#" + priority) + " of strategy " + strategyId;
        if (objectType == null) {
            throw new RuleConfigurationException(label + ": object type is required");
        }
        if (encoding == null) {
            throw new RuleConfigurationException(label + ": target encoding is required");
        }
        if (!encoding.appliesTo(objectType)) {
            throw new RuleConfigurationException(label + ": encoding " + encoding + " does not apply to " + objectType);
        }
        checkRange(label, "hotness", hotnessMin, hotnessMax, 0, 100);
        checkRange(label, "access", accessMin, accessMax, 0, 100);
        checkRange(label, "write ratio", writeRatioMin, writeRatioMax, 0, 1);
    }

    private static void checkRange(String label, String name, Double min, Double max, double floor, double ceiling) {
        if (min != null && (min < floor || min > ceiling)) {
            throw new RuleConfigurationException(label + ": " + name + " minimum " + min
                    + " outside " + floor + ".." + ceiling);
        }
        if (max != null && (max < floor || max > ceiling)) {
            throw new RuleConfigurationException(label + ": " + name + " maximum " + max
                    + " outside " + floor + ".." + ceiling);
        }
        if (min != null && max != null && min > max) {
            throw new RuleConfigurationException(label + ": " + name + " minimum " + min
                    + " is greater than maximum " + max);
        }
    }
}
