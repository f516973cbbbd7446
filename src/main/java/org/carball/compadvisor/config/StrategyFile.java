package org.carball.compadvisor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML representation of strategy definitions.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StrategyFile {

    private List<StrategyDefinition> strategies = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StrategyDefinition {
        private int id;
        private String name;
        private String description;
        private List<RuleDefinition> rules = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleDefinition {
        @JsonProperty("rule_id")
        private String ruleId;

        @JsonProperty("object_type")
        private String objectType;

        private int priority;

        @JsonProperty("hotness_min")
        private Double hotnessMin;

        @JsonProperty("hotness_max")
        private Double hotnessMax;

        @JsonProperty("access_min")
        private Double accessMin;

        @JsonProperty("access_max")
        private Double accessMax;

        @JsonProperty("write_ratio_min")
        private Double writeRatioMin;

        @JsonProperty("write_ratio_max")
        private Double writeRatioMax;

        private String encoding;

        private String description;
    }
}
