package org.carball.compadvisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Rule;
import org.carball.compadvisor.model.RuleConfigurationException;
import org.carball.compadvisor.model.Strategy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads strategy definitions from YAML and turns them into validated {@link Strategy} instances.
 */
@Slf4j
public class StrategyLoader {

    public static final String BUILT_IN_RESOURCE = "/strategies.yml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public List<Strategy> loadBuiltIn() throws IOException {
        try (InputStream in = StrategyLoader.class.getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (in == null) {
                throw new IOException("Built-in strategies not found on classpath: " + BUILT_IN_RESOURCE);
            }
            return toStrategies(mapper.readValue(in, StrategyFile.class), "built-in strategies");
        }
    }

    public List<Strategy> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Strategy file not found: " + file);
        }
        return toStrategies(mapper.readValue(file.toFile(), StrategyFile.class), file.toString());
    }

    /**
     * Loads the given file, or the built-in strategies when the path is null or blank.
     */
    public List<Strategy> loadOrDefault(String path) throws IOException {
        if (path == null || path.isBlank()) {
            return loadBuiltIn();
        }
        return load(Path.of(path));
    }

    List<Strategy> toStrategies(StrategyFile file, String source) {
        List<Strategy> strategies = new ArrayList<>();
        Set<Integer> ids = new HashSet<>();
        Set<String> names = new HashSet<>();

        for (StrategyFile.StrategyDefinition definition : file.getStrategies()) {
            if (!ids.add(definition.getId())) {
                throw new RuleConfigurationException("Duplicate strategy id " + definition.getId() + " in " + source);
            }
            if (definition.getName() != null && !names.add(definition.getName().toLowerCase())) {
                throw new RuleConfigurationException("Duplicate strategy name " + definition.getName() + " in " + source);
            }

            List<Rule> rules = new ArrayList<>();
            for (StrategyFile.RuleDefinition rule : definition.getRules()) {
                rules.add(toRule(definition, rule));
            }
            strategies.add(Strategy.create(definition.getId(), definition.getName(), definition.getDescription(), rules));
        }

        log.info("Loaded {} strategies with {} rules from {}", strategies.size(),
                strategies.stream().mapToInt(s -> s.getRules().size()).sum(), source);
        return strategies;
    }

    private static Rule toRule(StrategyFile.StrategyDefinition strategy, StrategyFile.RuleDefinition rule) {
        ObjectType objectType;
        Encoding encoding;
        try {
            objectType = ObjectType.fromName(rule.getObjectType());
            encoding = Encoding.fromName(rule.getEncoding());
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Strategy " + strategy.getName() + ", priority "
                    + rule.getPriority() + ": " + e.getMessage());
        }

        String ruleId = rule.getRuleId() != null ? rule.getRuleId()
                : strategy.getId() + "-" + objectType.name() + "-" + rule.getPriority();

        return Rule.builder()
                .ruleId(ruleId)
                .strategyId(strategy.getId())
                .objectType(objectType)
                .priority(rule.getPriority())
                .hotnessMin(rule.getHotnessMin())
                .hotnessMax(rule.getHotnessMax())
                .accessMin(rule.getAccessMin())
                .accessMax(rule.getAccessMax())
                .writeRatioMin(rule.getWriteRatioMin())
                .writeRatioMax(rule.getWriteRatioMax())
                .encoding(encoding)
                .description(rule.getDescription())
                .build();
    }
}
