package org.carball.compadvisor.rules;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.config.StrategyLoader;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Rule;
import org.carball.compadvisor.model.Strategy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Strategies and their rules, loaded once on first use and read-only afterwards.
 * <p>
 * Instances are passed to whoever needs them; tests build one over fixture strategies with {@link #of(List)}.
 */
@Slf4j
public class RuleCache {

    private final Supplier<List<Strategy>> source;
    private volatile Map<Integer, Strategy> strategies;

    public RuleCache(Supplier<List<Strategy>> source) {
        this.source = source;
    }

    public static RuleCache of(List<Strategy> strategies) {
        return new RuleCache(() -> strategies);
    }

    /**
     * A cache over the given YAML file, or over the built-in strategies when the path is null.
     */
    public static RuleCache fromFile(StrategyLoader loader, String path) {
        return new RuleCache(() -> {
            try {
                return loader.loadOrDefault(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to load strategies: " + e.getMessage(), e);
            }
        });
    }

    private Map<Integer, Strategy> loaded() {
        Map<Integer, Strategy> current = strategies;
        if (current == null) {
            synchronized (this) {
                current = strategies;
                if (current == null) {
                    Map<Integer, Strategy> byId = new LinkedHashMap<>();
                    for (Strategy strategy : source.get()) {
                        byId.put(strategy.getId(), strategy);
                    }
                    current = Collections.unmodifiableMap(byId);
                    strategies = current;
                    log.debug("Rule cache loaded with {} strategies", current.size());
                }
            }
        }
        return current;
    }

    public boolean isLoaded() {
        return strategies != null;
    }

    public List<Strategy> strategies() {
        return List.copyOf(loaded().values());
    }

    public Strategy strategy(int strategyId) {
        Strategy strategy = loaded().get(strategyId);
        if (strategy == null) {
            throw new IllegalArgumentException("Unknown strategy id: " + strategyId
                    + ". Available strategies: " + availableStrategies());
        }
        return strategy;
    }

    /**
     * Resolves a strategy by numeric id or case-insensitive name.
     */
    public Strategy resolve(String idOrName) {
        if (idOrName == null || idOrName.isBlank()) {
            throw new IllegalArgumentException("Strategy must be specified. Available strategies: "
                    + availableStrategies());
        }
        String trimmed = idOrName.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return strategy(Integer.parseInt(trimmed));
        }
        return loaded().values().stream()
                .filter(s -> s.getName().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown strategy: " + idOrName
                        + ". Available strategies: " + availableStrategies()));
    }

    /**
     * Rules of one strategy for one object type, lowest priority number first.
     */
    public List<Rule> rules(int strategyId, ObjectType objectType) {
        return strategy(strategyId).rulesFor(objectType);
    }

    public String availableStrategies() {
        return loaded().values().stream()
                .map(s -> s.getId() + " (" + s.getName() + ")")
                .collect(Collectors.joining(", "));
    }
}
