package org.carball.compadvisor.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A named compression policy: an ordered set of rules. Instances are immutable and validated on creation.
 */
@Value
public class Strategy {
    int id;
    String name;
    String description;
    List<Rule> rules;

    private Strategy(int id, String name, String description, List<Rule> rules) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.rules = rules;
    }

    /**
     * Validates every rule and returns a strategy whose rules are sorted by priority.
     *
     * @throws RuleConfigurationException on a malformed rule, a rule owned by another strategy,
     *                                    or two rules sharing a priority for the same object type
     */
    public static Strategy create(int id, String name, String description, List<Rule> rules) {
        if (name == null || name.isBlank()) {
            throw new RuleConfigurationException("Strategy " + id + " must have a name");
        }
        Map<ObjectType, Map<Integer, Rule>> seen = new HashMap<>();
        List<Rule> sorted = new ArrayList<>();
        for (Rule rule : rules) {
            rule.validate();
            if (rule.getStrategyId() != id) {
                throw new RuleConfigurationException("Rule " + rule.getRuleId() + " belongs to strategy "
                        + rule.getStrategyId() + ", not " + id);
            }
            Rule clash = seen.computeIfAbsent(rule.getObjectType(), t -> new HashMap<>())
                    .putIfAbsent(rule.getPriority(), rule);
            if (clash != null) {
                throw new RuleConfigurationException("Strategy " + name + ": rules " + clash.getRuleId()
                        + " and " + rule.getRuleId() + " share priority " + rule.getPriority()
                        + " for " + rule.getObjectType());
            }
            sorted.add(rule);
        }
        sorted.sort(Comparator.comparingInt(Rule::getPriority));
        return new Strategy(id, name, description, List.copyOf(sorted));
    }

    /**
     * Rules for one object type, lowest priority number first.
     */
    public List<Rule> rulesFor(ObjectType objectType) {
        return rules.stream()
                .filter(rule -> rule.getObjectType() == objectType)
                .collect(Collectors.toList());
    }
}
