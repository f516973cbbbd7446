package org.carball.compadvisor.rules;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Rule;

import java.util.List;

/**
 * Walks a strategy's rules for an object type in priority order; the first rule whose bounds all
 * hold wins. With no match the {@link DefaultDecisionTable} decides. A best ratio at or below 1.0
 * means compression is not worthwhile and always yields NONE.
 */
@Slf4j
public class StrategyRuleEngine {

    private final RuleCache ruleCache;

    public StrategyRuleEngine(RuleCache ruleCache) {
        this.ruleCache = ruleCache;
    }

    public RuleDecision evaluate(int strategyId, ObjectType objectType,
                                 double hotness, double access, double writeRatio, double ratio) {
        return evaluate(strategyId, EvaluationInput.builder()
                .objectType(objectType)
                .hotness(hotness)
                .access(access)
                .writeRatio(writeRatio)
                .ratio(ratio)
                .build());
    }

    public RuleDecision evaluate(int strategyId, EvaluationInput input) {
        List<Rule> rules = ruleCache.rules(strategyId, input.getObjectType());

        if (input.getRatio() <= 1.0) {
            return decided(Encoding.NONE, null, input);
        }

        for (Rule rule : rules) {
            if (rule.matches(input.getHotness(), input.getAccess(), input.getWriteRatio())) {
                log.debug("Rule {} matched (hotness {}, access {}, write ratio {})",
                        rule.getRuleId(), input.getHotness(), input.getAccess(), input.getWriteRatio());
                return decided(rule.getEncoding(), rule, input);
            }
        }

        Encoding fallback = DefaultDecisionTable.decide(input.getObjectType(), input.getRatio());
        log.debug("No rule of strategy {} matched for {}; default table chose {}",
                strategyId, input.getObjectType(), fallback);
        return decided(fallback, null, input);
    }

    private static RuleDecision decided(Encoding encoding, Rule rule, EvaluationInput input) {
        return new RuleDecision(encoding, rule, RationaleBuilder.build(input, encoding, rule));
    }
}
