package org.carball.compadvisor.rules;

import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.Rule;

/**
 * Outcome of evaluating a strategy.
 *
 * @param matchedRule the winning rule, or null when the default decision table or the
 *                    "not worthwhile" guard decided
 */
public record RuleDecision(Encoding encoding, Rule matchedRule, String rationale) {

    public boolean isRuleMatched() {
        return matchedRule != null;
    }
}
