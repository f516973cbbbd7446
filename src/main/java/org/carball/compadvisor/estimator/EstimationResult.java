package org.carball.compadvisor.estimator;

import org.carball.compadvisor.model.Encoding;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Best candidate for one object plus the outcome of every candidate that was tried.
 * {@code bestEncoding} is NONE when no candidate could be tested.
 */
public record EstimationResult(Encoding bestEncoding, double bestRatio, Map<Encoding, CandidateOutcome> outcomes) {

    public static EstimationResult nothingTested() {
        return new EstimationResult(Encoding.NONE, CandidateOutcome.UNTESTED_RATIO, Map.of());
    }

    /**
     * Ratio per candidate, with untested candidates recorded as 1.0.
     */
    public Map<Encoding, Double> ratios() {
        Map<Encoding, Double> ratios = new EnumMap<>(Encoding.class);
        outcomes.forEach((encoding, outcome) -> ratios.put(encoding, outcome.ratio()));
        return Collections.unmodifiableMap(ratios);
    }

    /**
     * Tested ratio of a specific encoding, or 1.0 when that encoding was not tested.
     */
    public double ratioFor(Encoding encoding) {
        CandidateOutcome outcome = outcomes.get(encoding);
        return outcome != null ? outcome.ratio() : CandidateOutcome.UNTESTED_RATIO;
    }

    public boolean isTested(Encoding encoding) {
        CandidateOutcome outcome = outcomes.get(encoding);
        return outcome != null && outcome.isTested();
    }

    public long testedCount() {
        return outcomes.values().stream().filter(CandidateOutcome::isTested).count();
    }
}
