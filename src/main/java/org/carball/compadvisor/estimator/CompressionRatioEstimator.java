package org.carball.compadvisor.estimator;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.engine.EngineException;
import org.carball.compadvisor.engine.RatioSample;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectRef;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the engine's estimation service for the ratio of each candidate encoding and picks the best.
 * <p>
 * A candidate that cannot be tested never fails the estimate: it is recorded as unsupported with
 * an implied ratio of 1.0. Equal ratios prefer the candidate with the lower CPU overhead, then the
 * catalog declaration order.
 */
@Slf4j
public class CompressionRatioEstimator {

    static final Comparator<CandidateOutcome> BEST_FIRST = Comparator
            .comparingDouble(CandidateOutcome::ratio).reversed()
            .thenComparingInt(outcome -> outcome.encoding().getCpuOverheadRank())
            .thenComparingInt(outcome -> outcome.encoding().ordinal());

    private final DatabaseEngine engine;
    private final long sampleSize;

    public CompressionRatioEstimator(DatabaseEngine engine, long sampleSize) {
        this.engine = engine;
        this.sampleSize = sampleSize;
    }

    public EstimationResult estimate(ObjectRef ref) {
        return estimate(ref, Encoding.candidatesFor(ref.objectType()));
    }

    public EstimationResult estimate(ObjectRef ref, List<Encoding> candidates) {
        Map<Encoding, CandidateOutcome> outcomes = new EnumMap<>(Encoding.class);

        for (Encoding candidate : candidates) {
            if (candidate == Encoding.NONE) {
                continue;
            }
            if (!candidate.appliesTo(ref.objectType())) {
                log.debug("Skipping {} for {}: not applicable to {}", candidate, ref, ref.objectType());
                continue;
            }
            outcomes.put(candidate, test(ref, candidate));
        }

        CandidateOutcome best = outcomes.values().stream()
                .filter(CandidateOutcome::isTested)
                .min(BEST_FIRST)
                .orElse(null);

        if (best == null) {
            log.warn("No candidate encoding could be tested for {}", ref);
            return new EstimationResult(Encoding.NONE, CandidateOutcome.UNTESTED_RATIO,
                    Collections.unmodifiableMap(outcomes));
        }

        log.debug("Best candidate for {}: {} at {}:1", ref, best.encoding(), best.ratio());
        return new EstimationResult(best.encoding(), best.ratio(), Collections.unmodifiableMap(outcomes));
    }

    private CandidateOutcome test(ObjectRef ref, Encoding candidate) {
        try {
            RatioSample sample = engine.estimateCompressionRatio(ref, candidate, sampleSize);
            if (sample == null || Double.isNaN(sample.ratio()) || sample.ratio() <= 0) {
                log.warn("Estimation of {} for {} returned no usable ratio; assuming 1.0", candidate, ref);
                return CandidateOutcome.unsupported(candidate, "no usable ratio returned");
            }
            return CandidateOutcome.tested(candidate, sample);
        } catch (EngineException | RuntimeException e) {
            log.warn("Could not estimate {} for {}; assuming 1.0: {}", candidate, ref, e.getMessage());
            return CandidateOutcome.unsupported(candidate, e.getMessage());
        }
    }
}
