package org.carball.compadvisor.estimator;

import org.carball.compadvisor.engine.RatioSample;
import org.carball.compadvisor.model.Encoding;

import java.util.Optional;

/**
 * Result of testing one candidate encoding. Either the engine produced a sample, or the candidate
 * could not be tested on this object and the reason is kept instead.
 */
public record CandidateOutcome(Encoding encoding, Optional<RatioSample> sample, String unsupportedReason) {

    public static final double UNTESTED_RATIO = 1.0;

    public static CandidateOutcome tested(Encoding encoding, RatioSample sample) {
        return new CandidateOutcome(encoding, Optional.of(sample), null);
    }

    public static CandidateOutcome unsupported(Encoding encoding, String reason) {
        return new CandidateOutcome(encoding, Optional.empty(), reason);
    }

    public boolean isTested() {
        return sample.isPresent();
    }

    /**
     * The estimated ratio, or 1.0 (no savings) for an untested candidate.
     */
    public double ratio() {
        return sample.map(RatioSample::ratio).orElse(UNTESTED_RATIO);
    }
}
