package org.carball.compadvisor.execution;

import org.carball.compadvisor.model.ObjectMetrics;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param metrics the object's facts as re-read during the check, or null when it could not be read
 */
public record PrecheckResult(ObjectMetrics metrics, List<PreconditionViolation> violations) {

    public boolean passed() {
        return violations.isEmpty();
    }

    public String describe() {
        return violations.stream().map(PreconditionViolation::toString).collect(Collectors.joining("; "));
    }
}
