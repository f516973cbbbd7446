package org.carball.compadvisor.execution;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.ddl.DdlGenerator;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.engine.EngineException;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectMetrics;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ObjectType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.carball.compadvisor.execution.PreconditionViolation.Reason;

/**
 * Checks that a storage change can safely start: the object still exists in the expected encoding,
 * no other session locks it, its storage area has room for the rewrite and the statement is well formed.
 * Mutual exclusion between executions is enforced separately, when the execution record is created.
 */
@Slf4j
public class PrecheckValidator {

    private final DatabaseEngine engine;
    private final DdlGenerator ddlGenerator;
    private final double spaceSafetyFactor;

    public PrecheckValidator(DatabaseEngine engine, DdlGenerator ddlGenerator, double spaceSafetyFactor) {
        this.engine = engine;
        this.ddlGenerator = ddlGenerator;
        this.spaceSafetyFactor = spaceSafetyFactor;
    }

    public PrecheckResult check(ObjectRef ref, Encoding expectedCurrent, Encoding target, String statement) {
        List<PreconditionViolation> violations = new ArrayList<>();

        for (String problem : ddlGenerator.validate(statement, ref, target)) {
            violations.add(new PreconditionViolation(Reason.INVALID_STATEMENT, problem));
        }

        ObjectMetrics metrics;
        try {
            Optional<ObjectMetrics> found = engine.getObjectMetrics(ref);
            if (found.isEmpty()) {
                violations.add(new PreconditionViolation(Reason.OBJECT_MISSING, ref + " no longer exists"));
                return new PrecheckResult(null, violations);
            }
            metrics = found.get();
        } catch (EngineException e) {
            violations.add(new PreconditionViolation(Reason.ENGINE_ERROR, "Cannot read metrics of " + ref + ": " + e.getMessage()));
            return new PrecheckResult(null, violations);
        }

        Encoding actual = metrics.getCurrentEncoding();
        if (actual != expectedCurrent) {
            violations.add(new PreconditionViolation(Reason.ENCODING_CHANGED,
                    "Expected " + ref + " in " + expectedCurrent + " but found " + actual));
        }

        try {
            if (engine.isLocked(ref)) {
                violations.add(new PreconditionViolation(Reason.LOCKED, ref + " is locked by another session"));
            }
        } catch (EngineException e) {
            violations.add(new PreconditionViolation(Reason.ENGINE_ERROR, "Cannot check locks on " + ref + ": " + e.getMessage()));
        }

        if (ref.objectType() != ObjectType.LOB) {
            checkSpace(ref, metrics.getStorageArea(), metrics.getSizeBytes(), violations);
        }

        if (!violations.isEmpty()) {
            log.info("Precheck failed for {}: {}", ref, violations);
        }
        return new PrecheckResult(metrics, violations);
    }

    private void checkSpace(ObjectRef ref, String area, long sizeBytes, List<PreconditionViolation> violations) {
        if (area == null || area.isBlank()) {
            log.debug("No storage area known for {}; skipping free space check", ref);
            return;
        }
        long required = (long) Math.ceil(sizeBytes * spaceSafetyFactor);
        try {
            long free = engine.freeBytes(area);
            if (free < required) {
                violations.add(new PreconditionViolation(Reason.INSUFFICIENT_SPACE, String.format(
                        "%s needs %d bytes free in %s, only %d available", ref, required, area, free)));
            }
        } catch (EngineException e) {
            violations.add(new PreconditionViolation(Reason.ENGINE_ERROR, "Cannot read free space of " + area + ": " + e.getMessage()));
        }
    }
}
