package org.carball.compadvisor.execution;

import org.carball.compadvisor.engine.EngineException;

import java.util.concurrent.CompletableFuture;

/**
 * A statement exceeded its timeout and did not stop within the cancellation grace period. The
 * engine may still complete it; {@link #ended()} completes once the statement call returns.
 */
class StatementStillRunningException extends EngineException {

    private final transient CompletableFuture<Void> ended;

    StatementStillRunningException(String message, CompletableFuture<Void> ended) {
        super(message);
        this.ended = ended;
    }

    CompletableFuture<Void> ended() {
        return ended;
    }
}
