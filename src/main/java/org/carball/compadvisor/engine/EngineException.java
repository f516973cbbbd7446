package org.carball.compadvisor.engine;

/**
 * Failure reported by the database engine: unreachable database, missing privilege, unsupported
 * feature or a statement error. The message carries the engine's error text verbatim.
 */
public class EngineException extends Exception {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
