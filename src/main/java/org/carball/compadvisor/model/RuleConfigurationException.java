package org.carball.compadvisor.model;

/**
 * Raised when a strategy or rule definition is malformed. Such rules never reach evaluation.
 */
public class RuleConfigurationException extends IllegalArgumentException {

    public RuleConfigurationException(String message) {
        super(message);
    }
}
