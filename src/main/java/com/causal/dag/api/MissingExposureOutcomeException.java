package com.causal.dag.api;

/**
 * Thrown by role classification when the exposure/outcome pair it was asked to
 * analyze is not present in the graph, or names the same node twice.
 */
public class MissingExposureOutcomeException extends InvalidGraphException {

    public MissingExposureOutcomeException(String message) {
        super(message);
    }
}
