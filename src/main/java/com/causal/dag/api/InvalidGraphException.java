package com.causal.dag.api;

/**
 * Thrown when a causal graph, or a request against one, violates the graph
 * invariants: unknown node ids, an empty graph, or a missing, duplicated or
 * coinciding exposure/outcome designation.
 * <p>
 * Validation errors abort the operation; no partial output is produced.
 */
public class InvalidGraphException extends IllegalArgumentException {

    public InvalidGraphException(String message) {
        super(message);
    }
}
