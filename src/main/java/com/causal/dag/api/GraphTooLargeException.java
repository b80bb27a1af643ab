package com.causal.dag.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown by the precheck of an exponential operation (elementary-cycle
 * enumeration, adjustment-set or butterfly-option enumeration) when the search
 * space exceeds its configured cap.
 * <p>
 * Carries the measured size, the limit that was exceeded and whatever partial
 * statistics were gathered before refusing (for example SCC sizes or the
 * candidate count), so the caller can widen the cap or restrict the subgraph.
 */
public class GraphTooLargeException extends IllegalStateException {
    private final String operation;
    private final long measured;
    private final long limit;
    private final Map<String, Object> statistics;

    public GraphTooLargeException(String operation, long measured, long limit, Map<String, Object> statistics) {
        super(String.format("%s refused: size %d exceeds limit %d %s", operation, measured, limit, statistics));
        this.operation = operation;
        this.measured = measured;
        this.limit = limit;
        this.statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    public String operation() {
        return operation;
    }

    public long measured() {
        return measured;
    }

    public long limit() {
        return limit;
    }

    /** Partial statistics gathered before the precheck refused to run. */
    public Map<String, Object> statistics() {
        return statistics;
    }
}
