package com.causal.dag.api;

/** Why a budgeted search ended before exhausting its search space. */
public enum StopReason {
    /** The search ran to completion. */
    NONE,
    /** The caller cancelled the search. */
    CANCELLED,
    /** The wall-clock budget ran out. */
    TIMED_OUT,
    /** The configured step cap was reached. */
    STEP_LIMIT,
    /** The configured cap on the number of results was reached. */
    RESULT_LIMIT,
    /** Results may exist beyond the configured size bound. */
    SIZE_LIMIT;

    public boolean completed() {
        return this == NONE;
    }
}
