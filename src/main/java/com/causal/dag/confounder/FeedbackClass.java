package com.causal.dag.confounder;

/** How a common parent of exposure and outcome relates to feedback loops. */
public enum FeedbackClass {
    /** No directed path back from exposure or outcome. */
    PURE_CONFOUNDER,
    /** Closes a feedback loop of at most the configured tight length. */
    TIGHT_FEEDBACK,
    /** Closes only longer feedback loops. */
    LONG_FEEDBACK
}
