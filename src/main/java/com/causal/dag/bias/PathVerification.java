package com.causal.dag.bias;

/**
 * Open-path counts over the enumerated exposure/outcome paths.
 *
 * @param totalPaths           paths enumerated.
 * @param openUnconditioned    open with no conditioning.
 * @param openWithChosen       open given the chosen adjustment set.
 * @param openWithMBiasNode    open given the chosen set plus
 *                             {@code addedNode}; equals
 *                             {@code openWithChosen} when there is none.
 * @param addedNode            first M-bias node that is not a descendant of
 *                             the exposure, or null if there is none.
 */
public record PathVerification(int totalPaths, int openUnconditioned, int openWithChosen, int openWithMBiasNode,
        String addedNode) {
}
