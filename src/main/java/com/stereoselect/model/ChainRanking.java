package com.stereoselect.model;

/**
 * Order in which candidates are folded into a multilook chain
 */
public enum ChainRanking {
    /**
     * Sort once by overlap area with the anchor and keep that order.
     */
    ANCHOR_OVERLAP,
    /**
     * After every fold, re-intersect all remaining candidates with the
     * cumulative intersection and fold the largest next. Costs one
     * intersection per remaining candidate per step.
     */
    RERANK_EACH_FOLD
}
