package com.purchasingpower.forksync.model;

/**
 * Action taken for a path that conflicts during the upstream merge.
 */
public enum ResolutionStrategy {

    /** Discard the merge result and restage the pre-merge local content. */
    FORCE_LOCAL,

    /** Leave for the artifact regenerator. */
    REGENERATE,

    /** Leave conflicted and report. */
    MANUAL
}
