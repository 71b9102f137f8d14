package com.purchasingpower.forksync.workflow;

public enum WorkflowMode {

    /** Full sync: backup, merge, resolve, promote. */
    SYNC,

    /** Divergence analysis and drift scan only. No branch or working tree mutation. */
    CHECK_ONLY
}
