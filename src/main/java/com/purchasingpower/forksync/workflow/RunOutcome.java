package com.purchasingpower.forksync.workflow;

/**
 * Machine-readable result of a run, consumed by CI and notification layers.
 */
public enum RunOutcome {
    UP_TO_DATE(0),
    CHECKED(0),
    MERGED(0),
    MERGED_NOT_PROMOTED(0),
    UNRESOLVED_CONFLICTS(1),
    DRIFT_BLOCKED(2),
    ABORTED(7),
    FAILED(7);

    private final int baseExitCode;

    RunOutcome(int baseExitCode) {
        this.baseExitCode = baseExitCode;
    }

    public int baseExitCode() {
        return baseExitCode;
    }
}
