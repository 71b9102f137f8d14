package com.purchasingpower.forksync.workflow;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one sync run.
 *
 * <pre>
 * INIT → BACKED_UP → FETCHED → ANALYZED → NO_OP
 *                                       → DRIFT_BLOCKED
 *                                       → MERGING → CONFLICTS_RESOLVING → CLEAN_MERGE
 *                                                                       → UNRESOLVED
 * INIT → FETCHED → ANALYZED → CHECKED            (check-only, read-only)
 * any state before promotion → ABORTED
 * INIT | BACKED_UP | FETCHED | ANALYZED → FAILED  (fatal, nothing merged)
 * every terminal state → REPORTED
 * </pre>
 */
public enum WorkflowState {
    INIT,
    BACKED_UP,
    FETCHED,
    ANALYZED,
    NO_OP,
    DRIFT_BLOCKED,
    CHECKED,
    MERGING,
    CONFLICTS_RESOLVING,
    CLEAN_MERGE,
    UNRESOLVED,
    ABORTED,
    FAILED,
    REPORTED;

    public Set<WorkflowState> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(BACKED_UP, FETCHED, FAILED, ABORTED);
            case BACKED_UP -> EnumSet.of(FETCHED, FAILED, ABORTED);
            case FETCHED -> EnumSet.of(ANALYZED, FAILED, ABORTED);
            case ANALYZED -> EnumSet.of(NO_OP, DRIFT_BLOCKED, CHECKED, MERGING, FAILED, ABORTED);
            case MERGING -> EnumSet.of(CONFLICTS_RESOLVING, ABORTED);
            case CONFLICTS_RESOLVING -> EnumSet.of(CLEAN_MERGE, UNRESOLVED, ABORTED);
            case CLEAN_MERGE -> EnumSet.of(REPORTED, ABORTED);
            case NO_OP, DRIFT_BLOCKED, CHECKED, UNRESOLVED, ABORTED, FAILED -> EnumSet.of(REPORTED);
            case REPORTED -> EnumSet.noneOf(WorkflowState.class);
        };
    }

    public boolean canTransitionTo(WorkflowState next) {
        return successors().contains(next);
    }

    /**
     * States that end the run (before the final REPORTED transition).
     */
    public boolean isTerminal() {
        return switch (this) {
            case NO_OP, DRIFT_BLOCKED, CHECKED, CLEAN_MERGE, UNRESOLVED, ABORTED, FAILED -> true;
            default -> false;
        };
    }
}
