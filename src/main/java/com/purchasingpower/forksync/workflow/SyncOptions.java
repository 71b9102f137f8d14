package com.purchasingpower.forksync.workflow;

/**
 * Per-invocation switches.
 *
 * @param mode           full sync or check-only
 * @param overrideDrift  proceed despite a CRITICAL drift finding
 * @param promote        merge a clean update branch into the primary branch
 * @param upstreamBranch upstream branch or tag to sync from; null uses the configured one
 */
public record SyncOptions(
        WorkflowMode mode,
        boolean overrideDrift,
        boolean promote,
        String upstreamBranch
) {

    public static SyncOptions sync() {
        return new SyncOptions(WorkflowMode.SYNC, false, true, null);
    }

    public static SyncOptions checkOnly() {
        return new SyncOptions(WorkflowMode.CHECK_ONLY, false, false, null);
    }

    public SyncOptions withOverrideDrift(boolean override) {
        return new SyncOptions(mode, override, promote, upstreamBranch);
    }

    public SyncOptions withPromote(boolean value) {
        return new SyncOptions(mode, overrideDrift, value, upstreamBranch);
    }

    public SyncOptions withUpstreamBranch(String branch) {
        return new SyncOptions(mode, overrideDrift, promote, branch);
    }

    public boolean isCheckOnly() {
        return mode == WorkflowMode.CHECK_ONLY;
    }
}
