package com.purchasingpower.forksync.workflow;

import com.purchasingpower.forksync.configuration.ArtifactProperties;
import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.configuration.UpstreamProperties;
import com.purchasingpower.forksync.exception.BusyException;
import com.purchasingpower.forksync.exception.DirtyTreeException;
import com.purchasingpower.forksync.exception.FetchException;
import com.purchasingpower.forksync.exception.ForkSyncException;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.git.RunIdGenerator;
import com.purchasingpower.forksync.git.WorkspaceLock;
import com.purchasingpower.forksync.model.DivergenceReport;
import com.purchasingpower.forksync.model.DriftReport;
import com.purchasingpower.forksync.model.RegenerationResult;
import com.purchasingpower.forksync.model.RepositorySnapshot;
import com.purchasingpower.forksync.model.ResolutionResult;
import com.purchasingpower.forksync.service.BuildArtifactRegenerator;
import com.purchasingpower.forksync.service.DivergenceAnalyzer;
import com.purchasingpower.forksync.service.LicenseDriftScanner;
import com.purchasingpower.forksync.service.ProtectedPathResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.revwalk.RevCommit;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sequences one upstream sync as a state machine over a {@link WorkflowRun}.
 *
 * <p>Ordering guarantees:
 * <ul>
 *   <li>the backup branch is created before anything else is mutated and is never deleted here</li>
 *   <li>the merge happens on a disposable update branch</li>
 *   <li>the primary branch moves only at promotion, from CLEAN_MERGE</li>
 *   <li>any failure after the merge started aborts: update branch dropped, primary reset to the backup</li>
 * </ul>
 * Runs are strictly sequential; {@link WorkspaceLock} rejects a concurrent run with {@link BusyException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MergeWorkflowOrchestrator {

    private static final Set<WorkflowState> MERGE_STATES = EnumSet.of(
            WorkflowState.MERGING, WorkflowState.CONFLICTS_RESOLVING, WorkflowState.CLEAN_MERGE);

    private final ForkSyncProperties props;
    private final DivergenceAnalyzer divergenceAnalyzer;
    private final LicenseDriftScanner driftScanner;
    private final ProtectedPathResolver resolver;
    private final BuildArtifactRegenerator regenerator;
    private final RunIdGenerator runIds;
    private final Clock clock;

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Run the workflow. Never throws for run-level failures: the returned run carries the
     * terminal state, outcome and exit code.
     */
    public WorkflowRun sync(GitRepositoryHandle handle, SyncOptions options) {
        WorkspaceLock lock;
        try {
            lock = WorkspaceLock.acquire(handle);
        } catch (ForkSyncException e) {
            WorkflowRun rejected = new WorkflowRun(runIds.next(id -> false), options.mode(), clock);
            failBeforeMerge(rejected, e);
            return complete(rejected);
        }

        try (lock) {
            WorkflowRun run = new WorkflowRun(nextRunId(handle, options), options.mode(), clock);
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("Starting {} run {} for branch {}", options.mode(), run.getId(), props.getPrimaryBranch());
            log.info("═══════════════════════════════════════════════════════════════");
            execute(handle, run, options);
            return complete(run);
        }
    }

    /**
     * Fetch and compare only. Mutates nothing but remote-tracking refs.
     */
    public DivergenceReport analyze(GitRepositoryHandle handle, String upstreamBranch) {
        try (WorkspaceLock ignored = WorkspaceLock.acquire(handle)) {
            fetchUpstream(handle);
            return divergenceAnalyzer.analyze(handle, localRef(), upstreamRef(handle, upstreamBranch));
        }
    }

    /**
     * Rebuild every configured artifact in the working tree from its canonical source.
     * Nothing is staged or committed.
     */
    public List<RegenerationResult> regenerateWorkTree(GitRepositoryHandle handle) {
        try (WorkspaceLock ignored = WorkspaceLock.acquire(handle)) {
            List<RegenerationResult> results = new ArrayList<>();
            for (ArtifactProperties artifact : props.getArtifacts()) {
                results.add(regenerator.refreshWorkTree(handle, artifact));
            }
            return results;
        }
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private void execute(GitRepositoryHandle handle, WorkflowRun run, SyncOptions options) {
        String primary = props.getPrimaryBranch();
        try {
            // INIT
            ObjectId primaryHead = handle.require(localRef());
            Set<String> dirty = handle.uncommittedPaths();
            run.recordSnapshot(new RepositorySnapshot(
                    primary,
                    primaryHead.getName(),
                    props.getUpstream().trackingRef(options.upstreamBranch()),
                    handle.currentBranch(),
                    dirty.isEmpty(),
                    clock.instant()));

            if (!options.isCheckOnly()) {
                if (!dirty.isEmpty()) {
                    throw new DirtyTreeException(dirty);
                }
                backup(handle, run, primaryHead);
                if (!primary.equals(handle.currentBranch())) {
                    log.info("Switching to {}", primary);
                    handle.checkout(primary);
                }
            }

            // FETCHED
            fetchUpstream(handle);
            String upstreamRef = upstreamRef(handle, options.upstreamBranch());
            run.transitionTo(WorkflowState.FETCHED);

            // ANALYZED
            DivergenceReport divergence = divergenceAnalyzer.analyze(handle, localRef(), upstreamRef);
            run.recordDivergence(divergence);
            run.transitionTo(WorkflowState.ANALYZED);

            if (!divergence.hasUpstreamChanges()) {
                log.info("Already up to date with {}", upstreamRef);
                run.transitionTo(WorkflowState.NO_OP);
                run.finish(RunOutcome.UP_TO_DATE, null);
                return;
            }
            logRecentCommits(divergence);

            DriftReport drift = driftScanner.scan(handle, divergence);
            boolean overridden = drift.isCritical() && options.overrideDrift();
            run.recordDrift(drift, overridden);

            if (drift.isCritical() && !overridden) {
                log.warn("CRITICAL license drift detected upstream. Sync blocked; "
                        + "review the findings and re-run with --override-drift to proceed.");
                run.transitionTo(WorkflowState.DRIFT_BLOCKED);
                run.finish(RunOutcome.DRIFT_BLOCKED, null);
                return;
            }
            if (overridden) {
                log.warn("CRITICAL license drift OVERRIDDEN by operator for run {}", run.getId());
            }

            if (options.isCheckOnly()) {
                run.transitionTo(WorkflowState.CHECKED);
                run.finish(RunOutcome.CHECKED, null);
                return;
            }

            merge(handle, run, divergence, upstreamRef, primaryHead, options);

        } catch (ForkSyncException e) {
            handleFailure(handle, run, e);
        } catch (RuntimeException e) {
            handleFailure(handle, run, new ForkSyncException("Unexpected failure: " + e.getMessage(), e));
        }
    }

    private void backup(GitRepositoryHandle handle, WorkflowRun run, ObjectId primaryHead) {
        String backup = backupBranch(run.getId());
        handle.createBranch(backup, primaryHead);
        run.recordBackup(backup);
        run.transitionTo(WorkflowState.BACKED_UP);
        log.info("Backup branch created: {}", backup);
    }

    private void merge(GitRepositoryHandle handle, WorkflowRun run, DivergenceReport divergence,
                       String upstreamRef, ObjectId primaryHead, SyncOptions options) {
        // MERGING
        run.transitionTo(WorkflowState.MERGING);
        String update = updateBranch(run.getId());
        handle.createAndCheckoutBranch(update, primaryHead);
        run.recordUpdateBranch(update);

        MergeResult result = handle.mergeNoCommit(ObjectId.fromString(divergence.getUpstreamHead()), upstreamRef);
        switch (result.getMergeStatus()) {
            case MERGED_NOT_COMMITTED, MERGED, FAST_FORWARD, ALREADY_UP_TO_DATE ->
                    log.info("Merge of {} completed without conflicts", upstreamRef);
            case CONFLICTING -> log.info("Conflicts detected in {} paths. Applying resolution policy...",
                    result.getConflicts() == null ? 0 : result.getConflicts().size());
            default -> throw new ForkSyncException("Merge could not be performed: " + result.getMergeStatus()
                    + (result.getFailingPaths() == null ? "" : " " + result.getFailingPaths().keySet()));
        }

        // CONFLICTS_RESOLVING
        run.transitionTo(WorkflowState.CONFLICTS_RESOLVING);
        Set<String> conflicts = handle.conflictingPaths();

        ResolutionResult resolution = resolver.resolveConflicts(handle, conflicts);
        run.markResolved(resolution.resolved());
        run.markResolved(resolver.enforceProtected(handle, divergence.changedPaths()));

        Set<String> artifactCandidates = new TreeSet<>(divergence.changedPaths());
        artifactCandidates.addAll(conflicts);
        for (ArtifactProperties artifact : regenerator.affectedArtifacts(artifactCandidates)) {
            RegenerationResult regenerated = regenerator.regenerate(handle, artifact);
            run.recordRegeneration(regenerated);
            run.markResolved(conflicts.stream()
                    .filter(path -> path.startsWith(regenerated.target() + "/"))
                    .toList());
        }

        Set<String> remaining = handle.conflictingPaths();
        if (!remaining.isEmpty()) {
            run.markUnresolved(remaining);
            run.transitionTo(WorkflowState.UNRESOLVED);
            run.finish(RunOutcome.UNRESOLVED_CONFLICTS, null);
            logManualFollowUp(run, remaining);
            return;
        }

        // CLEAN_MERGE
        run.transitionTo(WorkflowState.CLEAN_MERGE);
        RevCommit commit = handle.commit("chore: sync with upstream " + shortName(upstreamRef)
                + " (" + divergence.getUpstreamHead().substring(0, 8) + ")");
        run.recordMergeCommit(commit.getName());
        log.info("Merge committed on {}: {}", update, commit.getName().substring(0, 8));

        if (options.promote() && props.isPromote()) {
            promote(handle, run, update);
            run.finish(RunOutcome.MERGED, null);
        } else {
            log.info("Promotion skipped. Review {} and merge it into {} manually.", update, props.getPrimaryBranch());
            run.finish(RunOutcome.MERGED_NOT_PROMOTED, null);
        }
    }

    /**
     * The only place the primary branch moves.
     */
    private void promote(GitRepositoryHandle handle, WorkflowRun run, String update) {
        handle.checkout(props.getPrimaryBranch());
        MergeResult ff = handle.fastForward(update);
        if (!ff.getMergeStatus().isSuccessful()) {
            throw new ForkSyncException("Promotion of " + update + " failed: " + ff.getMergeStatus());
        }
        run.markPromoted();
        log.info("Promoted {} into {}", update, props.getPrimaryBranch());

        try {
            handle.deleteBranch(update);
        } catch (ForkSyncException e) {
            log.warn("Could not delete update branch {} - manual cleanup may be needed: {}", update, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Failure handling
    // ------------------------------------------------------------------

    private void handleFailure(GitRepositoryHandle handle, WorkflowRun run, ForkSyncException e) {
        if (MERGE_STATES.contains(run.getState())) {
            abort(handle, run, e);
        } else {
            failBeforeMerge(run, e);
        }
    }

    private void failBeforeMerge(WorkflowRun run, ForkSyncException e) {
        if (e instanceof FetchException || e instanceof DirtyTreeException || e instanceof BusyException) {
            log.error("Run {} failed: {}", run.getId(), e.getMessage());
        } else {
            log.error("Run {} failed", run.getId(), e);
        }
        run.fail(e.getMessage());
        run.transitionTo(WorkflowState.FAILED);
        run.finish(RunOutcome.FAILED, e.getExitCode());
    }

    /**
     * Discard the update branch and restore the primary branch to the backup.
     */
    private void abort(GitRepositoryHandle handle, WorkflowRun run, ForkSyncException cause) {
        log.error("Aborting run {}: {}", run.getId(), cause.getMessage(), cause);
        String message = cause.getMessage();
        try {
            handle.resetHard(Constants.HEAD);
            if (!props.getPrimaryBranch().equals(handle.currentBranch())) {
                handle.checkout(props.getPrimaryBranch());
            }
            if (run.getBackupBranch() != null) {
                handle.resetHard(Constants.R_HEADS + run.getBackupBranch());
            }
            if (run.getUpdateBranch() != null && handle.branchExists(run.getUpdateBranch())) {
                handle.deleteBranch(run.getUpdateBranch());
            }
            log.info("Rolled back to {}", run.getBackupBranch());
        } catch (ForkSyncException rollback) {
            log.error("Rollback incomplete. Restore manually from {}", run.getBackupBranch(), rollback);
            message = message + "; rollback incomplete: " + rollback.getMessage();
        }
        run.fail(message);
        run.transitionTo(WorkflowState.ABORTED);
        run.finish(RunOutcome.ABORTED, cause.getExitCode());
    }

    private WorkflowRun complete(WorkflowRun run) {
        run.transitionTo(WorkflowState.REPORTED);
        log.info("Run {} finished: {} (exit code {})", run.getId(), run.getOutcome(), run.getExitCode());
        if (run.getBackupBranch() != null) {
            log.info("Backup branch available at: {}", run.getBackupBranch());
        }
        return run;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void fetchUpstream(GitRepositoryHandle handle) {
        UpstreamProperties upstream = props.getUpstream();
        if (!handle.hasRemote(upstream.getRemote())) {
            if (upstream.getUrl() == null || upstream.getUrl().isBlank()) {
                throw new FetchException("Remote '" + upstream.getRemote()
                        + "' is not configured and forksync.upstream.url is not set", null);
            }
            handle.addRemote(upstream.getRemote(), upstream.getUrl());
        }
        log.info("Fetching {}...", upstream.getRemote());
        handle.fetch(upstream.getRemote());
    }

    /**
     * Tracking ref of the upstream branch, falling back to a tag of the same name.
     */
    private String upstreamRef(GitRepositoryHandle handle, String branchOverride) {
        UpstreamProperties upstream = props.getUpstream();
        String tracking = upstream.trackingRef(branchOverride);
        if (handle.resolve(tracking).isPresent()) {
            return tracking;
        }
        String name = (branchOverride == null || branchOverride.isBlank()) ? upstream.getBranch() : branchOverride;
        String tag = Constants.R_TAGS + name;
        if (handle.resolve(tag + "^{commit}").isPresent()) {
            return tag;
        }
        throw new FetchException("Cannot find " + tracking + " after fetching " + upstream.getRemote(), null);
    }

    private String nextRunId(GitRepositoryHandle handle, SyncOptions options) {
        if (options.isCheckOnly()) {
            return runIds.next(id -> false);
        }
        return runIds.next(id -> handle.branchExists(backupBranch(id)) || handle.branchExists(updateBranch(id)));
    }

    private String localRef() {
        return Constants.R_HEADS + props.getPrimaryBranch();
    }

    private String backupBranch(String runId) {
        return props.getBackupPrefix() + "-" + runId;
    }

    private String updateBranch(String runId) {
        return props.getUpdateBranchPrefix() + "-" + runId;
    }

    private static String shortName(String ref) {
        if (ref.startsWith(Constants.R_REMOTES)) {
            return ref.substring(Constants.R_REMOTES.length());
        }
        if (ref.startsWith(Constants.R_TAGS)) {
            return ref.substring(Constants.R_TAGS.length());
        }
        return ref;
    }

    private static void logRecentCommits(DivergenceReport divergence) {
        log.info("--- Recent upstream commits ---");
        divergence.getRecentCommits().forEach(c ->
                log.info("  {} {}", c.id().substring(0, 8), c.shortMessage()));
        log.info("(showing {} of {} commits)", divergence.getRecentCommits().size(), divergence.getCommitsBehind());
    }

    private void logManualFollowUp(WorkflowRun run, Set<String> remaining) {
        log.warn("REMAINING CONFLICTS ({}):", remaining.size());
        remaining.forEach(path -> log.warn("  {}", path));
        log.warn("Resolve them on {}, commit, then merge into {}. Backup: {}",
                run.getUpdateBranch(), props.getPrimaryBranch(), run.getBackupBranch());
    }
}
