package com.purchasingpower.forksync.workflow;

import com.purchasingpower.forksync.model.DivergenceReport;
import com.purchasingpower.forksync.model.DriftReport;
import com.purchasingpower.forksync.model.DriftSeverity;
import com.purchasingpower.forksync.model.RegenerationResult;
import com.purchasingpower.forksync.model.RepositorySnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable record of a single sync run, owned by the orchestrator.
 *
 * <p>The state only changes through {@link #transitionTo(WorkflowState)}, which rejects any
 * transition the state machine does not allow. A run is never reused: every invocation
 * creates a new instance.
 */
@Slf4j
@Getter
public class WorkflowRun {

    private final String id;
    private final WorkflowMode mode;
    private final Instant startedAt;
    private final Clock clock;

    private WorkflowState state = WorkflowState.INIT;
    private final List<Transition> history = new ArrayList<>();

    private Instant finishedAt;
    private RepositorySnapshot snapshot;
    private String backupBranch;
    private String updateBranch;
    private DivergenceReport divergence;
    private DriftReport drift = DriftReport.clean();
    private boolean driftOverridden;
    private final Set<String> resolvedPaths = new TreeSet<>();
    private final Set<String> unresolvedPaths = new TreeSet<>();
    private final List<RegenerationResult> regenerated = new ArrayList<>();
    private String mergeCommit;
    private boolean promoted;
    private RunOutcome outcome;
    private int exitCode;
    private String failureMessage;

    public WorkflowRun(String id, WorkflowMode mode, Clock clock) {
        this.id = id;
        this.mode = mode;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.history.add(new Transition(WorkflowState.INIT, startedAt));
    }

    public record Transition(WorkflowState state, Instant at) {
    }

    public void transitionTo(WorkflowState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " in run " + id);
        }
        if (state == WorkflowState.INIT && next == WorkflowState.FETCHED && mode != WorkflowMode.CHECK_ONLY) {
            throw new IllegalStateException("A mutating run must be backed up before fetching");
        }
        if (next == WorkflowState.MERGING && mode == WorkflowMode.CHECK_ONLY) {
            throw new IllegalStateException("A check-only run never merges");
        }
        if (next == WorkflowState.ABORTED && promoted) {
            throw new IllegalStateException("Run " + id + " was already promoted and cannot be aborted");
        }
        log.info("[{}] {} -> {}", id, state, next);
        state = next;
        history.add(new Transition(next, clock.instant()));
    }

    public List<Transition> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Set<String> getResolvedPaths() {
        return Collections.unmodifiableSet(resolvedPaths);
    }

    public Set<String> getUnresolvedPaths() {
        return Collections.unmodifiableSet(unresolvedPaths);
    }

    public List<RegenerationResult> getRegenerated() {
        return Collections.unmodifiableList(regenerated);
    }

    /**
     * State the run ended in, ignoring the final REPORTED transition.
     */
    public WorkflowState terminalState() {
        for (int i = history.size() - 1; i >= 0; i--) {
            WorkflowState candidate = history.get(i).state();
            if (candidate.isTerminal()) {
                return candidate;
            }
        }
        return state;
    }

    void recordSnapshot(RepositorySnapshot snapshot) {
        this.snapshot = snapshot;
    }

    void recordBackup(String backupBranch) {
        this.backupBranch = backupBranch;
    }

    void recordUpdateBranch(String updateBranch) {
        this.updateBranch = updateBranch;
    }

    void recordDivergence(DivergenceReport divergence) {
        this.divergence = divergence;
    }

    void recordDrift(DriftReport drift, boolean overridden) {
        this.drift = drift;
        this.driftOverridden = overridden;
    }

    void markResolved(Collection<String> paths) {
        resolvedPaths.addAll(paths);
        unresolvedPaths.removeAll(paths);
    }

    void markUnresolved(Collection<String> paths) {
        unresolvedPaths.addAll(paths);
    }

    void recordRegeneration(RegenerationResult result) {
        regenerated.add(result);
    }

    void recordMergeCommit(String commitId) {
        this.mergeCommit = commitId;
    }

    void markPromoted() {
        this.promoted = true;
    }

    void fail(String message) {
        this.failureMessage = message;
    }

    /**
     * Fix the outcome and exit code. A drift warning (or an overridden critical finding)
     * raises an otherwise successful exit code to 1.
     */
    void finish(RunOutcome outcome, Integer fatalExitCode) {
        this.outcome = outcome;
        this.finishedAt = clock.instant();
        if (fatalExitCode != null) {
            this.exitCode = fatalExitCode;
        } else if (outcome.baseExitCode() == 0 && drift.severity() != DriftSeverity.CLEAN) {
            this.exitCode = 1;
        } else {
            this.exitCode = outcome.baseExitCode();
        }
    }
}
