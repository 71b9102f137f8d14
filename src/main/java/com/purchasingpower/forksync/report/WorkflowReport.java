package com.purchasingpower.forksync.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.forksync.model.DivergenceReport;
import com.purchasingpower.forksync.model.DriftFinding;
import com.purchasingpower.forksync.model.DriftSeverity;
import com.purchasingpower.forksync.model.RegenerationResult;
import com.purchasingpower.forksync.model.UpstreamCommit;
import com.purchasingpower.forksync.workflow.RunOutcome;
import com.purchasingpower.forksync.workflow.WorkflowMode;
import com.purchasingpower.forksync.workflow.WorkflowRun;
import com.purchasingpower.forksync.workflow.WorkflowState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Machine-readable summary of one run, serialized to JSON for CI and notification layers.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowReport {

    String runId;
    WorkflowMode mode;
    RunOutcome outcome;
    WorkflowState terminalState;
    int exitCode;
    Instant startedAt;
    Instant finishedAt;

    String primaryBranch;
    String primaryHeadBefore;
    String backupBranch;
    String updateBranch;
    String mergeCommit;
    boolean promoted;

    String upstreamRef;
    String upstreamHead;
    String mergeBase;
    Integer commitsAhead;
    Integer commitsBehind;
    List<UpstreamCommit> recentCommits;
    Set<String> protectedPathsTouched;

    DriftSeverity driftSeverity;
    boolean driftOverridden;
    List<DriftFinding> driftFindings;

    Set<String> resolvedPaths;
    Set<String> unresolvedPaths;
    List<RegenerationResult> regenerated;

    List<String> transitions;
    String failure;

    public static WorkflowReport from(WorkflowRun run) {
        WorkflowReportBuilder builder = WorkflowReport.builder()
                .runId(run.getId())
                .mode(run.getMode())
                .outcome(run.getOutcome())
                .terminalState(run.terminalState())
                .exitCode(run.getExitCode())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .backupBranch(run.getBackupBranch())
                .updateBranch(run.getUpdateBranch())
                .mergeCommit(run.getMergeCommit())
                .promoted(run.isPromoted())
                .driftSeverity(run.getDrift().severity())
                .driftOverridden(run.isDriftOverridden())
                .driftFindings(run.getDrift().findings())
                .resolvedPaths(run.getResolvedPaths())
                .unresolvedPaths(run.getUnresolvedPaths())
                .regenerated(run.getRegenerated())
                .transitions(run.getHistory().stream().map(t -> t.state().name()).toList())
                .failure(run.getFailureMessage());

        if (run.getSnapshot() != null) {
            builder.primaryBranch(run.getSnapshot().primaryBranch())
                    .primaryHeadBefore(run.getSnapshot().primaryHead())
                    .upstreamRef(run.getSnapshot().upstreamRef());
        }

        DivergenceReport divergence = run.getDivergence();
        if (divergence != null) {
            builder.upstreamRef(divergence.getUpstreamRef())
                    .upstreamHead(divergence.getUpstreamHead())
                    .mergeBase(divergence.getMergeBase())
                    .commitsAhead(divergence.getCommitsAhead())
                    .commitsBehind(divergence.getCommitsBehind())
                    .recentCommits(divergence.getRecentCommits())
                    .protectedPathsTouched(divergence.getProtectedPathsTouched());
        }
        return builder.build();
    }
}
