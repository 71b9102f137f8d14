package com.purchasingpower.forksync.workflow;

import com.purchasingpower.forksync.model.DriftFinding;
import com.purchasingpower.forksync.model.DriftReport;
import com.purchasingpower.forksync.model.DriftSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine rules of a sync run.
 */
@DisplayName("Workflow State Machine Tests")
class WorkflowStateTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Full merge path is accepted in sync mode")
    void mergePath() {
        WorkflowRun run = new WorkflowRun("r1", WorkflowMode.SYNC, clock);

        run.transitionTo(WorkflowState.BACKED_UP);
        run.transitionTo(WorkflowState.FETCHED);
        run.transitionTo(WorkflowState.ANALYZED);
        run.transitionTo(WorkflowState.MERGING);
        run.transitionTo(WorkflowState.CONFLICTS_RESOLVING);
        run.transitionTo(WorkflowState.CLEAN_MERGE);
        run.transitionTo(WorkflowState.REPORTED);

        assertThat(run.getHistory()).extracting(WorkflowRun.Transition::state).containsExactly(
                WorkflowState.INIT, WorkflowState.BACKED_UP, WorkflowState.FETCHED, WorkflowState.ANALYZED,
                WorkflowState.MERGING, WorkflowState.CONFLICTS_RESOLVING, WorkflowState.CLEAN_MERGE,
                WorkflowState.REPORTED);
        assertEquals(WorkflowState.CLEAN_MERGE, run.terminalState());
    }

    @Test
    @DisplayName("A mutating run cannot skip the backup")
    void syncMustBackUp() {
        WorkflowRun run = new WorkflowRun("r1", WorkflowMode.SYNC, clock);

        assertThrows(IllegalStateException.class, () -> run.transitionTo(WorkflowState.FETCHED));
        assertEquals(WorkflowState.INIT, run.getState());
    }

    @Test
    @DisplayName("Check-only runs skip the backup and never merge")
    void checkOnlyIsReadOnly() {
        WorkflowRun run = new WorkflowRun("r1", WorkflowMode.CHECK_ONLY, clock);

        run.transitionTo(WorkflowState.FETCHED);
        run.transitionTo(WorkflowState.ANALYZED);

        assertThrows(IllegalStateException.class, () -> run.transitionTo(WorkflowState.MERGING));
        run.transitionTo(WorkflowState.CHECKED);
        assertTrue(run.getState().isTerminal());
    }

    @Test
    @DisplayName("Only the pre-merge states may fail; later failures abort")
    void failedOnlyBeforeMerge() {
        assertTrue(WorkflowState.ANALYZED.canTransitionTo(WorkflowState.FAILED));
        assertFalse(WorkflowState.MERGING.canTransitionTo(WorkflowState.FAILED));
        assertTrue(WorkflowState.MERGING.canTransitionTo(WorkflowState.ABORTED));
        assertTrue(WorkflowState.CONFLICTS_RESOLVING.canTransitionTo(WorkflowState.ABORTED));
    }

    @Test
    @DisplayName("A promoted run cannot be aborted")
    void noAbortAfterPromotion() {
        WorkflowRun run = new WorkflowRun("r1", WorkflowMode.SYNC, clock);
        run.transitionTo(WorkflowState.BACKED_UP);
        run.transitionTo(WorkflowState.FETCHED);
        run.transitionTo(WorkflowState.ANALYZED);
        run.transitionTo(WorkflowState.MERGING);
        run.transitionTo(WorkflowState.CONFLICTS_RESOLVING);
        run.transitionTo(WorkflowState.CLEAN_MERGE);
        run.markPromoted();

        assertThrows(IllegalStateException.class, () -> run.transitionTo(WorkflowState.ABORTED));
    }

    @Test
    @DisplayName("REPORTED is final")
    void reportedIsFinal() {
        assertThat(WorkflowState.REPORTED.successors()).isEmpty();
        for (WorkflowState state : WorkflowState.values()) {
            if (state.isTerminal()) {
                assertTrue(state.canTransitionTo(WorkflowState.REPORTED), state.name());
            }
        }
    }

    @Test
    @DisplayName("Drift warnings raise a successful exit code to 1")
    void driftWarningExitCode() {
        WorkflowRun run = new WorkflowRun("r1", WorkflowMode.CHECK_ONLY, clock);
        run.recordDrift(new DriftReport(List.of(new DriftFinding(
                "litellm/utils.py", DriftSeverity.WARNING, List.of("premium-user"), List.of(), "changed"))), false);

        run.finish(RunOutcome.CHECKED, null);

        assertEquals(1, run.getExitCode());
    }

    @Test
    @DisplayName("Fatal exit codes take precedence over outcome codes")
    void fatalExitCode() {
        WorkflowRun run = new WorkflowRun("r1", WorkflowMode.SYNC, clock);

        run.finish(RunOutcome.FAILED, 3);

        assertEquals(3, run.getExitCode());
        assertEquals(clock.instant(), run.getFinishedAt());
    }
}
