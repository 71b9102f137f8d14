package com.purchasingpower.forksync.workflow;

import com.purchasingpower.forksync.config.ForkSyncConfig;
import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.exception.ForkSyncException;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.git.RunIdGenerator;
import com.purchasingpower.forksync.model.ClassificationPolicy;
import com.purchasingpower.forksync.service.DivergenceAnalyzer;
import com.purchasingpower.forksync.service.LicenseDriftScanner;
import com.purchasingpower.forksync.service.ProtectedPathResolver;
import com.purchasingpower.forksync.service.impl.DivergenceAnalyzerImpl;
import com.purchasingpower.forksync.service.impl.LicenseDriftScannerImpl;
import com.purchasingpower.forksync.support.ForkFixture;
import org.eclipse.jgit.lib.ObjectId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static com.purchasingpower.forksync.support.ForkFixture.files;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Collaborator failures, injected with Mockito, must end the run cleanly: FAILED before the merge,
 * ABORTED with a full rollback after it.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Merge Workflow Failure Handling Tests")
class MergeWorkflowOrchestratorFailureTest {

    @TempDir
    Path tempDir;

    @Mock
    private DivergenceAnalyzer failingAnalyzer;

    @Mock
    private LicenseDriftScanner unusedScanner;

    @Mock
    private ProtectedPathResolver failingResolver;

    private ForkFixture fixture;
    private GitRepositoryHandle handle;
    private ForkSyncProperties props;

    @BeforeEach
    void setUp() throws Exception {
        fixture = ForkFixture.create(tempDir, ForkFixture.defaultLayout());
        handle = fixture.openFork();
        props = fixture.properties();
    }

    @AfterEach
    void tearDown() {
        handle.close();
        fixture.close();
    }

    @Test
    @DisplayName("Analyzer failure ends in FAILED with the generic exit code")
    void analyzerFailure() throws Exception {
        // Given
        when(failingAnalyzer.analyze(any(), anyString(), anyString()))
                .thenThrow(new ForkSyncException("Revision not found: refs/heads/main"));
        MergeWorkflowOrchestrator orchestrator = new MergeWorkflowOrchestrator(props, failingAnalyzer,
                unusedScanner, failingResolver, ForkFixture.regenerator(props),
                new RunIdGenerator(ForkFixture.FIXED_CLOCK), ForkFixture.FIXED_CLOCK);
        ObjectId before = fixture.forkRef("refs/heads/main");

        // When
        WorkflowRun run = orchestrator.sync(handle, SyncOptions.sync());

        // Then
        assertEquals(WorkflowState.FAILED, run.terminalState());
        assertEquals(RunOutcome.FAILED, run.getOutcome());
        assertEquals(ForkSyncException.GENERIC_EXIT_CODE, run.getExitCode());
        assertEquals(before, fixture.forkRef("refs/heads/main"));
        verifyNoInteractions(unusedScanner, failingResolver);
    }

    @Test
    @DisplayName("Resolver failure after the merge aborts and rolls back to the backup")
    void resolverFailureAborts() throws Exception {
        // Given
        when(failingResolver.resolveConflicts(any(), any()))
                .thenThrow(new ForkSyncException("index.lock exists"));
        ForkSyncConfig config = new ForkSyncConfig();
        ClassificationPolicy policy = config.classificationPolicy(props);
        MergeWorkflowOrchestrator orchestrator = new MergeWorkflowOrchestrator(props,
                new DivergenceAnalyzerImpl(policy, props),
                new LicenseDriftScannerImpl(config.driftRules(props), props),
                failingResolver, ForkFixture.regenerator(props),
                new RunIdGenerator(ForkFixture.FIXED_CLOCK), ForkFixture.FIXED_CLOCK);
        fixture.commitFork("fork", files("litellm/app.py", "def handler():\n    return 'fork'\n"));
        ObjectId before = fixture.forkRef("refs/heads/main");
        fixture.commitUpstream("upstream", files("litellm/app.py", "def handler():\n    return 'upstream'\n"));

        // When
        WorkflowRun run = orchestrator.sync(handle, SyncOptions.sync());

        // Then
        assertEquals(WorkflowState.ABORTED, run.terminalState());
        assertEquals(ForkSyncException.GENERIC_EXIT_CODE, run.getExitCode());
        assertEquals(before, fixture.forkRef("refs/heads/main"));
        assertEquals("main", fixture.forkCurrentBranch());
        assertTrue(fixture.forkIsClean());
        assertThat(fixture.forkBranches()).containsExactly(run.getBackupBranch(), "main");
        assertThat(run.getFailureMessage()).contains("index.lock exists");
    }
}
