package com.purchasingpower.forksync.cli;

import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.exception.ForkSyncException;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.DivergenceReport;
import com.purchasingpower.forksync.model.RegenerationResult;
import com.purchasingpower.forksync.report.WorkflowReport;
import com.purchasingpower.forksync.report.WorkflowReportWriter;
import com.purchasingpower.forksync.workflow.MergeWorkflowOrchestrator;
import com.purchasingpower.forksync.workflow.SyncOptions;
import com.purchasingpower.forksync.workflow.WorkflowRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.PrintStream;
import java.util.List;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * <pre>
 * fork-sync sync [--check-only] [--override-drift] [--no-promote] [--upstream-branch=&lt;b&gt;]
 * fork-sync analyze [--upstream-branch=&lt;b&gt;]
 * fork-sync regenerate
 * </pre>
 * Any {@code --forksync.*} option overrides configuration as usual.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "forksync.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ForkSyncCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int USAGE_EXIT_CODE = 64;

    private static final Set<String> COMMAND_OPTIONS =
            Set.of("check-only", "override-drift", "no-promote", "upstream-branch");

    private static final String USAGE = """
            Usage:
              fork-sync sync [--check-only] [--override-drift] [--no-promote] [--upstream-branch=<branch>]
              fork-sync analyze [--upstream-branch=<branch>]
              fork-sync regenerate
            """;

    private final ForkSyncProperties props;
    private final MergeWorkflowOrchestrator orchestrator;
    private final WorkflowReportWriter reportWriter;

    private PrintStream out = System.out;
    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    int execute(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.size() != 1 || !hasOnlyKnownOptions(args)) {
            System.err.print(USAGE);
            return USAGE_EXIT_CODE;
        }

        String command = commands.get(0);
        try (GitRepositoryHandle handle = GitRepositoryHandle.open(new File(props.getRepositoryDir()))) {
            return switch (command) {
                case "sync" -> sync(handle, args);
                case "analyze" -> analyze(handle, args);
                case "regenerate" -> regenerate(handle);
                default -> {
                    System.err.print(USAGE);
                    yield USAGE_EXIT_CODE;
                }
            };
        } catch (ForkSyncException e) {
            log.error("{} failed: {}", command, e.getMessage(), e);
            return e.getExitCode();
        }
    }

    private int sync(GitRepositoryHandle handle, ApplicationArguments args) {
        SyncOptions options = (args.containsOption("check-only") ? SyncOptions.checkOnly() : SyncOptions.sync())
                .withOverrideDrift(args.containsOption("override-drift"))
                .withUpstreamBranch(upstreamBranch(args));
        if (args.containsOption("no-promote")) {
            options = options.withPromote(false);
        }

        WorkflowRun run = orchestrator.sync(handle, options);
        reportWriter.publish(WorkflowReport.from(run), out);
        return run.getExitCode();
    }

    private int analyze(GitRepositoryHandle handle, ApplicationArguments args) {
        DivergenceReport divergence = orchestrator.analyze(handle, upstreamBranch(args));
        log.info("Divergence: {}", divergence.summary());
        reportWriter.publish(divergence, out);
        return 0;
    }

    private int regenerate(GitRepositoryHandle handle) {
        List<RegenerationResult> results = orchestrator.regenerateWorkTree(handle);
        if (results.isEmpty()) {
            log.warn("No artifacts configured under forksync.artifacts");
        }
        reportWriter.publish(results, out);
        return 0;
    }

    private static String upstreamBranch(ApplicationArguments args) {
        List<String> values = args.getOptionValues("upstream-branch");
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }

    private static boolean hasOnlyKnownOptions(ApplicationArguments args) {
        for (String name : args.getOptionNames()) {
            if (!COMMAND_OPTIONS.contains(name) && !name.startsWith("forksync.") && !name.startsWith("spring.")
                    && !name.startsWith("logging.")) {
                log.error("Unknown option --{}", name);
                return false;
            }
        }
        return true;
    }
}
