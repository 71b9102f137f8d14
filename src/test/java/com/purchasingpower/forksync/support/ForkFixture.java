package com.purchasingpower.forksync.support;

import com.purchasingpower.forksync.artifact.ArtifactValidator;
import com.purchasingpower.forksync.config.ForkSyncConfig;
import com.purchasingpower.forksync.configuration.ArtifactProperties;
import com.purchasingpower.forksync.configuration.DriftProperties;
import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.configuration.PolicyRuleProperties;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.git.RunIdGenerator;
import com.purchasingpower.forksync.model.ClassificationPolicy;
import com.purchasingpower.forksync.model.FileCategory;
import com.purchasingpower.forksync.model.ResolutionStrategy;
import com.purchasingpower.forksync.service.BuildArtifactRegenerator;
import com.purchasingpower.forksync.service.impl.BuildArtifactRegeneratorImpl;
import com.purchasingpower.forksync.service.impl.DivergenceAnalyzerImpl;
import com.purchasingpower.forksync.service.impl.LicenseDriftScannerImpl;
import com.purchasingpower.forksync.service.impl.ProtectedPathResolverImpl;
import com.purchasingpower.forksync.workflow.MergeWorkflowOrchestrator;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ListBranchCommand;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.revwalk.RevWalk;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two real repositories on disk: an "upstream" project and a fork cloned from it, with the
 * upstream registered in the fork as remote {@code upstream}. Both start on {@code main}.
 */
public final class ForkFixture implements AutoCloseable {

    public static final String LICENSE_FILE = "litellm/proxy/auth/litellm_license.py";
    public static final String GENERATED_DIR = "litellm/proxy/_experimental/out";
    public static final String UI_SOURCE_DIR = "ui/litellm-dashboard/out";

    public static final Clock FIXED_CLOCK =
            Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private static final PersonIdent UPSTREAM_DEV = new PersonIdent("Upstream Dev", "upstream@example.com");
    private static final PersonIdent FORK_DEV = new PersonIdent("Fork Dev", "fork@example.com");

    private final Path upstreamDir;
    private final Path forkDir;
    private final Git upstream;
    private final Git fork;

    private ForkFixture(Path upstreamDir, Path forkDir, Git upstream, Git fork) {
        this.upstreamDir = upstreamDir;
        this.forkDir = forkDir;
        this.upstream = upstream;
        this.fork = fork;
    }

    public static ForkFixture create(Path root, Map<String, String> initialFiles) throws Exception {
        Path upstreamDir = root.resolve("upstream");
        Path forkDir = root.resolve("fork");

        Git upstream = Git.init().setDirectory(upstreamDir.toFile()).setInitialBranch("main").call();
        write(upstreamDir, initialFiles);
        upstream.add().addFilepattern(".").call();
        upstream.commit().setMessage("initial import").setAuthor(UPSTREAM_DEV).setCommitter(UPSTREAM_DEV).call();

        Git fork = Git.cloneRepository()
                .setURI(upstreamDir.toUri().toString())
                .setDirectory(forkDir.toFile())
                .setRemote("upstream")
                .setBranch("main")
                .call();
        StoredConfig config = fork.getRepository().getConfig();
        config.setString("user", null, "name", FORK_DEV.getName());
        config.setString("user", null, "email", FORK_DEV.getEmailAddress());
        config.save();

        return new ForkFixture(upstreamDir, forkDir, upstream, fork);
    }

    /**
     * Default layout: a protected license file, a README, an ordinary module and a committed
     * copy of the generated UI.
     */
    public static Map<String, String> defaultLayout() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("README.md", "# Project\n");
        files.put(LICENSE_FILE, "class LicenseCheck:\n    def is_premium(self):\n        return False\n");
        files.put("litellm/app.py", "def handler():\n    return 'v1'\n");
        files.put("litellm/utils.py", "def helper():\n    return 1\n");
        files.put(GENERATED_DIR + "/index.html", html("v1"));
        return files;
    }

    /**
     * Alternating path/content pairs. A null content marks a deletion.
     */
    public static Map<String, String> files(String... pathsAndContents) {
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            files.put(pathsAndContents[i], pathsAndContents[i + 1]);
        }
        return files;
    }

    public static String html(String version) {
        return "<!DOCTYPE html>\n<html><body>" + version + "</body></html>\n";
    }

    // ------------------------------------------------------------------
    // Commits
    // ------------------------------------------------------------------

    /**
     * Commit on upstream main. A null value deletes the file.
     */
    public ObjectId commitUpstream(String message, Map<String, String> files) throws Exception {
        return commit(upstream, upstreamDir, message, files, UPSTREAM_DEV);
    }

    public ObjectId commitFork(String message, Map<String, String> files) throws Exception {
        return commit(fork, forkDir, message, files, FORK_DEV);
    }

    private static ObjectId commit(Git git, Path dir, String message, Map<String, String> files,
                                   PersonIdent who) throws Exception {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            if (entry.getValue() == null) {
                git.rm().addFilepattern(entry.getKey()).call();
            } else {
                write(dir, Map.of(entry.getKey(), entry.getValue()));
                git.add().addFilepattern(entry.getKey()).call();
            }
        }
        return git.commit().setMessage(message).setAuthor(who).setCommitter(who).call().toObjectId();
    }

    // ------------------------------------------------------------------
    // Fork access
    // ------------------------------------------------------------------

    public Path forkDir() {
        return forkDir;
    }

    public GitRepositoryHandle openFork() {
        return GitRepositoryHandle.open(forkDir.toFile());
    }

    public ObjectId forkRef(String ref) throws IOException {
        return fork.getRepository().resolve(ref);
    }

    public String readFork(String path) throws IOException {
        return Files.readString(forkDir.resolve(path), StandardCharsets.UTF_8);
    }

    public boolean forkFileExists(String path) {
        return Files.exists(forkDir.resolve(path));
    }

    public void writeFork(String path, String content) throws IOException {
        write(forkDir, Map.of(path, content));
    }

    public List<String> forkBranches() throws Exception {
        return fork.branchList().setListMode(ListBranchCommand.ListMode.ALL).call().stream()
                .map(Ref::getName)
                .filter(name -> name.startsWith("refs/heads/"))
                .map(name -> name.substring("refs/heads/".length()))
                .sorted()
                .toList();
    }

    public String forkCurrentBranch() throws IOException {
        return fork.getRepository().getBranch();
    }

    public boolean forkIsClean() throws Exception {
        return fork.status().call().getUncommittedChanges().isEmpty();
    }

    public int parentCount(ObjectId commit) throws IOException {
        try (RevWalk walk = new RevWalk(fork.getRepository())) {
            return walk.parseCommit(commit).getParentCount();
        }
    }

    public void breakUpstreamUrl() throws IOException {
        StoredConfig config = fork.getRepository().getConfig();
        config.setString("remote", "upstream", "url", forkDir.resolveSibling("does-not-exist").toString());
        config.save();
    }

    // ------------------------------------------------------------------
    // Wiring
    // ------------------------------------------------------------------

    /**
     * Properties matching {@link #defaultLayout()}.
     */
    public ForkSyncProperties properties() {
        ForkSyncProperties props = new ForkSyncProperties();
        props.setRepositoryDir(forkDir.toString());
        props.setPrimaryBranch("main");
        props.getUpstream().setRemote("upstream");
        props.getUpstream().setBranch("main");

        props.getPolicy().add(rule(LICENSE_FILE, FileCategory.PROTECTED, ResolutionStrategy.FORCE_LOCAL));
        props.getPolicy().add(rule("README.md", FileCategory.PROTECTED, ResolutionStrategy.FORCE_LOCAL));
        props.getPolicy().add(rule(GENERATED_DIR + "/**", FileCategory.GENERATED, ResolutionStrategy.REGENERATE));

        DriftProperties drift = props.getDrift();
        drift.getCriticalPaths().add(LICENSE_FILE);
        drift.getWatchedPaths().add("litellm/utils.py");
        drift.getScanGlobs().add("**/*.py");
        drift.getPatterns().add(pattern("premium-user", "premium_user|is_premium"));
        drift.getPatterns().add(pattern("license-check", "LicenseCheck|LITELLM_LICENSE"));

        ArtifactProperties ui = new ArtifactProperties();
        ui.setName("dashboard-ui");
        ui.setTarget(GENERATED_DIR);
        ui.setSource(UI_SOURCE_DIR);
        props.getArtifacts().add(ui);
        return props;
    }

    public static MergeWorkflowOrchestrator orchestrator(ForkSyncProperties props) {
        return orchestrator(props, regenerator(props));
    }

    public static MergeWorkflowOrchestrator orchestrator(ForkSyncProperties props,
                                                         BuildArtifactRegenerator regenerator) {
        ForkSyncConfig config = new ForkSyncConfig();
        ClassificationPolicy policy = config.classificationPolicy(props);
        return new MergeWorkflowOrchestrator(
                props,
                new DivergenceAnalyzerImpl(policy, props),
                new LicenseDriftScannerImpl(config.driftRules(props), props),
                new ProtectedPathResolverImpl(policy),
                regenerator,
                new RunIdGenerator(FIXED_CLOCK),
                FIXED_CLOCK);
    }

    public static BuildArtifactRegeneratorImpl regenerator(ForkSyncProperties props) {
        return new BuildArtifactRegeneratorImpl(props, new ArtifactValidator());
    }

    private static PolicyRuleProperties rule(String pattern, FileCategory category, ResolutionStrategy strategy) {
        PolicyRuleProperties rule = new PolicyRuleProperties();
        rule.setPattern(pattern);
        rule.setCategory(category);
        rule.setStrategy(strategy);
        return rule;
    }

    private static DriftProperties.Pattern pattern(String name, String regex) {
        DriftProperties.Pattern pattern = new DriftProperties.Pattern();
        pattern.setName(name);
        pattern.setRegex(regex);
        return pattern;
    }

    private static void write(Path root, Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            Path file = root.resolve(entry.getKey());
            Files.createDirectories(file.getParent());
            Files.writeString(file, entry.getValue(), StandardCharsets.UTF_8);
        }
    }

    @Override
    public void close() {
        upstream.close();
        fork.close();
    }
}
