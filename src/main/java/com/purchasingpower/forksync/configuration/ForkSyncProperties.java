package com.purchasingpower.forksync.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for the fork synchronization engine.
 *
 * <p><b>Example configuration (application.yml):</b>
 * <pre>
 * forksync:
 *   repository-dir: .
 *   primary-branch: main
 *   upstream:
 *     remote: upstream
 *     url: git@github.com:BerriAI/litellm.git
 *     branch: main
 *   policy:
 *     - pattern: "litellm/proxy/auth/litellm_license.py"
 *       category: PROTECTED
 *       strategy: FORCE_LOCAL
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "forksync")
public class ForkSyncProperties {

    @NotBlank(message = "Repository directory is required")
    private String repositoryDir = ".";

    @NotBlank
    private String primaryBranch = "main";

    @NotBlank
    private String backupPrefix = "backup-before-sync";

    @NotBlank
    private String updateBranchPrefix = "update/upstream-sync";

    @Min(0)
    private int recentCommitLimit = 20;

    /**
     * Optional path the JSON run report is written to, in addition to stdout.
     */
    private String reportFile;

    /**
     * Promote a clean merge into the primary branch. When false the run stops at CLEAN_MERGE
     * with the committed update branch left for review.
     */
    private boolean promote = true;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private UpstreamProperties upstream = new UpstreamProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DriftProperties drift = new DriftProperties();

    /**
     * Ordered classification rules. First matching pattern wins.
     */
    @Valid
    @NotNull
    private List<PolicyRuleProperties> policy = new ArrayList<>();

    @Valid
    @NotNull
    private List<ArtifactProperties> artifacts = new ArrayList<>();
}
