package com.purchasingpower.forksync.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * A generated directory that is rebuilt from a canonical build output instead of merged.
 */
@Data
public class ArtifactProperties {

    @NotBlank
    private String name;

    /**
     * Directory inside the repository holding the committed build output.
     */
    @NotBlank
    private String target;

    /**
     * Canonical, already-built tree. Relative paths resolve against the repository root.
     */
    @NotBlank
    private String source;

    /**
     * Ant-style pattern (relative to the artifact root) selecting documents to validate.
     */
    @NotBlank
    private String documentGlob = "**/*.html";

    /**
     * Regex of the top-level marker every document must contain exactly once.
     */
    @NotBlank
    private String marker = "(?i)<!DOCTYPE";

    @Min(0)
    private int minFiles = 1;

    @Min(1)
    private int maxFiles = 10_000;
}
