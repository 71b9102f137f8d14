package com.purchasingpower.forksync.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DriftProperties {

    /**
     * Files whose change upstream blocks the sync: the fork's overrides live there.
     */
    @NotNull
    private List<String> criticalPaths = new ArrayList<>();

    /**
     * Files known to contain gating checks. A change is reported as a warning.
     */
    @NotNull
    private List<String> watchedPaths = new ArrayList<>();

    /**
     * Ant-style patterns restricting which other changed files are scanned. Empty scans all.
     */
    @NotNull
    private List<String> scanGlobs = new ArrayList<>();

    @Min(1)
    private long maxScanBytes = 2 * 1024 * 1024;

    @Min(1)
    private int excerptLines = 3;

    @Valid
    @NotNull
    private List<Pattern> patterns = new ArrayList<>();

    @Data
    public static class Pattern {

        @NotBlank
        private String name;

        @NotBlank
        private String regex;
    }
}
