package com.purchasingpower.forksync.model;

import java.util.Objects;

/**
 * One entry of the classification policy.
 *
 * @param pattern  Ant-style path pattern relative to the repository root
 * @param category ownership category
 * @param strategy conflict resolution strategy
 */
public record FileClassification(
        String pattern,
        FileCategory category,
        ResolutionStrategy strategy
) {

    /** Classification applied to paths no policy entry matches. */
    public static final FileClassification UNMATCHED =
            new FileClassification("**", FileCategory.ORDINARY, ResolutionStrategy.MANUAL);

    public FileClassification {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(strategy, "strategy");
    }
}
