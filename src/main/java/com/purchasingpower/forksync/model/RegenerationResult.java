package com.purchasingpower.forksync.model;

/**
 * @param artifact     configured artifact name
 * @param target       repository-relative directory that was rebuilt
 * @param filesCopied  number of files in the rebuilt directory
 * @param stagedPaths  index entries added or removed under the target
 */
public record RegenerationResult(
        String artifact,
        String target,
        int filesCopied,
        int stagedPaths
) {
}
