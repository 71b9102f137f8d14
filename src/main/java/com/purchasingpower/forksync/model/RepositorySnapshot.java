package com.purchasingpower.forksync.model;

import java.time.Instant;

/**
 * State of the repository captured once at run start.
 *
 * @param primaryBranch short name of the branch being synchronized
 * @param primaryHead   commit id the primary branch pointed at
 * @param upstreamRef   full name of the upstream tracking ref
 * @param checkedOut    branch that was checked out when the run started
 * @param clean         true when the working tree had no uncommitted tracked changes
 * @param capturedAt    capture instant
 */
public record RepositorySnapshot(
        String primaryBranch,
        String primaryHead,
        String upstreamRef,
        String checkedOut,
        boolean clean,
        Instant capturedAt
) {
}
