package com.purchasingpower.forksync.service;

import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.DivergenceReport;

public interface DivergenceAnalyzer {

    /**
     * Compare the local branch with the (already fetched) upstream ref.
     *
     * @param handle      repository to inspect
     * @param localRef    local branch, e.g. {@code refs/heads/main}
     * @param upstreamRef tracking ref, e.g. {@code refs/remotes/upstream/main}
     * @return ahead/behind counts and the paths upstream changed since the merge base
     */
    DivergenceReport analyze(GitRepositoryHandle handle, String localRef, String upstreamRef);
}
