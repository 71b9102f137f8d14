package com.purchasingpower.forksync.service;

import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.DivergenceReport;
import com.purchasingpower.forksync.model.DriftReport;

public interface LicenseDriftScanner {

    /**
     * Check whether upstream touched gating logic the fork overrides.
     * Reads fetched objects only; never touches the working tree.
     */
    DriftReport scan(GitRepositoryHandle handle, DivergenceReport divergence);
}
