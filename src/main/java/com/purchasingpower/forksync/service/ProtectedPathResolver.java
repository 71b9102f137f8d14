package com.purchasingpower.forksync.service;

import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.ResolutionResult;

import java.util.Collection;
import java.util.Set;

public interface ProtectedPathResolver {

    /**
     * Apply the classification policy to the conflicting paths of an in-progress merge.
     * Paths that are no longer conflicting are skipped, so repeating a call is a no-op.
     */
    ResolutionResult resolveConflicts(GitRepositoryHandle handle, Collection<String> conflictingPaths);

    /**
     * Restore pre-merge content for FORCE_LOCAL paths the merge changed without a conflict.
     *
     * @return paths that were restored
     */
    Set<String> enforceProtected(GitRepositoryHandle handle, Collection<String> mergedPaths);
}
