package com.purchasingpower.forksync.service;

import com.purchasingpower.forksync.configuration.ArtifactProperties;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.RegenerationResult;

import java.util.List;

public interface BuildArtifactRegenerator {

    /**
     * Replace the artifact's target directory with a copy of its canonical build output,
     * validate it and stage it.
     *
     * @throws com.purchasingpower.forksync.exception.RegenerationValidationException when the
     *         source or the copy fails validation; nothing stays staged under the target
     */
    RegenerationResult regenerate(GitRepositoryHandle handle, ArtifactProperties artifact);

    /**
     * Rebuild the target directory in the working tree without staging anything.
     */
    RegenerationResult refreshWorkTree(GitRepositoryHandle handle, ArtifactProperties artifact);

    /**
     * Artifacts whose target contains at least one of {@code paths}.
     */
    List<ArtifactProperties> affectedArtifacts(Iterable<String> paths);
}
