package com.purchasingpower.forksync.service.impl;

import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.ClassificationPolicy;
import com.purchasingpower.forksync.model.ResolutionResult;
import com.purchasingpower.forksync.model.ResolutionStrategy;
import com.purchasingpower.forksync.service.ProtectedPathResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Post-merge rewrite that keeps fork-owned files at their pre-merge content.
 *
 * <p>"Pre-merge local content" is the blob in HEAD of the update branch, which is the
 * primary branch's head at the time the merge started.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProtectedPathResolverImpl implements ProtectedPathResolver {

    private final ClassificationPolicy policy;

    @Override
    public ResolutionResult resolveConflicts(GitRepositoryHandle handle, Collection<String> conflictingPaths) {
        Set<String> stillConflicting = handle.conflictingPaths();
        ObjectId head = handle.require(Constants.HEAD);

        Set<String> resolved = new TreeSet<>();
        Set<String> deferred = new TreeSet<>();
        Set<String> unresolved = new TreeSet<>();

        for (String path : new TreeSet<>(conflictingPaths)) {
            if (!stillConflicting.contains(path)) {
                log.debug("{} is no longer conflicting, skipping", path);
                continue;
            }
            ResolutionStrategy strategy = policy.strategyFor(path);
            switch (strategy) {
                case FORCE_LOCAL -> {
                    restoreLocal(handle, head, path);
                    resolved.add(path);
                    log.info("  Keeping ours: {}", path);
                }
                case REGENERATE -> deferred.add(path);
                case MANUAL -> {
                    unresolved.add(path);
                    log.warn("  Needs manual resolution: {}", path);
                }
            }
        }
        return new ResolutionResult(resolved, deferred, unresolved);
    }

    @Override
    public Set<String> enforceProtected(GitRepositoryHandle handle, Collection<String> mergedPaths) {
        Set<String> conflicting = handle.conflictingPaths();
        Set<String> staged = handle.stagedPaths();
        ObjectId head = handle.require(Constants.HEAD);

        Set<String> restored = new TreeSet<>();
        for (String path : new TreeSet<>(mergedPaths)) {
            if (conflicting.contains(path) || !staged.contains(path)
                    || policy.strategyFor(path) != ResolutionStrategy.FORCE_LOCAL) {
                continue;
            }
            restoreLocal(handle, head, path);
            restored.add(path);
            log.info("  Reverted clean upstream change to protected path: {}", path);
        }
        return restored;
    }

    private void restoreLocal(GitRepositoryHandle handle, ObjectId head, String path) {
        Optional<byte[]> local = handle.readFile(head, path);
        if (local.isPresent()) {
            handle.writeWorkTreeFile(path, local.get());
            handle.stage(path);
        } else {
            // absent before the merge: keep it absent
            handle.remove(path, false);
        }
    }
}
