package com.purchasingpower.forksync.model;

import java.util.Set;

/**
 * Outcome of one resolver pass.
 *
 * @param resolved     paths restaged with local content during this pass
 * @param deferred     paths left for the artifact regenerator
 * @param unresolved   paths left conflicted for manual follow-up
 */
public record ResolutionResult(
        Set<String> resolved,
        Set<String> deferred,
        Set<String> unresolved
) {
    public ResolutionResult {
        resolved = Set.copyOf(resolved);
        deferred = Set.copyOf(deferred);
        unresolved = Set.copyOf(unresolved);
    }

    public boolean changedAnything() {
        return !resolved.isEmpty();
    }
}
