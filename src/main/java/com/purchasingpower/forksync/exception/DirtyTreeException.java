package com.purchasingpower.forksync.exception;

import lombok.Getter;

import java.util.Set;

/**
 * The working tree has uncommitted tracked changes. Nothing was mutated.
 */
@Getter
public class DirtyTreeException extends ForkSyncException {

    public static final int EXIT_CODE = 4;

    private final Set<String> uncommittedPaths;

    public DirtyTreeException(Set<String> uncommittedPaths) {
        super("Working tree has uncommitted changes (" + uncommittedPaths.size()
                + " paths). Commit or stash them first.", EXIT_CODE, null);
        this.uncommittedPaths = Set.copyOf(uncommittedPaths);
    }
}
