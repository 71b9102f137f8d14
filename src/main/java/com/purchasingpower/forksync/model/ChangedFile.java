package com.purchasingpower.forksync.model;

/**
 * A file that changed upstream relative to the common ancestor.
 */
public record ChangedFile(
        String path,
        ChangeType changeType
) {
    /**
     * Type of change detected by the tree diff.
     */
    public enum ChangeType {
        ADD,
        MODIFY,
        DELETE,
        RENAME,
        COPY
    }

    public boolean isDeletion() {
        return changeType == ChangeType.DELETE;
    }
}
