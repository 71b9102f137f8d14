package com.purchasingpower.forksync.model;

/**
 * How a path is owned by the fork.
 */
public enum FileCategory {

    /** Fork-local content that must survive every sync. */
    PROTECTED,

    /** Build output that is rebuilt, never merged. */
    GENERATED,

    /** Everything else: merged normally, conflicts need a human. */
    ORDINARY
}
