package com.purchasingpower.forksync.model;

/**
 * Ordered from least to most severe.
 */
public enum DriftSeverity {
    CLEAN,
    WARNING,
    CRITICAL;

    public DriftSeverity max(DriftSeverity other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
