package com.purchasingpower.forksync.model;

import java.util.List;

/**
 * @param path         changed path
 * @param severity     how much the change threatens the fork's overrides
 * @param matchedRules names of the drift rules that matched, in rule order
 * @param excerpt      a few matching lines from the upstream content
 * @param reason       short human-readable cause
 */
public record DriftFinding(
        String path,
        DriftSeverity severity,
        List<String> matchedRules,
        List<String> excerpt,
        String reason
) {
    public DriftFinding {
        matchedRules = List.copyOf(matchedRules);
        excerpt = List.copyOf(excerpt);
    }
}
