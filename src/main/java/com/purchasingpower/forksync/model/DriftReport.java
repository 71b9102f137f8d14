package com.purchasingpower.forksync.model;

import java.util.List;

public record DriftReport(List<DriftFinding> findings) {

    public DriftReport {
        findings = List.copyOf(findings);
    }

    public static DriftReport clean() {
        return new DriftReport(List.of());
    }

    public DriftSeverity severity() {
        DriftSeverity result = DriftSeverity.CLEAN;
        for (DriftFinding finding : findings) {
            result = result.max(finding.severity());
        }
        return result;
    }

    public boolean isCritical() {
        return severity() == DriftSeverity.CRITICAL;
    }
}
