package com.purchasingpower.forksync.service.impl;

import com.purchasingpower.forksync.configuration.DriftProperties;
import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.ChangedFile;
import com.purchasingpower.forksync.model.DivergenceReport;
import com.purchasingpower.forksync.model.DriftFinding;
import com.purchasingpower.forksync.model.DriftReport;
import com.purchasingpower.forksync.model.DriftRule;
import com.purchasingpower.forksync.model.DriftSeverity;
import com.purchasingpower.forksync.service.LicenseDriftScanner;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.ObjectId;
import org.springframework.stereotype.Service;
import org.springframework.util.AntPathMatcher;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Textual heuristic guarding the assumption that a few known files fully control feature gating.
 *
 * <p>Severity per changed path:
 * <ol>
 *   <li>critical path whose upstream content differs from ours: CRITICAL</li>
 *   <li>watched path whose upstream content differs from ours: WARNING</li>
 *   <li>any other changed path whose upstream content matches a drift rule: WARNING</li>
 * </ol>
 * False positives are acceptable; the rule vocabulary is deliberately broad.
 */
@Slf4j
@Service
public class LicenseDriftScannerImpl implements LicenseDriftScanner {

    private final List<DriftRule> rules;
    private final DriftProperties drift;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public LicenseDriftScannerImpl(List<DriftRule> rules, ForkSyncProperties props) {
        this.rules = List.copyOf(rules);
        this.drift = props.getDrift();
    }

    @Override
    public DriftReport scan(GitRepositoryHandle handle, DivergenceReport divergence) {
        if (!divergence.hasUpstreamChanges()) {
            return DriftReport.clean();
        }

        ObjectId local = ObjectId.fromString(divergence.getLocalHead());
        ObjectId upstream = ObjectId.fromString(divergence.getUpstreamHead());
        Set<String> critical = new HashSet<>(drift.getCriticalPaths());
        Set<String> watched = new HashSet<>(drift.getWatchedPaths());

        List<DriftFinding> findings = new ArrayList<>();
        for (ChangedFile changed : divergence.getChangedFiles()) {
            String path = changed.path();
            if (critical.contains(path)) {
                knownPathFinding(handle, local, upstream, path, DriftSeverity.CRITICAL)
                        .ifPresent(findings::add);
            } else if (watched.contains(path)) {
                knownPathFinding(handle, local, upstream, path, DriftSeverity.WARNING)
                        .ifPresent(findings::add);
            } else if (!changed.isDeletion() && inScanScope(path)) {
                vocabularyFinding(handle, upstream, path).ifPresent(findings::add);
            }
        }

        DriftReport report = new DriftReport(findings);
        logReport(report);
        return report;
    }

    private Optional<DriftFinding> knownPathFinding(GitRepositoryHandle handle, ObjectId local,
                                                    ObjectId upstream, String path, DriftSeverity severity) {
        Optional<ObjectId> ours = handle.blobId(local, path);
        Optional<ObjectId> theirs = handle.blobId(upstream, path);
        if (Objects.equals(ours, theirs)) {
            log.debug("{} changed upstream but matches our content", path);
            return Optional.empty();
        }

        List<String> upstreamLines = theirs.map(id -> lines(handle, id)).orElse(List.of());
        Set<String> localLines = new HashSet<>(ours.map(id -> lines(handle, id)).orElse(List.of()));
        List<String> introduced = upstreamLines.stream()
                .filter(line -> !localLines.contains(line))
                .toList();

        Match match = match(introduced);
        String reason = theirs.isEmpty()
                ? "known gating file deleted upstream"
                : "known gating file modified upstream";
        return Optional.of(new DriftFinding(path, severity, match.rules(), match.excerpt(), reason));
    }

    private Optional<DriftFinding> vocabularyFinding(GitRepositoryHandle handle, ObjectId upstream, String path) {
        Optional<ObjectId> blob = handle.blobId(upstream, path);
        if (blob.isEmpty()) {
            return Optional.empty();
        }
        if (handle.blobSize(blob.get()) > drift.getMaxScanBytes()) {
            log.debug("Skipping {}: larger than {} bytes", path, drift.getMaxScanBytes());
            return Optional.empty();
        }

        byte[] content = handle.readBlob(blob.get());
        if (isBinary(content)) {
            return Optional.empty();
        }

        Match match = match(new String(content, StandardCharsets.UTF_8).lines().toList());
        if (match.rules().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DriftFinding(path, DriftSeverity.WARNING, match.rules(), match.excerpt(),
                "gating vocabulary in changed file"));
    }

    private Match match(List<String> lines) {
        Set<String> matched = new LinkedHashSet<>();
        List<String> excerpt = new ArrayList<>();
        for (String line : lines) {
            boolean hit = false;
            for (DriftRule rule : rules) {
                if (rule.matches(line)) {
                    matched.add(rule.name());
                    hit = true;
                }
            }
            if (hit && excerpt.size() < drift.getExcerptLines()) {
                excerpt.add(line.strip());
            }
        }
        List<String> ordered = rules.stream()
                .map(DriftRule::name)
                .filter(matched::contains)
                .distinct()
                .toList();
        return new Match(ordered, excerpt);
    }

    private boolean inScanScope(String path) {
        return drift.getScanGlobs().isEmpty()
                || drift.getScanGlobs().stream().anyMatch(glob -> matcher.match(glob, path));
    }

    private static List<String> lines(GitRepositoryHandle handle, ObjectId blob) {
        byte[] content = handle.readBlob(blob);
        if (isBinary(content)) {
            return List.of();
        }
        return new String(content, StandardCharsets.UTF_8).lines().toList();
    }

    private static boolean isBinary(byte[] content) {
        int limit = Math.min(content.length, 8000);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static void logReport(DriftReport report) {
        if (report.findings().isEmpty()) {
            log.info("No license drift detected");
            return;
        }
        for (DriftFinding finding : report.findings()) {
            if (finding.severity() == DriftSeverity.CRITICAL) {
                log.warn("CRITICAL drift in {}: {} {}", finding.path(), finding.reason(), finding.matchedRules());
            } else {
                log.info("Drift warning in {}: {} {}", finding.path(), finding.reason(), finding.matchedRules());
            }
            finding.excerpt().forEach(line -> log.info("    {}", line));
        }
        log.info("License drift severity: {}", report.severity());
    }

    private record Match(List<String> rules, List<String> excerpt) {
    }
}
