package com.purchasingpower.forksync.service.impl;

import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.ChangedFile;
import com.purchasingpower.forksync.model.ClassificationPolicy;
import com.purchasingpower.forksync.model.DivergenceReport;
import com.purchasingpower.forksync.model.FileCategory;
import com.purchasingpower.forksync.service.DivergenceAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.ObjectId;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class DivergenceAnalyzerImpl implements DivergenceAnalyzer {

    private final ClassificationPolicy policy;
    private final ForkSyncProperties props;

    @Override
    public DivergenceReport analyze(GitRepositoryHandle handle, String localRef, String upstreamRef) {
        ObjectId local = handle.require(localRef);
        ObjectId upstream = handle.require(upstreamRef);

        int ahead = handle.countCommits(local, upstream);
        int behind = handle.countCommits(upstream, local);

        DivergenceReport.DivergenceReportBuilder report = DivergenceReport.builder()
                .localRef(localRef)
                .localHead(local.getName())
                .upstreamRef(upstreamRef)
                .upstreamHead(upstream.getName())
                .commitsAhead(ahead)
                .commitsBehind(behind);

        if (behind == 0) {
            log.info("{} is up to date with {} ({} local commits ahead)", localRef, upstreamRef, ahead);
            handle.mergeBase(local, upstream).ifPresent(base -> report.mergeBase(base.getName()));
            return report.build();
        }

        ObjectId base = handle.mergeBase(local, upstream).orElse(null);
        if (base == null) {
            log.warn("{} and {} share no history; diffing upstream against an empty tree", localRef, upstreamRef);
        }

        List<ChangedFile> changed = handle.diff(base, upstream);
        Set<String> protectedTouched = policy.filter(
                changed.stream().map(ChangedFile::path).toList(), FileCategory.PROTECTED);

        DivergenceReport result = report
                .mergeBase(base == null ? null : base.getName())
                .changedFiles(changed)
                .recentCommits(handle.listCommits(upstream, local, props.getRecentCommitLimit()))
                .protectedPathsTouched(protectedTouched)
                .build();

        log.info("Divergence {}..{}: {}", localRef, upstreamRef, result.summary());
        for (String path : protectedTouched) {
            log.info("  protected path changed upstream (potential conflict): {}", path);
        }
        return result;
    }
}
