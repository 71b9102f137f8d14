package com.purchasingpower.forksync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of comparing the local branch with the fetched upstream ref.
 * Recomputed on every run and never persisted.
 */
@Value
@Builder
public class DivergenceReport {

    String localRef;
    String localHead;
    String upstreamRef;
    String upstreamHead;

    /** Common ancestor, or null when the histories are unrelated. */
    String mergeBase;

    int commitsAhead;
    int commitsBehind;

    /** Everything changed upstream relative to the merge base. */
    @Singular
    List<ChangedFile> changedFiles;

    /** Newest first, capped by the configured limit. */
    @Singular
    List<UpstreamCommit> recentCommits;

    /** Protected paths upstream touched: likely conflicts. */
    @Singular("protectedPathTouched")
    Set<String> protectedPathsTouched;

    public boolean hasUpstreamChanges() {
        return commitsBehind > 0;
    }

    public Set<String> changedPaths() {
        Set<String> paths = new TreeSet<>();
        for (ChangedFile file : changedFiles) {
            paths.add(file.path());
        }
        return paths;
    }

    public String summary() {
        return String.format("%d ahead, %d behind, %d paths changed upstream",
                commitsAhead, commitsBehind, changedFiles.size());
    }
}
