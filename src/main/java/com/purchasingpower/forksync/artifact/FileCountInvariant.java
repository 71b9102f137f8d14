package com.purchasingpower.forksync.artifact;

import java.nio.file.Path;
import java.util.List;

public class FileCountInvariant implements ArtifactInvariant {

    private final int minFiles;
    private final int maxFiles;

    public FileCountInvariant(int minFiles, int maxFiles) {
        if (minFiles > maxFiles) {
            throw new IllegalArgumentException("min-files " + minFiles + " exceeds max-files " + maxFiles);
        }
        this.minFiles = minFiles;
        this.maxFiles = maxFiles;
    }

    @Override
    public String name() {
        return "file-count";
    }

    @Override
    public List<String> check(Path root, List<Path> files) {
        int count = files.size();
        if (count < minFiles || count > maxFiles) {
            return List.of("%d files, expected between %d and %d".formatted(count, minFiles, maxFiles));
        }
        return List.of();
    }
}
