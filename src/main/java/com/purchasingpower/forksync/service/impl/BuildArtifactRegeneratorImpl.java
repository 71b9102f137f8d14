package com.purchasingpower.forksync.service.impl;

import com.purchasingpower.forksync.artifact.ArtifactValidator;
import com.purchasingpower.forksync.configuration.ArtifactProperties;
import com.purchasingpower.forksync.configuration.ForkSyncProperties;
import com.purchasingpower.forksync.exception.ForkSyncException;
import com.purchasingpower.forksync.exception.RegenerationValidationException;
import com.purchasingpower.forksync.git.GitRepositoryHandle;
import com.purchasingpower.forksync.model.RegenerationResult;
import com.purchasingpower.forksync.service.BuildArtifactRegenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Replaces generated directories by copying a canonical build output instead of merging them.
 *
 * <p>A textual three-way merge of compiled front-end output concatenates documents and breaks
 * content hashes, so whatever the merge produced under the target is thrown away. This is the
 * one step that fails closed: output that does not validate is never staged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BuildArtifactRegeneratorImpl implements BuildArtifactRegenerator {

    private final ForkSyncProperties props;
    private final ArtifactValidator validator;

    @Override
    public RegenerationResult regenerate(GitRepositoryHandle handle, ArtifactProperties artifact) {
        String target = normalize(artifact.getTarget());
        log.info("Regenerating artifact '{}' into {}", artifact.getName(), target);

        int files = rebuild(handle, artifact);

        List<String> violations = validator.validate(artifact, handle.workTree().resolve(target));
        if (!violations.isEmpty()) {
            log.error("Regenerated '{}' is invalid, discarding changes under {}", artifact.getName(), target);
            handle.restoreFromHead(target);
            throw new RegenerationValidationException(artifact.getName(), violations);
        }

        int staged = stage(handle, target);
        log.info("Artifact '{}' regenerated: {} files, {} index entries updated", artifact.getName(), files, staged);
        return new RegenerationResult(artifact.getName(), target, files, staged);
    }

    @Override
    public RegenerationResult refreshWorkTree(GitRepositoryHandle handle, ArtifactProperties artifact) {
        String target = normalize(artifact.getTarget());
        int files = rebuild(handle, artifact);

        List<String> violations = validator.validate(artifact, handle.workTree().resolve(target));
        if (!violations.isEmpty()) {
            handle.restoreFromHead(target);
            throw new RegenerationValidationException(artifact.getName(), violations);
        }
        log.info("Copied {} files to {}. Commit them with: git add {}", files, target, target);
        return new RegenerationResult(artifact.getName(), target, files, 0);
    }

    @Override
    public List<ArtifactProperties> affectedArtifacts(Iterable<String> paths) {
        List<ArtifactProperties> affected = new ArrayList<>();
        for (ArtifactProperties artifact : props.getArtifacts()) {
            String prefix = normalize(artifact.getTarget()) + "/";
            for (String path : paths) {
                if (path.startsWith(prefix)) {
                    affected.add(artifact);
                    break;
                }
            }
        }
        return affected;
    }

    /**
     * Validate the canonical source, then replace the target directory with a copy of it.
     *
     * @return number of files copied
     */
    private int rebuild(GitRepositoryHandle handle, ArtifactProperties artifact) {
        Path source = resolveSource(handle, artifact);
        List<String> sourceViolations = validator.validate(artifact, source);
        if (!sourceViolations.isEmpty()) {
            log.error("Canonical build output for '{}' at {} is missing or corrupted. Rebuild it first.",
                    artifact.getName(), source);
            throw new RegenerationValidationException(artifact.getName(), sourceViolations);
        }

        Path target = handle.workTree().resolve(normalize(artifact.getTarget()));
        try {
            if (Files.exists(target)) {
                FileSystemUtils.deleteRecursively(target);
            }
            Files.createDirectories(target);
            FileSystemUtils.copyRecursively(source, target);
        } catch (IOException e) {
            throw new ForkSyncException("Failed to copy " + source + " to " + target, e);
        }
        return ArtifactValidator.listFiles(target).size();
    }

    /**
     * Stage the rebuilt directory: drop index entries for files that no longer exist,
     * then add everything present. Conflict stages under the target are cleared either way.
     */
    private static int stage(GitRepositoryHandle handle, String target) {
        Set<String> before = handle.indexPathsUnder(target);
        int removed = 0;
        for (String path : before) {
            if (!Files.exists(handle.workTree().resolve(path))) {
                handle.remove(path, true);
                removed++;
            }
        }
        handle.stage(target);
        Set<String> after = handle.indexPathsUnder(target);
        int added = (int) after.stream().filter(p -> !before.contains(p)).count();
        return removed + added;
    }

    private static Path resolveSource(GitRepositoryHandle handle, ArtifactProperties artifact) {
        Path source = Path.of(artifact.getSource());
        return source.isAbsolute() ? source : handle.workTree().resolve(source);
    }

    private static String normalize(String target) {
        String result = target.replace('\\', '/');
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
