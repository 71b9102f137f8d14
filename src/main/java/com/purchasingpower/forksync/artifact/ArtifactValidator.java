package com.purchasingpower.forksync.artifact;

import com.purchasingpower.forksync.configuration.ArtifactProperties;
import com.purchasingpower.forksync.exception.ForkSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs the structural invariants configured for an artifact against a directory.
 */
@Slf4j
@Component
public class ArtifactValidator {

    public List<ArtifactInvariant> invariantsFor(ArtifactProperties artifact) {
        return List.of(
                new FileCountInvariant(artifact.getMinFiles(), artifact.getMaxFiles()),
                new SingleMarkerInvariant(artifact.getDocumentGlob(), artifact.getMarker()),
                new ConflictMarkerInvariant(artifact.getDocumentGlob()));
    }

    /**
     * @return violations prefixed with the invariant name; empty when valid
     */
    public List<String> validate(ArtifactProperties artifact, Path root) {
        if (!Files.isDirectory(root)) {
            return List.of("directory not found: " + root);
        }
        List<Path> files = listFiles(root);
        List<String> violations = new ArrayList<>();
        for (ArtifactInvariant invariant : invariantsFor(artifact)) {
            for (String violation : invariant.check(root, files)) {
                violations.add("[" + invariant.name() + "] " + violation);
            }
        }
        log.debug("Validated {} ({} files): {} violations", root, files.size(), violations.size());
        return violations;
    }

    public static List<Path> listFiles(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(root::relativize)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ForkSyncException("Cannot list " + root, e);
        }
    }
}
