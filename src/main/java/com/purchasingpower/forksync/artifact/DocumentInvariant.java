package com.purchasingpower.forksync.artifact;

import com.purchasingpower.forksync.exception.ForkSyncException;
import org.springframework.util.AntPathMatcher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for checks applied to each document (file matching a glob) of a generated directory.
 */
public abstract class DocumentInvariant implements ArtifactInvariant {

    private final String documentGlob;
    private final AntPathMatcher matcher = new AntPathMatcher();

    protected DocumentInvariant(String documentGlob) {
        this.documentGlob = documentGlob;
    }

    @Override
    public List<String> check(Path root, List<Path> files) {
        List<String> violations = new ArrayList<>();
        for (Path relative : files) {
            String unixPath = relative.toString().replace('\\', '/');
            if (!matcher.match(documentGlob, unixPath)) {
                continue;
            }
            String content = read(root.resolve(relative));
            checkDocument(unixPath, content).ifPresent(violations::add);
        }
        return violations;
    }

    protected abstract Optional<String> checkDocument(String path, String content);

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ForkSyncException("Cannot read generated document " + file, e);
        }
    }
}
