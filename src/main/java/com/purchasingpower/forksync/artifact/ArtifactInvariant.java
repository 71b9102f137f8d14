package com.purchasingpower.forksync.artifact;

import java.nio.file.Path;
import java.util.List;

/**
 * A structural check a generated directory must pass before it may be staged.
 */
public interface ArtifactInvariant {

    String name();

    /**
     * @param root  artifact root directory
     * @param files every regular file under {@code root}, as paths relative to it
     * @return human-readable violations, empty when the directory is valid
     */
    List<String> check(Path root, List<Path> files);
}
