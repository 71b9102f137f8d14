package com.purchasingpower.forksync.exception;

import lombok.Getter;

import java.util.List;

/**
 * A regenerated artifact directory failed its structural checks.
 * Staged changes under the target have been discarded before this is thrown.
 */
@Getter
public class RegenerationValidationException extends ForkSyncException {

    public static final int EXIT_CODE = 5;

    private final String artifact;
    private final List<String> violations;

    public RegenerationValidationException(String artifact, List<String> violations) {
        super("Artifact '" + artifact + "' failed validation: " + String.join("; ", violations),
                EXIT_CODE, null);
        this.artifact = artifact;
        this.violations = List.copyOf(violations);
    }
}
