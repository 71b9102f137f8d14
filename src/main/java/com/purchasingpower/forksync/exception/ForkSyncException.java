package com.purchasingpower.forksync.exception;

import lombok.Getter;

/**
 * Base of every failure the sync engine reports. Carries the process exit code
 * the CLI returns when the failure ends a run.
 */
@Getter
public class ForkSyncException extends RuntimeException {

    public static final int GENERIC_EXIT_CODE = 7;

    private final int exitCode;

    public ForkSyncException(String message) {
        this(message, GENERIC_EXIT_CODE, null);
    }

    public ForkSyncException(String message, Throwable cause) {
        this(message, GENERIC_EXIT_CODE, cause);
    }

    protected ForkSyncException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }
}
