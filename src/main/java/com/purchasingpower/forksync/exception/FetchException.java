package com.purchasingpower.forksync.exception;

/**
 * Upstream remote could not be fetched. Fatal, never retried.
 */
public class FetchException extends ForkSyncException {

    public static final int EXIT_CODE = 3;

    public FetchException(String message, Throwable cause) {
        super(message, EXIT_CODE, cause);
    }
}
