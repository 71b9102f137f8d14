package com.purchasingpower.forksync.exception;

/**
 * Another sync run holds the repository lock.
 */
public class BusyException extends ForkSyncException {

    public static final int EXIT_CODE = 6;

    public BusyException(String message) {
        super(message, EXIT_CODE, null);
    }
}
