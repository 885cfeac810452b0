package com.broadcaster.persistence;

/**
 * Storage failure. Unchecked: pollers log it through the persistence queue,
 * and at start-up it aborts the boot.
 */
public class HistoryStoreException extends RuntimeException {

    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
