package com.example.kiosksync.error;

/**
 * Base class for every failure the sync engine and the chat lifecycle surface to callers.
 */
public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
