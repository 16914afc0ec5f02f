package com.example.kiosksync.error;

public class ArchiveFailureException extends SyncException {

    public ArchiveFailureException(String sessionId, Throwable cause) {
        super("Failed to archive chat session " + sessionId, cause);
    }
}
