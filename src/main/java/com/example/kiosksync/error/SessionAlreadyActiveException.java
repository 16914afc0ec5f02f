package com.example.kiosksync.error;

/**
 * A chat session was started while another one is still active. The active one is left as is;
 * callers end it (or use {@code switchTo}) before starting the next.
 */
public class SessionAlreadyActiveException extends SyncException {

    private final String activeSessionId;

    public SessionAlreadyActiveException(String activeSessionId) {
        super("Chat session " + activeSessionId + " is still active");
        this.activeSessionId = activeSessionId;
    }

    public String getActiveSessionId() { return activeSessionId; }
}
