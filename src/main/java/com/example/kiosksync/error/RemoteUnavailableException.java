package com.example.kiosksync.error;

/**
 * The backend could not be reached or failed while serving the call. Local state is untouched.
 */
public class RemoteUnavailableException extends SyncException {

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public RemoteUnavailableException(String message) {
        super(message);
    }
}
