package com.example.kiosksync.error;

public class NoActiveSessionException extends SyncException {

    public NoActiveSessionException() {
        super("No active chat session");
    }
}
