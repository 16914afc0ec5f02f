package com.example.kiosksync.error;

public class InvalidRequestException extends SyncException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
