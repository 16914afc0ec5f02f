package com.example.kiosksync.error;

public class NotFoundException extends SyncException {

    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " '" + id + "' not found");
        this.id = id;
    }

    public String getId() { return id; }
}
