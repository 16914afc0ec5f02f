package com.example.kiosksync.error;

public class DuplicateEntityException extends SyncException {

    private final String id;

    public DuplicateEntityException(String kind, String id) {
        super(kind + " '" + id + "' already exists");
        this.id = id;
    }

    public String getId() { return id; }
}
