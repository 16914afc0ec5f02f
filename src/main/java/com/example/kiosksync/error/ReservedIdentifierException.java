package com.example.kiosksync.error;

/**
 * The name of a new entity produced an id that can never be stored, either because it is
 * empty or because it collides with a reserved route token such as {@code new}.
 */
public class ReservedIdentifierException extends SyncException {

    private final String name;
    private final String id;

    public ReservedIdentifierException(String name, String id) {
        super("Name '" + name + "' produces reserved id '" + id + "'");
        this.name = name;
        this.id = id;
    }

    public String getName() { return name; }
    public String getId() { return id; }
}
