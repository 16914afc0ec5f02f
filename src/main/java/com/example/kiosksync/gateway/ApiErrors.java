package com.example.kiosksync.gateway;

/**
 * Values of the {@code error} field in backend error bodies.
 */
public final class ApiErrors {

    public static final String NOT_FOUND = "not_found";
    public static final String VERSION_CONFLICT = "version_conflict";
    public static final String DUPLICATE = "duplicate";
    public static final String RESERVED_ID = "reserved_id";
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String NO_ACTIVE_SESSION = "no_active_session";
    public static final String SESSION_ACTIVE = "session_active";
    public static final String UNAVAILABLE = "unavailable";
    public static final String INTERNAL = "internal_error";

    private ApiErrors() {
    }
}
