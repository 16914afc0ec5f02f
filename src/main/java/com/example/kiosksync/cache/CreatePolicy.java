package com.example.kiosksync.cache;

/**
 * How {@link LocalCache#add} treats a backend that cannot be reached.
 */
public enum CreatePolicy {
    /** Keep the dirty local copy and return normally; the next save pushes it. */
    LOCAL_FIRST,
    /** Keep the dirty local copy but surface the failure, like save does. */
    REMOTE_CONFIRMED
}
