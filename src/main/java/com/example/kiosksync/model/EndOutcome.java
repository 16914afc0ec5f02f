package com.example.kiosksync.model;

public enum EndOutcome {
    /** Written to durable storage and indexed. */
    ARCHIVED,
    /** Had no messages; nothing was written. */
    DISCARDED_EMPTY,
    /** Archive call failed; metadata cached locally and the session parked for manual retry. */
    ARCHIVE_FAILED,
    /** Neither active nor recoverable. */
    NOT_FOUND,
    /** Flush gave up waiting; the archive call keeps running in the background. */
    TIMED_OUT
}
