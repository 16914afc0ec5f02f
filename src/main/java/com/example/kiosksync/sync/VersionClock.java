package com.example.kiosksync.sync;

import java.time.Clock;
import java.time.Instant;

/**
 * Issues version stamps: wall-clock millis, bumped past the previous stamp so a record's
 * versions are strictly increasing even when the clock stalls or steps back.
 */
public class VersionClock {

    private final Clock clock;

    public VersionClock(Clock clock) {
        this.clock = clock;
    }

    public long next(long previous) {
        return Math.max(clock.millis(), previous + 1);
    }

    public long millis() {
        return clock.millis();
    }

    public Instant now() {
        return clock.instant();
    }
}
