package com.example.kiosksync.sync;

import com.example.kiosksync.support.TestClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class VersionClockTest {

    @Test
    void testNext_FollowsWallClock() {
        TestClock clock = new TestClock(Instant.ofEpochMilli(1_000L));
        VersionClock versions = new VersionClock(clock);

        assertEquals(1_000L, versions.next(0L));
        clock.advance(Duration.ofMillis(500));
        assertEquals(1_500L, versions.next(1_000L));
    }

    @Test
    void testNext_StrictlyIncreasingWhenClockStalls() {
        VersionClock versions = new VersionClock(new TestClock(Instant.ofEpochMilli(1_000L)));

        long first = versions.next(0L);
        long second = versions.next(first);
        long third = versions.next(5_000L);

        assertEquals(1_001L, second);
        assertEquals(5_001L, third);
    }
}
