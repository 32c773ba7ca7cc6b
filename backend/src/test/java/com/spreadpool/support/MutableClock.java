package com.spreadpool.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that only moves when told to. A thread may pin its own instant, which lets
 * concurrent callers observe different times.
 */
public class MutableClock extends Clock {
    private final ThreadLocal<Instant> pinned = new ThreadLocal<>();
    private volatile Instant now;

    public MutableClock(Instant start) {
        this.now = start;
    }

    public void set(Instant instant) {
        this.now = instant;
    }

    public void advance(Duration d) {
        this.now = now.plus(d);
    }

    public void pinForCurrentThread(Instant instant) {
        pinned.set(instant);
    }

    public void unpinCurrentThread() {
        pinned.remove();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        Instant own = pinned.get();
        return own != null ? own : now;
    }
}
