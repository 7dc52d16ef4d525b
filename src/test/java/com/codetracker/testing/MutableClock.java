package com.codetracker.testing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * UTC clock that only moves when told to.
 */
public final class MutableClock extends Clock {

    private volatile Instant instant;

    private MutableClock(Instant instant) {
        this.instant = instant;
    }

    public static MutableClock at(LocalDateTime dateTime) {
        return new MutableClock(dateTime.toInstant(ZoneOffset.UTC));
    }

    public void set(LocalDateTime dateTime) {
        this.instant = dateTime.toInstant(ZoneOffset.UTC);
    }

    public void advance(Duration duration) {
        this.instant = instant.plus(duration);
    }

    public LocalDateTime now() {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("fixed to UTC");
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
