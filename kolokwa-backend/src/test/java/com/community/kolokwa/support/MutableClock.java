package com.community.kolokwa.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that tests move by hand, for streak days and timestamp checks.
 */
public class MutableClock extends Clock {

    public static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    private volatile Instant instant;
    private final ZoneId zone;

    public MutableClock() {
        this(START, ZoneOffset.UTC);
    }

    public MutableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    public void reset() {
        instant = START;
    }

    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    public void advanceDays(int days) {
        advance(Duration.ofDays(days));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
