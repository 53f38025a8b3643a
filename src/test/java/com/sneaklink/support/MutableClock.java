package com.sneaklink.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 測試用可撥動時鐘（UTC）
 */
public class MutableClock extends Clock {

    private volatile Instant instant;

    public MutableClock(LocalDateTime start) {
        this.instant = start.toInstant(ZoneOffset.UTC);
    }

    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    public void set(LocalDateTime time) {
        instant = time.toInstant(ZoneOffset.UTC);
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
        return this;
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
