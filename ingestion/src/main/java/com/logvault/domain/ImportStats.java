package com.logvault.domain;

import java.time.Duration;
import java.time.Instant;

public record ImportStats(
        long totalLines,
        long imported,
        long duplicates,
        long emptyLines,
        Instant startTime,
        Instant endTime,
        boolean cancelled) {

    public Duration duration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    public double recordsPerSecond() {
        double seconds = duration().toNanos() / 1_000_000_000.0;
        return seconds > 0 ? imported / seconds : 0;
    }
}
