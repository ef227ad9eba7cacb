package com.wafsentinel.engine.trend;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open interval {@code [from, to)} of record timestamps.
 *
 * @author WAF Sentinel Team
 */
public record AggregationWindow(Instant from, Instant to) {

    public AggregationWindow {
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Empty aggregation window " + from + ".." + to);
        }
    }

    /** The lookback window ending at {@code now}. */
    public static AggregationWindow lookback(Instant now, Duration lookback) {
        return new AggregationWindow(now.minus(lookback), now);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(to);
    }
}
