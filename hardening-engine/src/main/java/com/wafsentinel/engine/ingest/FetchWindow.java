package com.wafsentinel.engine.ingest;

import java.time.Instant;

/**
 * Time range a classification run may read.
 *
 * @param from lower bound used when no cursor exists yet (initial backfill)
 * @param to   upper bound; buckets starting at or after it are not read
 *
 * @author WAF Sentinel Team
 */
public record FetchWindow(Instant from, Instant to) {

    public FetchWindow {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window end " + to + " is before start " + from);
        }
    }
}
