package com.wafsentinel.engine.record;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Partitioning interval of the time-bucketed indices.
 *
 * <p>
 * The inspection layer writes {@code unclassified_yyyy.MM.dd.HH} indices by
 * default; daily partitioning drops the hour suffix.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public enum BucketGranularity {

    HOURLY("yyyy.MM.dd.HH", ChronoUnit.HOURS),
    DAILY("yyyy.MM.dd", ChronoUnit.DAYS);

    private final String pattern;
    private final ChronoUnit unit;

    BucketGranularity(String pattern, ChronoUnit unit) {
        this.pattern = pattern;
        this.unit = unit;
    }

    public String getPattern() {
        return pattern;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    public Duration getLength() {
        return unit.getDuration();
    }

    DateTimeFormatter formatter() {
        return DateTimeFormatter.ofPattern(pattern);
    }
}
