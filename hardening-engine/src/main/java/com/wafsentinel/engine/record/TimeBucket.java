package com.wafsentinel.engine.record;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One partition of a time-bucketed store, identified by its UTC start instant.
 *
 * <p>
 * Buckets order chronologically and render as the index suffix used by the
 * inspection layer, e.g. {@code 2025.06.19.04}.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public record TimeBucket(Instant start, BucketGranularity granularity) implements Comparable<TimeBucket> {

    public TimeBucket {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(granularity, "granularity");
        start = start.truncatedTo(granularity.getUnit());
    }

    /** The bucket containing the given instant. */
    public static TimeBucket of(Instant instant, BucketGranularity granularity) {
        return new TimeBucket(instant, granularity);
    }

    /**
     * Parse a bucket label such as {@code 2025.06.19.04}.
     *
     * @throws IllegalArgumentException if the label does not match the granularity pattern
     */
    public static TimeBucket parse(String label, BucketGranularity granularity) {
        try {
            Instant start = switch (granularity) {
                case HOURLY -> LocalDateTime.parse(label, granularity.formatter()).toInstant(ZoneOffset.UTC);
                case DAILY -> LocalDate.parse(label, granularity.formatter()).atStartOfDay().toInstant(ZoneOffset.UTC);
            };
            return new TimeBucket(start, granularity);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + granularity + " bucket label: " + label, e);
        }
    }

    /**
     * All buckets from the one containing {@code from} through the one containing
     * {@code to}, inclusive.
     */
    public static List<TimeBucket> range(Instant from, Instant to, BucketGranularity granularity) {
        List<TimeBucket> buckets = new ArrayList<>();
        if (to.isBefore(from)) {
            return buckets;
        }
        TimeBucket bucket = of(from, granularity);
        TimeBucket last = of(to, granularity);
        while (bucket.compareTo(last) <= 0) {
            buckets.add(bucket);
            bucket = bucket.next();
        }
        return buckets;
    }

    /** Exclusive end of the bucket. */
    public Instant end() {
        return start.plus(granularity.getLength());
    }

    public TimeBucket next() {
        return new TimeBucket(end(), granularity);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end());
    }

    /** Index suffix, e.g. {@code 2025.06.19.04}. */
    public String label() {
        return granularity.formatter().format(start.atZone(ZoneOffset.UTC));
    }

    /** Full index name for the given prefix, e.g. {@code unclassified_2025.06.19.04}. */
    public String indexName(String prefix) {
        return prefix + label();
    }

    @Override
    public int compareTo(TimeBucket other) {
        return start.compareTo(other.start);
    }

    @Override
    public String toString() {
        return label();
    }
}
