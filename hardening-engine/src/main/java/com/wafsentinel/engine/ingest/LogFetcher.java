package com.wafsentinel.engine.ingest;

import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.BucketGranularity;
import com.wafsentinel.engine.record.TimeBucket;
import com.wafsentinel.engine.store.AuditLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owner of the ingestion cursor.
 *
 * <p>
 * {@link #fetch(FetchWindow)} starts a {@link RecordSequence} just after the
 * persisted cursor. Only sealed buckets are read: a bucket is sealed once its
 * end plus the settle delay has passed, so no record can still arrive behind
 * the cursor's id.
 * </p>
 *
 * <p>
 * The cursor only moves through {@link #advance(AuditRecord)} and
 * {@link #completeBucket(TimeBucket)}, which the orchestrator calls after the
 * corresponding classification is durably written. Both are serialized.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class LogFetcher {

    private static final Logger log = LoggerFactory.getLogger(LogFetcher.class);

    private final AuditLogStore store;
    private final CursorRepository cursorRepository;
    private final BucketGranularity granularity;
    private final Duration settleDelay;
    private final Clock clock;

    private final Object cursorLock = new Object();
    private CursorState cursor;
    private boolean cursorLoaded;

    public LogFetcher(AuditLogStore store, CursorRepository cursorRepository, BucketGranularity granularity,
            Duration settleDelay, Clock clock) {
        this.store = store;
        this.cursorRepository = cursorRepository;
        this.granularity = granularity;
        this.settleDelay = settleDelay;
        this.clock = clock;
    }

    /**
     * Start a sequence over every sealed bucket from the cursor (or, before the
     * first commit, from the window start) up to the window end.
     */
    public RecordSequence fetch(FetchWindow window) {
        Optional<CursorState> current = Optional.ofNullable(cursor());

        TimeBucket first;
        String afterId = null;
        if (current.isPresent()) {
            first = TimeBucket.parse(current.get().bucket(), granularity);
            afterId = current.get().lastId();
        } else {
            first = TimeBucket.of(window.from(), granularity);
        }

        Instant now = clock.instant();
        List<TimeBucket> buckets = new ArrayList<>();
        for (TimeBucket bucket = first; isSealed(bucket, now) && bucket.start().isBefore(window.to());
                bucket = bucket.next()) {
            buckets.add(bucket);
        }

        if (buckets.isEmpty()) {
            log.debug("No sealed bucket to read from {} (settle delay {})", first, settleDelay);
        } else {
            log.info("Fetching {} bucket(s) {}..{} after id {}",
                    buckets.size(), buckets.get(0), buckets.get(buckets.size() - 1), afterId);
        }
        return new RecordSequence(store, buckets, afterId);
    }

    /**
     * Move the cursor past a committed record.
     *
     * @throws IllegalStateException if the record is not beyond the current cursor
     */
    public void advance(AuditRecord record) {
        synchronized (cursorLock) {
            CursorState current = cursor();
            if (current != null) {
                TimeBucket cursorBucket = TimeBucket.parse(current.bucket(), granularity);
                int byBucket = record.bucket().compareTo(cursorBucket);
                if (byBucket < 0 || (byBucket == 0 && current.lastId() != null
                        && record.id().compareTo(current.lastId()) <= 0)) {
                    throw new IllegalStateException("Cursor regression: " + record.bucket() + "/" + record.id()
                            + " is not after " + current.bucket() + "/" + current.lastId());
                }
            }
            persist(new CursorState(record.bucket().label(), record.id(), clock.instant()));
        }
    }

    /** Mark a bucket fully processed; the cursor moves to the start of the next one. */
    public void completeBucket(TimeBucket bucket) {
        synchronized (cursorLock) {
            CursorState current = cursor();
            if (current != null && TimeBucket.parse(current.bucket(), granularity).compareTo(bucket) > 0) {
                return;
            }
            persist(new CursorState(bucket.next().label(), null, clock.instant()));
            log.info("Bucket {} complete, cursor moved to {}", bucket, bucket.next());
        }
    }

    /** Current cursor, {@code null} before the first commit. */
    public CursorState cursor() {
        synchronized (cursorLock) {
            if (!cursorLoaded) {
                cursor = cursorRepository.load().orElse(null);
                cursorLoaded = true;
            }
            return cursor;
        }
    }

    /** Forget the in-memory cursor so the next access re-reads the persisted one. */
    public void reload() {
        synchronized (cursorLock) {
            cursorLoaded = false;
            cursor = null;
        }
    }

    private boolean isSealed(TimeBucket bucket, Instant now) {
        return !bucket.end().plus(settleDelay).isAfter(now);
    }

    private void persist(CursorState next) {
        cursorRepository.save(next);
        cursor = next;
    }
}
