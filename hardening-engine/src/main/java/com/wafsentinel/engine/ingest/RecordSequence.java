package com.wafsentinel.engine.ingest;

import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.TimeBucket;
import com.wafsentinel.engine.store.AuditLogStore;

import java.util.List;

/**
 * Lazy, paged walk over a fixed list of buckets.
 *
 * <p>
 * The read position only moves after a page was fetched successfully, so a
 * {@link #nextBatch(int)} call that failed with a transient error can simply
 * be repeated. The sequence is not thread-safe; one run owns it.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class RecordSequence {

    private final AuditLogStore store;
    private final List<TimeBucket> buckets;

    private int bucketIndex;
    private String afterId;

    RecordSequence(AuditLogStore store, List<TimeBucket> buckets, String initialAfterId) {
        this.store = store;
        this.buckets = List.copyOf(buckets);
        this.afterId = initialAfterId;
    }

    /**
     * Fetch the next page.
     *
     * @param max maximum number of records
     * @return the page, or {@link FetchBatch#isEnd() end} when every bucket is drained
     */
    public FetchBatch nextBatch(int max) {
        if (isExhausted()) {
            return FetchBatch.end();
        }
        TimeBucket bucket = buckets.get(bucketIndex);
        List<AuditRecord> page = store.search(bucket, afterId, max);

        boolean exhausted = page.size() < max;
        if (exhausted) {
            bucketIndex++;
            afterId = null;
        } else {
            afterId = page.get(page.size() - 1).id();
        }
        return new FetchBatch(bucket, page, exhausted);
    }

    public boolean isExhausted() {
        return bucketIndex >= buckets.size();
    }

    /** Buckets this sequence walks, oldest first. */
    public List<TimeBucket> buckets() {
        return buckets;
    }
}
