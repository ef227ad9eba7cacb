package com.wafsentinel.engine.ingest;

import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.TimeBucket;

import java.util.List;

/**
 * Records of one page, all from the same bucket, in ascending id order.
 *
 * @param bucket          bucket the page was read from, {@code null} at end of sequence
 * @param records         page content
 * @param bucketExhausted the bucket has no records beyond this page
 *
 * @author WAF Sentinel Team
 */
public record FetchBatch(TimeBucket bucket, List<AuditRecord> records, boolean bucketExhausted) {

    public FetchBatch {
        records = List.copyOf(records);
    }

    static FetchBatch end() {
        return new FetchBatch(null, List.of(), false);
    }

    public boolean isEnd() {
        return bucket == null;
    }
}
