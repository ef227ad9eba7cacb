package com.wafsentinel.engine.store;

import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.TimeBucket;

import java.util.List;

/**
 * Read access to the unclassified, time-bucketed audit indices.
 *
 * @author WAF Sentinel Team
 */
public interface AuditLogStore {

    /**
     * Read one page of a bucket in ascending id order.
     *
     * @param bucket  bucket to read; a bucket with no index yields an empty page
     * @param afterId exclusive lower bound on the record id, {@code null} to start at the beginning
     * @param size    maximum page size
     * @return records with {@code id > afterId}, ascending
     * @throws TransientIOException if the store cannot be reached
     */
    List<AuditRecord> search(TimeBucket bucket, String afterId, int size);
}
