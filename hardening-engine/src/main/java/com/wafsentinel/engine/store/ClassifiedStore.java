package com.wafsentinel.engine.store;

import com.wafsentinel.engine.record.TimeBucket;

/**
 * Upsert and scan access to the classified, time-bucketed indices.
 *
 * @author WAF Sentinel Team
 */
public interface ClassifiedStore {

    /**
     * Create a document unless one with the same id already exists in the bucket.
     *
     * @throws TransientIOException  if the store cannot be reached
     * @throws StoreRequestException if the store rejects the document
     */
    WriteOutcome createIfAbsent(TimeBucket bucket, ClassifiedRecord document);

    /**
     * Read one page of a classified bucket in ascending document id order.
     *
     * @param afterKey exclusive lower bound, {@code null} for the first page
     * @throws TransientIOException if the store cannot be reached
     */
    ClassifiedPage scan(TimeBucket bucket, String afterKey, int size);
}
