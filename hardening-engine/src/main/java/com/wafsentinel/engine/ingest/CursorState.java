package com.wafsentinel.engine.ingest;

import java.time.Instant;

/**
 * Ingestion high-water mark.
 *
 * @param bucket    label of the bucket being processed
 * @param lastId    id of the last committed record in that bucket, {@code null}
 *                  when nothing in the bucket has been committed yet
 * @param updatedAt when the cursor last moved
 *
 * @author WAF Sentinel Team
 */
public record CursorState(String bucket, String lastId, Instant updatedAt) {
}
