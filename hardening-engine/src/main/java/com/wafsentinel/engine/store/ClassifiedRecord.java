package com.wafsentinel.engine.store;

import com.wafsentinel.engine.classifier.ClassificationResult;
import com.wafsentinel.engine.record.AuditRecord;

/**
 * A classified document: the source record joined with its verdict.
 *
 * @author WAF Sentinel Team
 */
public record ClassifiedRecord(AuditRecord record, ClassificationResult result) {

    public String documentId() {
        return result.idempotenceKey();
    }
}
