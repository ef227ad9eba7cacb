package com.wafsentinel.engine.classifier;

import java.time.Instant;

/**
 * Persisted verdict for one audit record under one model version.
 *
 * @param recordId     transaction id of the classified record
 * @param label        predicted label
 * @param confidence   probability of the malicious class
 * @param modelVersion version of the model artifact that produced the verdict
 * @param classifiedAt classification time
 *
 * @author WAF Sentinel Team
 */
public record ClassificationResult(
        String recordId,
        Label label,
        double confidence,
        String modelVersion,
        Instant classifiedAt) {

    /** Document id in the classified store; one document per record and model version. */
    public String idempotenceKey() {
        return idempotenceKey(recordId, modelVersion);
    }

    public static String idempotenceKey(String recordId, String modelVersion) {
        return recordId + ":" + modelVersion;
    }

    public boolean isMalicious() {
        return label == Label.MALICIOUS;
    }
}
