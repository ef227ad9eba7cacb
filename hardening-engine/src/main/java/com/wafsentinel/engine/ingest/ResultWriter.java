package com.wafsentinel.engine.ingest;

import com.wafsentinel.engine.classifier.ClassificationResult;
import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.store.ClassifiedRecord;
import com.wafsentinel.engine.store.ClassifiedStore;
import com.wafsentinel.engine.store.WriteOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists verdicts into the classified bucket matching the record's own
 * bucket.
 *
 * <p>
 * Writes are create-if-absent on {@code recordId:modelVersion}: a second write
 * of the same record under the same model is a no-op, which makes pipeline
 * retries after a crash between commit and cursor persistence safe.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    private final ClassifiedStore store;

    private final Counter created;
    private final Counter duplicates;

    public ResultWriter(ClassifiedStore store, MeterRegistry meterRegistry) {
        this.store = store;
        this.created = Counter.builder("sentinel.writer.documents")
                .tag("outcome", "created")
                .description("Classified documents written")
                .register(meterRegistry);
        this.duplicates = Counter.builder("sentinel.writer.documents")
                .tag("outcome", "already_present")
                .description("Writes skipped because the classification already existed")
                .register(meterRegistry);
    }

    /**
     * Durably record a classification.
     *
     * @param record the classified source record
     * @param result its verdict
     * @return whether the document was created or already present
     */
    public WriteOutcome write(AuditRecord record, ClassificationResult result) {
        if (!record.id().equals(result.recordId())) {
            throw new IllegalArgumentException(
                    "Result for " + result.recordId() + " cannot be written for record " + record.id());
        }
        WriteOutcome outcome = store.createIfAbsent(record.bucket(), new ClassifiedRecord(record, result));
        if (outcome == WriteOutcome.CREATED) {
            created.increment();
        } else {
            duplicates.increment();
            log.debug("Classification {} already stored", result.idempotenceKey());
        }
        return outcome;
    }
}
