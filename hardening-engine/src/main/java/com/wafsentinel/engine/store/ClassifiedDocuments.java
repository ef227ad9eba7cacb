package com.wafsentinel.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wafsentinel.engine.classifier.ClassificationResult;
import com.wafsentinel.engine.classifier.Label;
import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.AuditRecordParser;
import com.wafsentinel.engine.record.BucketGranularity;
import com.wafsentinel.engine.record.TimeBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Document layout of the classified indices.
 *
 * <p>
 * A classified document is the original audit source with the verdict fields
 * added, so dashboards and the trend aggregator see every inspection field next
 * to the label:
 * </p>
 * <ul>
 * <li>{@code target}: 1 malicious, 0 benign</li>
 * <li>{@code label}, {@code confidence}, {@code model_version}</li>
 * <li>{@code record_id}, {@code record_bucket}, {@code classification_key}</li>
 * <li>{@code classification_timestamp}: ISO-8601</li>
 * </ul>
 *
 * @author WAF Sentinel Team
 */
public final class ClassifiedDocuments {

    private static final Logger log = LoggerFactory.getLogger(ClassifiedDocuments.class);

    public static final String KEY_FIELD = "classification_key";

    private ClassifiedDocuments() {
    }

    public static ObjectNode encode(ClassifiedRecord classified) {
        AuditRecord record = classified.record();
        ClassificationResult result = classified.result();

        ObjectNode document = record.source().isObject()
                ? (ObjectNode) record.source().deepCopy()
                : JsonNodeFactory.instance.objectNode();
        document.put("target", result.label().target());
        document.put("label", result.label().name().toLowerCase(Locale.ROOT));
        document.put("confidence", result.confidence());
        document.put("model_version", result.modelVersion());
        document.put("record_id", record.id());
        document.put("record_bucket", record.bucket().label());
        document.put(KEY_FIELD, result.idempotenceKey());
        document.put("classification_timestamp", result.classifiedAt().toString());
        return document;
    }

    /**
     * Rebuild a classified record from a stored document.
     *
     * @param classifiedBucket bucket of the index the document was read from
     * @return the record, or empty when the verdict fields are missing or invalid
     */
    public static Optional<ClassifiedRecord> decode(TimeBucket classifiedBucket, String documentId, JsonNode source) {
        JsonNode recordId = source.path("record_id");
        JsonNode modelVersion = source.path("model_version");
        JsonNode target = source.path("target");
        if (!recordId.isTextual() || !modelVersion.isTextual() || !target.canConvertToInt()) {
            log.warn("Skipping classified document {} without verdict fields", documentId);
            return Optional.empty();
        }

        TimeBucket recordBucket = recordBucket(source.path("record_bucket"), classifiedBucket);
        AuditRecord parsed = AuditRecordParser.parse(recordBucket, recordId.asText(), source);
        AuditRecord record = parsed.id().equals(recordId.asText()) ? parsed : parsed.withId(recordId.asText());

        Instant classifiedAt;
        try {
            classifiedAt = Instant.parse(source.path("classification_timestamp").asText());
        } catch (DateTimeParseException e) {
            classifiedAt = Instant.EPOCH;
        }

        Label label = Label.fromTarget(target.asInt());
        double confidence = source.path("confidence").isNumber()
                ? source.path("confidence").asDouble()
                : label.target();

        ClassificationResult result = new ClassificationResult(
                recordId.asText(), label, confidence, modelVersion.asText(), classifiedAt);
        return Optional.of(new ClassifiedRecord(record, result));
    }

    private static TimeBucket recordBucket(JsonNode label, TimeBucket fallback) {
        if (label.isTextual()) {
            BucketGranularity granularity = fallback.granularity();
            try {
                return TimeBucket.parse(label.asText(), granularity);
            } catch (IllegalArgumentException e) {
                log.debug("Unparsable record_bucket {}, using {}", label.asText(), fallback);
            }
        }
        return fallback;
    }
}
