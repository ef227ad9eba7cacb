package com.wafsentinel.engine.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One HTTP transaction inspected by ModSecurity, as written to an
 * {@code unclassified_*} index.
 *
 * <p>
 * Only {@code bucket} and {@code id} are guaranteed. Every other attribute may
 * be absent: optional scalars are {@code null}, collections are empty. Records
 * are attacker-influenced, so absence is resolved by the feature extractor and
 * never by the parser.
 * </p>
 *
 * @param bucket        partition the record was read from
 * @param id            transaction id, unique within the bucket
 * @param timestamp     inspection time, {@code null} when missing or unparsable
 * @param clientAddress source address
 * @param method        HTTP method as sent
 * @param uri           request path including the query string
 * @param headers       request headers, lower-cased names
 * @param body          request body excerpt
 * @param userAgent     User-Agent header value
 * @param contentLength declared content length, {@code null} when absent
 * @param triggeredRules rules matched by the inspection layer
 * @param anomalyScore  total inbound anomaly score, {@code null} when absent
 * @param source        the raw source document
 *
 * @author WAF Sentinel Team
 */
public record AuditRecord(
        TimeBucket bucket,
        String id,
        Instant timestamp,
        String clientAddress,
        String method,
        String uri,
        Map<String, String> headers,
        String body,
        String userAgent,
        Long contentLength,
        List<TriggeredRule> triggeredRules,
        Integer anomalyScore,
        JsonNode source) {

    public AuditRecord {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        triggeredRules = triggeredRules == null ? List.of() : List.copyOf(triggeredRules);
        source = source == null ? JsonNodeFactory.instance.objectNode() : source.deepCopy();
    }

    /** The same record under another id. */
    public AuditRecord withId(String newId) {
        return new AuditRecord(bucket, newId, timestamp, clientAddress, method, uri, headers, body, userAgent,
                contentLength, triggeredRules, anomalyScore, source);
    }

    /** Distinct ids of the rules this record triggered, in match order. */
    public Set<String> triggeredRuleIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (TriggeredRule rule : triggeredRules) {
            ids.add(rule.ruleId());
        }
        return ids;
    }

    /** Timestamp, falling back to the start of the record's bucket. */
    public Instant effectiveTimestamp() {
        return timestamp != null ? timestamp : bucket.start();
    }
}
