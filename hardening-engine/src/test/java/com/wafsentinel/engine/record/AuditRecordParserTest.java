package com.wafsentinel.engine.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditRecordParserTest {

    private static final TimeBucket BUCKET = TimeBucket.parse("2025.06.19.04", BucketGranularity.HOURLY);

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldParseCompleteDocument() throws Exception {
        JsonNode source = mapper.readTree("""
                {
                  "transaction_id": "aZ9kQ1",
                  "@timestamp": "2025-06-19T04:12:30.500Z",
                  "client_ip": "203.0.113.7",
                  "http_method": "POST",
                  "request_path": "/login.php?user=admin",
                  "request_body": "password=' OR 1=1 --",
                  "user_agent": "sqlmap/1.7",
                  "content_length": "Content-Length: 21",
                  "headers": {"Host": "shop.example", "Accept": "*/*"},
                  "rules": [
                    {"rule_id": "942100", "paranoia_level": 1, "severity": "CRITICAL", "anomaly_score": 5},
                    {"rule_id": 942421, "paranoia_level": "3", "severity": "WARNING", "anomaly_score": 3}
                  ],
                  "anomaly_score": 15
                }
                """);

        AuditRecord record = AuditRecordParser.parse(BUCKET, "doc-1", source);

        assertEquals("aZ9kQ1", record.id());
        assertEquals(Instant.parse("2025-06-19T04:12:30.500Z"), record.timestamp());
        assertEquals("203.0.113.7", record.clientAddress());
        assertEquals("POST", record.method());
        assertEquals("/login.php?user=admin", record.uri());
        assertEquals(21L, record.contentLength());
        assertEquals("shop.example", record.headers().get("host"));
        assertEquals(List.of(
                new TriggeredRule("942100", 1, "critical", 5),
                new TriggeredRule("942421", 3, "warning", 3)), record.triggeredRules());
        assertEquals(15, record.anomalyScore());
        assertEquals("aZ9kQ1", record.source().path("transaction_id").asText());
    }

    @Test
    void shouldDegradeMalformedFieldsToAbsence() throws Exception {
        JsonNode source = mapper.readTree("""
                {
                  "@timestamp": "yesterday",
                  "http_method": {"nested": true},
                  "content_length": "lots",
                  "headers": "not-a-map",
                  "rules": [null, {"paranoia_level": 4}, "930100"],
                  "anomaly_score": "high"
                }
                """);

        AuditRecord record = AuditRecordParser.parse(BUCKET, "doc-2", source);

        assertEquals("doc-2", record.id());
        assertNull(record.timestamp());
        assertNull(record.method());
        assertNull(record.contentLength());
        assertTrue(record.headers().isEmpty());
        assertEquals(List.of(new TriggeredRule("930100", 0, "", 0)), record.triggeredRules());
        assertNull(record.anomalyScore());
        assertEquals(BUCKET.start(), record.effectiveTimestamp());
    }

    @Test
    void shouldReadHeaderListAndUserAgentFallback() throws Exception {
        JsonNode source = mapper.readTree("""
                {
                  "transaction_id": "t-3",
                  "timestamp": 1750306350000,
                  "headers": [{"name": "User-Agent", "value": "curl/8.5.0"}, {"name": "X-Empty"}]
                }
                """);

        AuditRecord record = AuditRecordParser.parse(BUCKET, "doc-3", source);

        assertEquals(Instant.ofEpochMilli(1750306350000L), record.timestamp());
        assertEquals(1, record.headers().size());
        assertEquals("curl/8.5.0", record.userAgent());
    }
}
