package com.wafsentinel.engine.record;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a raw audit document onto an {@link AuditRecord}.
 *
 * <p>
 * Parsing is total: unknown shapes, wrong types and missing fields degrade to
 * absent values instead of throwing. Recognised source fields:
 * </p>
 * <ul>
 * <li>{@code transaction_id}, {@code @timestamp} / {@code timestamp}</li>
 * <li>{@code client_ip} / {@code source_ip}</li>
 * <li>{@code http_method}, {@code request_path} / {@code uri},
 * {@code request_body}, {@code user_agent}, {@code content_length}</li>
 * <li>{@code headers} as an object or as a list of {@code name}/{@code value}
 * pairs</li>
 * <li>{@code rules}: list of {@code rule_id}, {@code paranoia_level},
 * {@code severity}, {@code anomaly_score}</li>
 * <li>{@code anomaly_score}</li>
 * </ul>
 *
 * @author WAF Sentinel Team
 */
public final class AuditRecordParser {

    private static final Logger log = LoggerFactory.getLogger(AuditRecordParser.class);

    public static final String ID_FIELD = "transaction_id";

    private AuditRecordParser() {
    }

    /**
     * Parse a source document.
     *
     * @param bucket     bucket the document was read from
     * @param documentId store document id, used when the source has no transaction id
     * @param source     the {@code _source} object
     * @return the parsed record, never {@code null}
     */
    public static AuditRecord parse(TimeBucket bucket, String documentId, JsonNode source) {
        String id = text(source, ID_FIELD);
        if (id == null || id.isBlank()) {
            id = documentId;
        }

        Map<String, String> headers = headers(source.path("headers"));
        String userAgent = text(source, "user_agent");
        if (userAgent == null) {
            userAgent = headers.get("user-agent");
        }

        return new AuditRecord(
                bucket,
                id,
                timestamp(source),
                firstText(source, "client_ip", "source_ip"),
                text(source, "http_method"),
                firstText(source, "request_path", "uri"),
                headers,
                text(source, "request_body"),
                userAgent,
                contentLength(source.path("content_length")),
                rules(source.path("rules")),
                integer(source.path("anomaly_score")),
                source);
    }

    static Instant timestamp(JsonNode source) {
        for (String field : new String[] { "@timestamp", "timestamp" }) {
            JsonNode node = source.path(field);
            if (node.isNumber()) {
                return Instant.ofEpochMilli(node.asLong());
            }
            if (node.isTextual()) {
                try {
                    return OffsetDateTime.parse(node.asText()).toInstant();
                } catch (DateTimeParseException e) {
                    try {
                        return Instant.parse(node.asText());
                    } catch (DateTimeParseException ignored) {
                        log.debug("Unparsable {} value: {}", field, node.asText());
                    }
                }
            }
        }
        return null;
    }

    /**
     * Content length as a number or as a raw {@code Content-Length: n} header
     * line, as found in CSIC-style captures.
     */
    static Long contentLength(JsonNode node) {
        if (node.isNumber()) {
            return Math.max(0L, node.asLong());
        }
        if (!node.isTextual()) {
            return null;
        }
        String value = node.asText().trim();
        int colon = value.toLowerCase(Locale.ROOT).indexOf("content-length:");
        if (colon >= 0) {
            value = value.substring(colon + "content-length:".length()).trim();
        }
        try {
            return Math.max(0L, Long.parseLong(value));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<TriggeredRule> rules(JsonNode node) {
        List<TriggeredRule> rules = new ArrayList<>();
        if (!node.isArray()) {
            return rules;
        }
        for (JsonNode rule : node) {
            String ruleId = rule.isObject() ? text(rule, "rule_id") : (rule.isValueNode() && !rule.isNull() ? rule.asText() : null);
            if (ruleId == null || ruleId.isBlank()) {
                continue;
            }
            Integer paranoia = integer(rule.path("paranoia_level"));
            Integer score = integer(rule.path("anomaly_score"));
            String severity = text(rule, "severity");
            rules.add(new TriggeredRule(
                    ruleId.trim(),
                    paranoia == null ? 0 : paranoia,
                    severity == null ? "" : severity.toLowerCase(Locale.ROOT),
                    score == null ? 0 : score));
        }
        return rules;
    }

    private static Map<String, String> headers(JsonNode node) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                    headers.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue().asText());
                }
            }
        } else if (node.isArray()) {
            for (JsonNode header : node) {
                String name = text(header, "name");
                String value = text(header, "value");
                if (name != null && value != null) {
                    headers.put(name.toLowerCase(Locale.ROOT), value);
                }
            }
        }
        return headers;
    }

    private static Integer integer(JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String firstText(JsonNode source, String... fields) {
        for (String field : fields) {
            String value = text(source, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode source, String field) {
        JsonNode node = source.path(field);
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
