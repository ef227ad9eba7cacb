package com.wafsentinel.engine.feature;

import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.TriggeredRule;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Turns an {@link AuditRecord} into a {@link FeatureSchema#V1} vector.
 *
 * <p>
 * Extraction is a total, side-effect-free function of the record: malformed or
 * missing fields map to sentinels (zero counts, empty text, the {@code other}
 * category) and nothing depends on other records, so the same record always
 * yields the same vector.
 * </p>
 *
 * <p>
 * Text-derived features only look at the first {@value #MAX_TEXT_CHARS}
 * characters of each field, which bounds regex and hashing cost on oversized
 * payloads.
 * </p>
 *
 * @author WAF Sentinel Team
 */
@Component
public class FeatureExtractor {

    static final int MAX_TEXT_CHARS = 8192;

    private final FeatureSchema schema = FeatureSchema.V1;

    public FeatureSchema schema() {
        return schema;
    }

    public String schemaVersion() {
        return schema.version();
    }

    /**
     * Extract the feature vector of a record.
     *
     * @param record the record, attacker-controlled content included
     * @return the vector, never {@code null}
     */
    public FeatureVector extract(AuditRecord record) {
        double[] v = new double[schema.size()];
        Slots slots = new Slots(v);

        String uri = nullToEmpty(record.uri());
        String body = nullToEmpty(record.body());
        String uriText = truncate(uri);
        String bodyText = truncate(body);

        slots.set("uri_length", uri.length());
        slots.set("uri_special_char_ratio", TextStatistics.specialCharRatio(uriText));
        slots.set("uri_entropy", TextStatistics.entropy(uriText));
        slots.set("uri_query_param_count", queryParamCount(uriText));
        slots.set("uri_path_depth", pathDepth(uriText));
        slots.set("body_length", body.length());
        slots.set("body_special_char_ratio", TextStatistics.specialCharRatio(bodyText));
        slots.set("body_entropy", TextStatistics.entropy(bodyText));
        slots.set("header_count", record.headers().size());
        slots.set("content_length_log", Math.log1p(record.contentLength() == null ? 0L : Math.max(0L, record.contentLength())));

        UserAgentProfile ua = UserAgentProfile.of(record.userAgent());
        slots.set("ua_length", ua.length());
        slots.set("ua_word_count", ua.wordCount());
        slots.set("ua_is_mobile", ua.mobile() ? 1 : 0);
        slots.set("ua_is_bot", ua.bot() ? 1 : 0);
        slots.set("ua_browser_version", ua.browserVersion());
        slots.set("browser_" + ua.browser(), 1);
        slots.set("os_" + ua.operatingSystem(), 1);

        slots.set("http_method_" + method(record.method()), 1);

        String payload = decode(uriText) + " " + decode(bodyText);
        for (SecurityPattern pattern : SecurityPattern.values()) {
            slots.set(pattern.featureName(), pattern.count(payload));
        }

        int maxRuleScore = 0;
        for (TriggeredRule rule : record.triggeredRules()) {
            if (rule.paranoiaLevel() >= 1 && rule.paranoiaLevel() <= 4) {
                slots.add("rules_pl" + rule.paranoiaLevel(), 1);
            }
            maxRuleScore = Math.max(maxRuleScore, rule.anomalyScore());
        }
        slots.set("rules_total", record.triggeredRules().size());
        slots.set("rule_max_anomaly_score", maxRuleScore);
        slots.set("anomaly_score_total", record.anomalyScore() == null ? 0 : record.anomalyScore());

        slots.copy("path_hash_0", TextStatistics.hashedNgrams(TextStatistics.normalize(uriText), FeatureSchema.HASH_BUCKETS));
        slots.copy("body_hash_0", TextStatistics.hashedNgrams(TextStatistics.normalize(bodyText), FeatureSchema.HASH_BUCKETS));

        return new FeatureVector(schema, v);
    }

    static String method(String method) {
        if (method == null) {
            return "OTHER";
        }
        String upper = method.trim().toUpperCase(Locale.ROOT);
        return FeatureSchema.METHODS.contains(upper) ? upper : "OTHER";
    }

    static int queryParamCount(String uri) {
        int query = uri.indexOf('?');
        if (query < 0 || query == uri.length() - 1) {
            return 0;
        }
        int count = 0;
        for (String pair : uri.substring(query + 1).split("&")) {
            if (!pair.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    static int pathDepth(String uri) {
        int query = uri.indexOf('?');
        String path = query >= 0 ? uri.substring(0, query) : uri;
        int depth = 0;
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                depth++;
            }
        }
        return depth;
    }

    /** Percent-decode, keeping the raw text when the encoding is malformed. */
    static String decode(String text) {
        try {
            return URLDecoder.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return text;
        }
    }

    private static String truncate(String text) {
        return text.length() > MAX_TEXT_CHARS ? text.substring(0, MAX_TEXT_CHARS) : text;
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }

    /** Name-addressed writes into the backing array. */
    private final class Slots {
        private final double[] values;

        Slots(double[] values) {
            this.values = values;
        }

        void set(String name, double value) {
            values[slot(name)] = value;
        }

        void add(String name, double value) {
            values[slot(name)] += value;
        }

        void copy(String firstName, double[] source) {
            System.arraycopy(source, 0, values, slot(firstName), source.length);
        }

        private int slot(String name) {
            return schema.slotOf(name).orElseThrow(() -> new IllegalStateException("Feature not in schema: " + name));
        }
    }
}
