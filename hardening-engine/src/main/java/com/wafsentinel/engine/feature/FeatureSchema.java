package com.wafsentinel.engine.feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Versioned slot layout of a {@link FeatureVector}.
 *
 * <p>
 * Model artifacts declare the schema version they were trained against and the
 * classifier refuses vectors of any other version. Any change to slot names,
 * order or value domain must bump {@link #version()}.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public final class FeatureSchema {

    public static final String V1_VERSION = "waf-features/1";

    /** Number of feature-hashing buckets per text field. */
    public static final int HASH_BUCKETS = 32;

    static final List<String> BROWSERS = List.of("chrome", "firefox", "safari", "opera", "edge", "ie", "mobile", "other");
    static final List<String> OPERATING_SYSTEMS = List.of("windows", "linux", "mac", "android", "ios", "other");
    static final List<String> METHODS = List.of("GET", "POST", "PUT", "DELETE", "HEAD", "OPTIONS", "PATCH", "OTHER");

    public static final FeatureSchema V1 = new FeatureSchema(V1_VERSION, v1Names());

    private final String version;
    private final List<String> names;
    private final Map<String, Integer> slots;

    FeatureSchema(String version, List<String> names) {
        this.version = version;
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            if (index.put(names.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate feature name: " + names.get(i));
            }
        }
        this.slots = Collections.unmodifiableMap(index);
    }

    public String version() {
        return version;
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public OptionalInt slotOf(String name) {
        Integer slot = slots.get(name);
        return slot == null ? OptionalInt.empty() : OptionalInt.of(slot);
    }

    /** Look up a schema by version; only {@link #V1} is currently supported. */
    public static FeatureSchema forVersion(String version) {
        if (V1_VERSION.equals(version)) {
            return V1;
        }
        throw new IllegalArgumentException("Unsupported feature schema version: " + version);
    }

    private static List<String> v1Names() {
        List<String> names = new ArrayList<>(List.of(
                "uri_length", "uri_special_char_ratio", "uri_entropy", "uri_query_param_count", "uri_path_depth",
                "body_length", "body_special_char_ratio", "body_entropy",
                "header_count", "content_length_log",
                "ua_length", "ua_word_count", "ua_is_mobile", "ua_is_bot", "ua_browser_version"));
        BROWSERS.forEach(b -> names.add("browser_" + b));
        OPERATING_SYSTEMS.forEach(os -> names.add("os_" + os));
        METHODS.forEach(m -> names.add("http_method_" + m));
        for (SecurityPattern pattern : SecurityPattern.values()) {
            names.add(pattern.featureName());
        }
        for (int level = 1; level <= 4; level++) {
            names.add("rules_pl" + level);
        }
        names.add("rules_total");
        names.add("rule_max_anomaly_score");
        names.add("anomaly_score_total");
        for (int i = 0; i < HASH_BUCKETS; i++) {
            names.add("path_hash_" + i);
        }
        for (int i = 0; i < HASH_BUCKETS; i++) {
            names.add("body_hash_" + i);
        }
        return names;
    }
}
