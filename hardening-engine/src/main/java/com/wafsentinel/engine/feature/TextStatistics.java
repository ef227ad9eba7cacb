package com.wafsentinel.engine.feature;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Order-independent statistics over request text. All methods accept
 * {@code null} and treat it as the empty string.
 *
 * @author WAF Sentinel Team
 */
final class TextStatistics {

    /** Characters typical of injection payloads. */
    private static final String SPECIAL_CHARS = "<>'\";()&|$%*`{}[]\\!^~@#+=,";

    private static final Pattern SCHEME_AND_HOST = Pattern.compile("https?://[^/]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private TextStatistics() {
    }

    static double specialCharRatio(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        int special = 0;
        for (int i = 0; i < text.length(); i++) {
            if (SPECIAL_CHARS.indexOf(text.charAt(i)) >= 0) {
                special++;
            }
        }
        return (double) special / text.length();
    }

    /** Shannon entropy of the character distribution, in bits. */
    static double entropy(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        Map<Character, Integer> counts = new HashMap<>();
        for (int i = 0; i < text.length(); i++) {
            counts.merge(text.charAt(i), 1, Integer::sum);
        }
        double entropy = 0.0;
        double length = text.length();
        for (int count : counts.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    /**
     * Lower-case, drop scheme and host, collapse whitespace and fold backslashes
     * so equivalent payloads hash to the same n-grams.
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        normalized = SCHEME_AND_HOST.matcher(normalized).replaceAll("");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.replace('\\', '/').replace("//", "/").trim();
    }

    /**
     * L2-normalised frequencies of character unigrams and bigrams folded into
     * {@code buckets} slots with 32-bit FNV-1a.
     */
    static double[] hashedNgrams(String text, int buckets) {
        double[] vector = new double[buckets];
        if (text == null || text.isEmpty()) {
            return vector;
        }
        for (int i = 0; i < text.length(); i++) {
            vector[bucket(text.substring(i, i + 1), buckets)] += 1.0;
            if (i + 1 < text.length()) {
                vector[bucket(text.substring(i, i + 2), buckets)] += 1.0;
            }
        }
        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    private static int bucket(String gram, int buckets) {
        int hash = FNV_OFFSET;
        for (byte b : gram.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return (hash & 0x7fffffff) % buckets;
    }
}
