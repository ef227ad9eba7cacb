package com.wafsentinel.engine.feature;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coarse browser and operating-system classification of a User-Agent string.
 * Detection is first-match in declaration order.
 *
 * @author WAF Sentinel Team
 */
record UserAgentProfile(
        String browser,
        String operatingSystem,
        boolean mobile,
        boolean bot,
        double browserVersion,
        int length,
        int wordCount) {

    private static final Map<String, List<String>> BROWSER_MARKERS = new LinkedHashMap<>();
    private static final Map<String, List<String>> OS_MARKERS = new LinkedHashMap<>();
    private static final Pattern VERSION = Pattern.compile("\\d+\\.\\d+");

    static {
        BROWSER_MARKERS.put("chrome", List.of("chrome", "chromium"));
        BROWSER_MARKERS.put("firefox", List.of("firefox", "mozilla"));
        BROWSER_MARKERS.put("safari", List.of("safari"));
        BROWSER_MARKERS.put("opera", List.of("opera"));
        BROWSER_MARKERS.put("edge", List.of("edge", "edg"));
        BROWSER_MARKERS.put("ie", List.of("msie", "trident"));
        BROWSER_MARKERS.put("mobile", List.of("mobile", "android", "iphone"));

        OS_MARKERS.put("windows", List.of("windows nt"));
        OS_MARKERS.put("linux", List.of("linux", "x11"));
        OS_MARKERS.put("mac", List.of("macintosh", "mac os"));
        OS_MARKERS.put("android", List.of("android"));
        OS_MARKERS.put("ios", List.of("iphone", "ipad", "ios"));
    }

    /** Profile a User-Agent; {@code null} profiles as the literal {@code unknown}. */
    static UserAgentProfile of(String userAgent) {
        String ua = userAgent == null ? "unknown" : userAgent.toLowerCase(Locale.ROOT);

        Matcher version = VERSION.matcher(ua);
        double browserVersion = 0.0;
        if (version.find()) {
            double parsed = Double.parseDouble(version.group());
            browserVersion = Double.isFinite(parsed) ? parsed : 0.0;
        }

        String trimmed = ua.trim();
        return new UserAgentProfile(
                firstMatch(ua, BROWSER_MARKERS),
                firstMatch(ua, OS_MARKERS),
                containsAny(ua, List.of("mobile", "android", "iphone", "ipad")),
                containsAny(ua, List.of("bot", "crawler", "spider")),
                browserVersion,
                ua.length(),
                trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length);
    }

    private static String firstMatch(String ua, Map<String, List<String>> markers) {
        for (Map.Entry<String, List<String>> entry : markers.entrySet()) {
            if (containsAny(ua, entry.getValue())) {
                return entry.getKey();
            }
        }
        return "other";
    }

    private static boolean containsAny(String ua, List<String> needles) {
        for (String needle : needles) {
            if (ua.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
