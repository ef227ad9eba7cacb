package com.wafsentinel.engine.feature;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Payload signatures counted as features. Each constant contributes one
 * {@code secpat_*} slot holding its match count.
 *
 * @author WAF Sentinel Team
 */
enum SecurityPattern {

    SQLI_SELECT("(?:union\\s+(?:all\\s+)?select|select\\s+(?:\\w+|\\*)\\s+from)"),
    SQLI_DESTRUCTIVE("(?:drop\\s+(?:table|database)|delete\\s+from)"),
    PATH_TRAVERSAL("(?:\\.\\./|\\./|~/)"),
    SENSITIVE_FILE("(?:/etc/(?:passwd|shadow))"),
    PHP_WRAPPER("(?:php://(?:filter|input)|file://)"),
    XSS("(?:<script>|</script>|javascript:)"),
    COMMAND_INJECTION("(?:;\\s*\\w+\\s*;|`[^`]*`|\\|\\s*\\w+)");

    private final Pattern pattern;

    SecurityPattern(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    String featureName() {
        return "secpat_" + name().toLowerCase(Locale.ROOT);
    }

    int count(String text) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
