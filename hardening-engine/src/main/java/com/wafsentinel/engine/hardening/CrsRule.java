package com.wafsentinel.engine.hardening;

/**
 * A high-paranoia rule definition taken from a CRS configuration file.
 *
 * @param ruleId        id of the rule (of the first directive when chained)
 * @param paranoiaLevel paranoia level from the {@code paranoia-level/N} tag
 * @param severity      lower-case severity action value, {@code null} if absent
 * @param text          the directive text, continuation lines and chained rules included
 * @param source        file the rule was read from
 *
 * @author WAF Sentinel Team
 */
public record CrsRule(String ruleId, int paranoiaLevel, String severity, String text, String source) {
}
