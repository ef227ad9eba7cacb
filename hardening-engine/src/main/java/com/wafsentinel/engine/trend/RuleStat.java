package com.wafsentinel.engine.trend;

/**
 * Trigger statistics of one rule over an aggregation window.
 *
 * @param ruleId          CRS rule id
 * @param paranoiaLevel   highest paranoia level reported for the rule, 0 if never reported
 * @param triggerCount    classified records that triggered the rule
 * @param maliciousCount  of those, records classified malicious
 * @param benignCount     of those, records classified benign
 * @param triggerRate     trigger count over all classified records in the window
 * @param precision       {@code maliciousCount / triggerCount}; {@code null} when the
 *                        rule never triggered, which means "no evidence" and not
 *                        "no risk"
 *
 * @author WAF Sentinel Team
 */
public record RuleStat(
        String ruleId,
        int paranoiaLevel,
        long triggerCount,
        long maliciousCount,
        long benignCount,
        double triggerRate,
        Double precision) {

    public static RuleStat of(String ruleId, int paranoiaLevel, long maliciousCount, long benignCount,
            long totalRecords) {
        long triggers = maliciousCount + benignCount;
        return new RuleStat(
                ruleId,
                paranoiaLevel,
                triggers,
                maliciousCount,
                benignCount,
                totalRecords == 0 ? 0.0 : (double) triggers / totalRecords,
                triggers == 0 ? null : (double) maliciousCount / triggers);
    }

    /** A rule with no triggers in the window. */
    public static RuleStat empty(String ruleId, int paranoiaLevel) {
        return new RuleStat(ruleId, paranoiaLevel, 0, 0, 0, 0.0, null);
    }
}
