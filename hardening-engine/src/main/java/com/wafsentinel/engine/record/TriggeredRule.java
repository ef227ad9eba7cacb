package com.wafsentinel.engine.record;

/**
 * A CRS rule matched by the inspection layer for one transaction.
 *
 * @param ruleId        CRS rule id, e.g. {@code 942100}
 * @param paranoiaLevel paranoia level 1-4, or 0 when the record did not carry one
 * @param severity      lower-cased severity tag, empty when absent
 * @param anomalyScore  anomaly score contributed by this match
 *
 * @author WAF Sentinel Team
 */
public record TriggeredRule(String ruleId, int paranoiaLevel, String severity, int anomalyScore) {

    public TriggeredRule {
        severity = severity == null ? "" : severity;
    }

    public boolean isHighParanoia() {
        return paranoiaLevel >= 3;
    }
}
