package com.wafsentinel.engine.hardening;

import java.time.Instant;
import java.util.Objects;

/**
 * State of one rule in the rule set.
 *
 * @param ruleId        original CRS rule id
 * @param paranoiaLevel paranoia level the rule is tagged with
 * @param state         lifecycle state
 * @param confirmations consecutive qualifying cycles counted towards the next promotion
 * @param changedAt     when {@code state} last changed
 *
 * @author WAF Sentinel Team
 */
public record RuleEntry(String ruleId, int paranoiaLevel, RuleState state, int confirmations, Instant changedAt) {

    public RuleEntry {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(state, "state");
        if (confirmations < 0) {
            throw new IllegalArgumentException("Negative confirmations for rule " + ruleId);
        }
    }

    public static RuleEntry inactive(String ruleId, int paranoiaLevel) {
        return new RuleEntry(ruleId, paranoiaLevel, RuleState.INACTIVE, 0, null);
    }

    public RuleEntry moveTo(RuleState next, int nextConfirmations, Instant at) {
        return new RuleEntry(ruleId, paranoiaLevel, next, nextConfirmations, at);
    }

    public RuleEntry withConfirmations(int nextConfirmations) {
        return new RuleEntry(ruleId, paranoiaLevel, state, nextConfirmations, changedAt);
    }
}
