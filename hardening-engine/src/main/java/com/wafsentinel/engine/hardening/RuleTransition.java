package com.wafsentinel.engine.hardening;

import com.wafsentinel.engine.trend.RuleStat;

/**
 * One state change of one rule, with the statistics that caused it.
 *
 * @author WAF Sentinel Team
 */
public record RuleTransition(String ruleId, RuleState from, RuleState to, RuleStat stat) {

    public boolean changesEnforcement() {
        return from.enforced() != to.enforced();
    }
}
