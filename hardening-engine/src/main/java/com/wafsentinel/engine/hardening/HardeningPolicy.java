package com.wafsentinel.engine.hardening;

import com.wafsentinel.engine.trend.RuleStat;

/**
 * Thresholds of the promotion state machine.
 *
 * @param minSample              minimum trigger count before precision is trusted
 * @param promotionThreshold     precision a rule must reach to qualify for promotion
 * @param demotionThreshold      precision below which an active rule is demoted
 * @param confirmationCycles     consecutive qualifying cycles needed to activate a
 *                               candidate or to release a demoted rule
 * @param maxActivationsPerCycle upper bound of rules activated by one cycle
 * @param minParanoiaLevel       lowest paranoia level managed by the engine
 *
 * @author WAF Sentinel Team
 */
public record HardeningPolicy(
        int minSample,
        double promotionThreshold,
        double demotionThreshold,
        int confirmationCycles,
        int maxActivationsPerCycle,
        int minParanoiaLevel) {

    public HardeningPolicy {
        if (minSample < 1) {
            throw new IllegalArgumentException("minSample must be positive: " + minSample);
        }
        if (promotionThreshold < 0.0 || promotionThreshold > 1.0
                || demotionThreshold < 0.0 || demotionThreshold > 1.0) {
            throw new IllegalArgumentException("Thresholds must be within [0, 1]");
        }
        if (demotionThreshold > promotionThreshold) {
            throw new IllegalArgumentException("Demotion threshold " + demotionThreshold
                    + " is above promotion threshold " + promotionThreshold);
        }
        if (confirmationCycles < 1 || maxActivationsPerCycle < 1) {
            throw new IllegalArgumentException("confirmationCycles and maxActivationsPerCycle must be positive");
        }
    }

    /** Trigger count reaches the sample floor and precision reaches the promotion threshold. */
    public boolean qualifies(RuleStat stat) {
        return stat.precision() != null
                && stat.triggerCount() >= minSample
                && stat.precision() >= promotionThreshold;
    }

    /** Enough evidence that precision fell below the hysteresis threshold. */
    public boolean demotes(RuleStat stat) {
        return stat.precision() != null
                && stat.triggerCount() >= minSample
                && stat.precision() < demotionThreshold;
    }
}
