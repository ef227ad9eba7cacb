package com.wafsentinel.engine.trend;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Output of one aggregation pass.
 *
 * @param window      aggregated interval
 * @param summary     traffic ratio over the interval
 * @param ruleStats   per-rule statistics, most triggered first
 * @param generatedAt when the report was computed
 *
 * @author WAF Sentinel Team
 */
public record TrendReport(AggregationWindow window, TrafficSummary summary, List<RuleStat> ruleStats,
        Instant generatedAt) {

    public TrendReport {
        ruleStats = List.copyOf(ruleStats);
    }

    public Optional<RuleStat> stat(String ruleId) {
        return ruleStats.stream().filter(s -> s.ruleId().equals(ruleId)).findFirst();
    }
}
