package com.wafsentinel.engine.trend;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Attack and benign ratio over an aggregation window.
 *
 * @param totalRecords        classified records in the window
 * @param maliciousCount      records classified malicious
 * @param benignCount         records classified benign
 * @param attackPercentage    malicious share, percent, two decimals
 * @param normalPercentage    benign share, percent, two decimals
 * @param averageAnomalyScore mean of the non-zero total anomaly scores, two decimals
 *
 * @author WAF Sentinel Team
 */
public record TrafficSummary(
        long totalRecords,
        long maliciousCount,
        long benignCount,
        double attackPercentage,
        double normalPercentage,
        double averageAnomalyScore) {

    public static TrafficSummary of(long malicious, long benign, long anomalyScoreSum, long anomalyScoreCount) {
        long total = malicious + benign;
        return new TrafficSummary(
                total,
                malicious,
                benign,
                total == 0 ? 0.0 : round(100.0 * malicious / total),
                total == 0 ? 0.0 : round(100.0 * benign / total),
                anomalyScoreCount == 0 ? 0.0 : round((double) anomalyScoreSum / anomalyScoreCount));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
