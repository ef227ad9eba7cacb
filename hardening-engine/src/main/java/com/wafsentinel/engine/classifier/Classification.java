package com.wafsentinel.engine.classifier;

/**
 * Output of one model invocation.
 *
 * @param label      thresholded label
 * @param confidence calibrated probability of {@link Label#MALICIOUS}, in [0, 1]
 *
 * @author WAF Sentinel Team
 */
public record Classification(Label label, double confidence) {
}
