package com.wafsentinel.engine.orchestration;

import java.time.Duration;

/**
 * Tuning of a classification run.
 *
 * @param batchSize       records fetched per page
 * @param concurrency     classification worker threads
 * @param maxAttempts     attempts per fetch or write before the run aborts
 * @param initialBackoff  delay before the first retry, doubled on each further retry
 * @param initialLookback how far back the first run starts when no cursor exists yet
 *
 * @author WAF Sentinel Team
 */
public record PipelineSettings(int batchSize, int concurrency, int maxAttempts, Duration initialBackoff,
        Duration initialLookback) {

    public PipelineSettings {
        if (batchSize < 1 || concurrency < 1 || maxAttempts < 1) {
            throw new IllegalArgumentException("batchSize, concurrency and maxAttempts must be positive");
        }
    }
}
