package com.wafsentinel.engine.metrics;

import com.wafsentinel.engine.orchestration.ClassificationRun;
import com.wafsentinel.engine.orchestration.HardeningCycle;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Engine-level gauges, in addition to the per-component counters and timers:
 * <ul>
 * <li>{@code sentinel.rules.active} - rules currently enforced</li>
 * <li>{@code sentinel.rules.version} - version of the rule set last seen</li>
 * <li>{@code sentinel.classification.running} - 1 while a classification run is in progress</li>
 * <li>{@code sentinel.uptime_seconds} - engine uptime</li>
 * </ul>
 *
 * @author WAF Sentinel Team
 */
@Component
public class EngineMetrics {

    private static final Logger log = LoggerFactory.getLogger(EngineMetrics.class);

    private final ClassificationRun classificationRun;
    private final HardeningCycle hardeningCycle;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public EngineMetrics(ClassificationRun classificationRun, HardeningCycle hardeningCycle,
            MeterRegistry meterRegistry) {
        this.classificationRun = classificationRun;
        this.hardeningCycle = hardeningCycle;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("sentinel.rules.active", hardeningCycle, HardeningCycle::activeRuleCount)
                .description("Rules currently enforced")
                .register(meterRegistry);

        Gauge.builder("sentinel.rules.version", hardeningCycle, HardeningCycle::ruleSetVersion)
                .description("Version of the rule set last loaded or committed")
                .register(meterRegistry);

        Gauge.builder("sentinel.classification.running", classificationRun, r -> r.isRunning() ? 1.0 : 0.0)
                .description("Whether a classification run is in progress")
                .register(meterRegistry);

        Gauge.builder("sentinel.uptime_seconds", this, m -> (System.currentTimeMillis() - m.startTime) / 1000.0)
                .description("Engine uptime in seconds")
                .register(meterRegistry);

        log.info("Engine metrics registered");
    }
}
