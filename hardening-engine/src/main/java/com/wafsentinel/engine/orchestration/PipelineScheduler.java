package com.wafsentinel.engine.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * The two independent cadences: classification keeps up with ingestion,
 * hardening re-evaluates the rule set on a much coarser interval.
 *
 * @author WAF Sentinel Team
 */
@Component
@ConditionalOnProperty(prefix = "waf-sentinel.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final ClassificationRun classificationRun;
    private final HardeningCycle hardeningCycle;

    public PipelineScheduler(ClassificationRun classificationRun, HardeningCycle hardeningCycle) {
        this.classificationRun = classificationRun;
        this.hardeningCycle = hardeningCycle;
    }

    @Scheduled(fixedDelayString = "${waf-sentinel.schedule.classification-interval:PT5M}",
            initialDelayString = "${waf-sentinel.schedule.classification-initial-delay:PT30S}")
    public void classify() {
        RunStatus status = classificationRun.run();
        log.debug("Scheduled classification run {} finished: {}", status.runId(), status.outcome());
    }

    @Scheduled(fixedDelayString = "${waf-sentinel.schedule.hardening-interval:PT1H}",
            initialDelayString = "${waf-sentinel.schedule.hardening-initial-delay:PT5M}")
    public void harden() {
        RunStatus status = hardeningCycle.run();
        log.debug("Scheduled hardening cycle {} finished: {}", status.runId(), status.outcome());
    }
}
