package com.wafsentinel.engine.trend;

import com.wafsentinel.engine.classifier.ClassificationResult;
import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.BucketGranularity;
import com.wafsentinel.engine.record.TimeBucket;
import com.wafsentinel.engine.record.TriggeredRule;
import com.wafsentinel.engine.store.ClassifiedPage;
import com.wafsentinel.engine.store.ClassifiedRecord;
import com.wafsentinel.engine.store.ClassifiedStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes rule statistics from the classified corpus.
 *
 * <p>
 * Nothing is carried over between passes: every call scans the classified
 * buckets overlapping the window, keeps records whose timestamp falls inside
 * it and, when a record was classified by several model versions, only the
 * most recent verdict.
 * </p>
 *
 * <p>
 * A rule is malicious-correlated on a record when the record is labelled
 * malicious and triggered the rule, benign-correlated when it triggered the
 * rule and is labelled benign.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class TrendAggregator {

    private static final Logger log = LoggerFactory.getLogger(TrendAggregator.class);

    private final ClassifiedStore store;
    private final BucketGranularity granularity;
    private final int pageSize;
    private final Clock clock;
    private final Timer aggregationTimer;

    public TrendAggregator(ClassifiedStore store, BucketGranularity granularity, int pageSize, Clock clock,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.granularity = granularity;
        this.pageSize = pageSize;
        this.clock = clock;
        this.aggregationTimer = Timer.builder("sentinel.trend.aggregation")
                .description("Time to aggregate the classified corpus over a window")
                .register(meterRegistry);
    }

    /**
     * Aggregate the window.
     *
     * @throws com.wafsentinel.engine.store.TransientIOException if the store cannot be read
     */
    public TrendReport aggregate(AggregationWindow window) {
        Timer.Sample sample = Timer.start();
        try {
            Map<String, Observation> latest = collect(window);
            TrendReport report = summarize(window, latest.values());
            log.info("Aggregated {} classified records over {}..{}: attack={}%, {} rules triggered",
                    report.summary().totalRecords(), window.from(), window.to(),
                    report.summary().attackPercentage(), report.ruleStats().size());
            return report;
        } finally {
            sample.stop(aggregationTimer);
        }
    }

    private Map<String, Observation> collect(AggregationWindow window) {
        Map<String, Observation> latest = new HashMap<>();
        for (TimeBucket bucket : TimeBucket.range(window.from(), window.to().minusNanos(1), granularity)) {
            String after = null;
            int scanned = 0;
            while (true) {
                ClassifiedPage page = store.scan(bucket, after, pageSize);
                for (ClassifiedRecord classified : page.records()) {
                    AuditRecord record = classified.record();
                    if (!window.contains(record.effectiveTimestamp())) {
                        continue;
                    }
                    Observation observation = Observation.of(classified);
                    latest.merge(record.bucket().label() + "/" + record.id(), observation, Observation::newer);
                }
                scanned += page.hitCount();
                if (page.hitCount() < pageSize || page.lastKey() == null) {
                    break;
                }
                after = page.lastKey();
            }
            log.debug("Scanned {} classified documents in bucket {}", scanned, bucket);
        }
        return latest;
    }

    private TrendReport summarize(AggregationWindow window, Iterable<Observation> observations) {
        long malicious = 0;
        long benign = 0;
        long anomalySum = 0;
        long anomalyCount = 0;
        Map<String, RuleCounter> counters = new HashMap<>();

        for (Observation observation : observations) {
            boolean isMalicious = observation.result().isMalicious();
            if (isMalicious) {
                malicious++;
            } else {
                benign++;
            }
            if (observation.anomalyScore() > 0) {
                anomalySum += observation.anomalyScore();
                anomalyCount++;
            }

            Map<String, Integer> levels = new HashMap<>();
            for (TriggeredRule rule : observation.rules()) {
                levels.merge(rule.ruleId(), rule.paranoiaLevel(), Math::max);
            }
            for (Map.Entry<String, Integer> rule : levels.entrySet()) {
                RuleCounter counter = counters.computeIfAbsent(rule.getKey(), id -> new RuleCounter());
                counter.paranoiaLevel = Math.max(counter.paranoiaLevel, rule.getValue());
                if (isMalicious) {
                    counter.malicious++;
                } else {
                    counter.benign++;
                }
            }
        }

        long total = malicious + benign;
        List<RuleStat> stats = new ArrayList<>();
        for (Map.Entry<String, RuleCounter> entry : counters.entrySet()) {
            RuleCounter c = entry.getValue();
            stats.add(RuleStat.of(entry.getKey(), c.paranoiaLevel, c.malicious, c.benign, total));
        }
        stats.sort(Comparator.comparingLong(RuleStat::triggerCount).reversed().thenComparing(RuleStat::ruleId));

        return new TrendReport(window, TrafficSummary.of(malicious, benign, anomalySum, anomalyCount), stats,
                clock.instant());
    }

    /** The parts of a classified record the aggregation needs. */
    private record Observation(ClassificationResult result, List<TriggeredRule> rules, int anomalyScore) {

        static Observation of(ClassifiedRecord classified) {
            AuditRecord record = classified.record();
            return new Observation(classified.result(), record.triggeredRules(),
                    record.anomalyScore() == null ? 0 : record.anomalyScore());
        }

        static Observation newer(Observation a, Observation b) {
            int byTime = a.result().classifiedAt().compareTo(b.result().classifiedAt());
            if (byTime != 0) {
                return byTime > 0 ? a : b;
            }
            return a.result().modelVersion().compareTo(b.result().modelVersion()) >= 0 ? a : b;
        }
    }

    private static final class RuleCounter {
        int paranoiaLevel;
        long malicious;
        long benign;
    }
}
