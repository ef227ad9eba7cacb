package com.wafsentinel.engine.orchestration;

import com.wafsentinel.engine.alert.NotificationEvent;
import com.wafsentinel.engine.alert.Notifier;
import com.wafsentinel.engine.hardening.DiffJournal;
import com.wafsentinel.engine.hardening.DiffSigner;
import com.wafsentinel.engine.hardening.HardeningPlan;
import com.wafsentinel.engine.hardening.HardeningPolicy;
import com.wafsentinel.engine.hardening.RuleConflictException;
import com.wafsentinel.engine.hardening.RuleEntry;
import com.wafsentinel.engine.hardening.RuleHardeningEngine;
import com.wafsentinel.engine.hardening.RuleSetDiff;
import com.wafsentinel.engine.hardening.RuleSetPersistenceException;
import com.wafsentinel.engine.hardening.RuleSetRepository;
import com.wafsentinel.engine.hardening.RuleSetState;
import com.wafsentinel.engine.hardening.RuleTransition;
import com.wafsentinel.engine.store.StoreRequestException;
import com.wafsentinel.engine.store.TransientIOException;
import com.wafsentinel.engine.trend.AggregationWindow;
import com.wafsentinel.engine.trend.RuleStat;
import com.wafsentinel.engine.trend.TrendAggregator;
import com.wafsentinel.engine.trend.TrendReport;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coarse-cadence half of the engine: aggregate, evaluate, commit, journal,
 * notify.
 *
 * <p>
 * Cycles are single-flight. A cycle either commits its whole plan or nothing:
 * a version conflict aborts it until the next scheduled cycle, a persistence
 * failure fails it with a HardeningFailed notification and is never retried
 * automatically. Once the commit has started the cycle is not cancellable.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class HardeningCycle {

    private static final Logger log = LoggerFactory.getLogger(HardeningCycle.class);

    private final TrendAggregator aggregator;
    private final RuleHardeningEngine engine;
    private final RuleSetRepository repository;
    private final DiffJournal journal;
    private final DiffSigner signer;
    private final Notifier notifier;
    private final RunHistory history;
    private final HardeningPolicy policy;
    private final Duration lookback;
    private final double attackPercentageThreshold;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong activeRules = new AtomicLong();
    private final AtomicLong ruleSetVersion = new AtomicLong();

    public HardeningCycle(TrendAggregator aggregator, RuleHardeningEngine engine, RuleSetRepository repository,
            DiffJournal journal, DiffSigner signer, Notifier notifier, RunHistory history, HardeningPolicy policy,
            Duration lookback, double attackPercentageThreshold, Clock clock, MeterRegistry meterRegistry) {
        this.aggregator = aggregator;
        this.engine = engine;
        this.repository = repository;
        this.journal = journal;
        this.signer = signer;
        this.notifier = notifier;
        this.history = history;
        this.policy = policy;
        this.lookback = lookback;
        this.attackPercentageThreshold = attackPercentageThreshold;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run one cycle. Returns {@link RunOutcome#SKIPPED} if a cycle or rollback
     * is in progress.
     */
    public RunStatus run() {
        String cycleId = "cycle-" + UUID.randomUUID();
        Instant startedAt = clock.instant();
        if (!lock.tryLock()) {
            return record(RunStatus.skipped(cycleId, RunKind.HARDENING, startedAt,
                    "Hardening cycle already in progress"));
        }
        try {
            return record(runLocked(cycleId, startedAt));
        } catch (RuntimeException e) {
            log.error("Hardening cycle {} failed", cycleId, e);
            return record(fail(cycleId, RunKind.HARDENING, startedAt,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    private RunStatus runLocked(String cycleId, Instant startedAt) {
        TrendReport report;
        RuleSetState state;
        try {
            report = aggregator.aggregate(AggregationWindow.lookback(startedAt, lookback));
            state = repository.load();
        } catch (TransientIOException | RuleSetPersistenceException e) {
            log.error("Hardening cycle {} aborted before evaluation: {}", cycleId, e.getMessage());
            return finish(cycleId, startedAt, RunOutcome.ABORTED, 0, e.getMessage());
        } catch (StoreRequestException e) {
            log.error("Hardening cycle {} failed, classified store rejected the scan (HTTP {}): {}",
                    cycleId, e.getStatus(), e.getMessage());
            return fail(cycleId, RunKind.HARDENING, startedAt, e.getMessage());
        }
        publish(state);

        if (report.summary().attackPercentage() > attackPercentageThreshold) {
            notifier.notify(NotificationEvent.severityThresholdExceeded(report.summary(), report.window(),
                    attackPercentageThreshold, clock.instant()));
        }

        HardeningPlan plan = engine.evaluate(state, report, policy);
        if (!plan.hasChanges()) {
            return finish(cycleId, startedAt, RunOutcome.SUCCEEDED, report.summary().totalRecords(),
                    "No rule changes at version " + state.version());
        }

        RuleSetDiff diff = signer.sign(RuleSetDiff.of(cycleId, plan, clock.instant()));
        RunStatus committed = commit(cycleId, startedAt, state.version(), plan.proposed(), diff,
                plan.changesEnforcement(), report.summary().totalRecords());
        if (committed.outcome() == RunOutcome.SUCCEEDED) {
            publish(plan.proposed());
        }
        return committed;
    }

    /**
     * Revert the change journaled for {@code cycleId}. Only possible while the
     * rule set is still at the version that change produced.
     */
    public RunStatus rollback(String cycleId) {
        String rollbackId = "rollback-" + cycleId;
        Instant startedAt = clock.instant();
        lock.lock();
        try {
            RuleSetDiff original = journal.find(cycleId).orElse(null);
            if (original == null) {
                return record(finish(rollbackId, RunKind.ROLLBACK, startedAt, RunOutcome.FAILED, 0,
                        "No journaled change for cycle " + cycleId));
            }
            RuleSetState state = repository.load();
            if (state.version() != original.resultingVersion()) {
                return record(finish(rollbackId, RunKind.ROLLBACK, startedAt, RunOutcome.ABORTED, 0,
                        new RuleConflictException(original.resultingVersion(), state.version()).getMessage()));
            }

            Map<String, RuleEntry> reverted = new LinkedHashMap<>(state.rules());
            List<RuleTransition> transitions = new ArrayList<>();
            for (RuleEntry previous : original.previous()) {
                RuleEntry current = state.rules().get(previous.ruleId());
                reverted.put(previous.ruleId(), previous);
                if (current != null && current.state() != previous.state()) {
                    transitions.add(new RuleTransition(previous.ruleId(), current.state(), previous.state(),
                            RuleStat.empty(previous.ruleId(), previous.paranoiaLevel())));
                }
            }
            RuleSetState proposed = state.successor(reverted, startedAt);
            RuleSetDiff diff = signer.sign(RuleSetDiff.between(rollbackId, state, proposed, transitions, startedAt));
            boolean enforcementChanged = transitions.stream().anyMatch(RuleTransition::changesEnforcement);

            RunStatus status = commit(rollbackId, RunKind.ROLLBACK, startedAt, state.version(), proposed, diff,
                    enforcementChanged, 0);
            if (status.outcome() == RunOutcome.SUCCEEDED) {
                publish(proposed);
            }
            return record(status);
        } catch (RuleSetPersistenceException e) {
            return record(finish(rollbackId, RunKind.ROLLBACK, startedAt, RunOutcome.FAILED, 0, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Rollback {} failed", rollbackId, e);
            return record(fail(rollbackId, RunKind.ROLLBACK, startedAt,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    public long activeRuleCount() {
        return activeRules.get();
    }

    public long ruleSetVersion() {
        return ruleSetVersion.get();
    }

    private RunStatus commit(String cycleId, Instant startedAt, long baseVersion, RuleSetState proposed,
            RuleSetDiff diff, boolean enforcementChanged, long records) {
        return commit(cycleId, RunKind.HARDENING, startedAt, baseVersion, proposed, diff, enforcementChanged,
                records);
    }

    private RunStatus commit(String cycleId, RunKind kind, Instant startedAt, long baseVersion,
            RuleSetState proposed, RuleSetDiff diff, boolean enforcementChanged, long records) {
        try {
            repository.compareAndWrite(baseVersion, proposed);
        } catch (RuleConflictException e) {
            log.warn("{} {} aborted, nothing applied: {}", kind, cycleId, e.getMessage());
            return finish(cycleId, kind, startedAt, RunOutcome.ABORTED, records, e.getMessage());
        } catch (RuleSetPersistenceException e) {
            log.error("{} {} failed, rule set left at version {}: {}", kind, cycleId, baseVersion, e.getMessage());
            notifier.notify(NotificationEvent.hardeningFailed(cycleId, e.getMessage(), clock.instant()));
            return finish(cycleId, kind, startedAt, RunOutcome.FAILED, records, e.getMessage());
        }

        String message = String.format(Locale.ROOT, "Rule set version %d -> %d, %d transition(s)",
                baseVersion, proposed.version(), diff.transitions().size());
        try {
            journal.append(diff);
        } catch (RuntimeException e) {
            log.error("{} {} committed version {} but could not journal its diff: {}",
                    kind, cycleId, proposed.version(), e.getMessage());
            notifier.notify(NotificationEvent.hardeningFailed(cycleId,
                    "Version " + proposed.version() + " committed without a journal entry: " + e.getMessage(),
                    clock.instant()));
            message += ", journal entry missing";
        }

        if (enforcementChanged) {
            notifier.notify(NotificationEvent.ruleSetChanged(diff, clock.instant()));
        }
        return finish(cycleId, kind, startedAt, RunOutcome.SUCCEEDED, records, message);
    }

    /** A failure outside the commit path: nothing was written, the operators are told. */
    private RunStatus fail(String cycleId, RunKind kind, Instant startedAt, String message) {
        notifier.notify(NotificationEvent.hardeningFailed(cycleId, message, clock.instant()));
        return finish(cycleId, kind, startedAt, RunOutcome.FAILED, 0, message);
    }

    private void publish(RuleSetState state) {
        activeRules.set(state.activeRuleIds().size());
        ruleSetVersion.set(state.version());
    }

    private RunStatus finish(String cycleId, Instant startedAt, RunOutcome outcome, long records, String message) {
        return finish(cycleId, RunKind.HARDENING, startedAt, outcome, records, message);
    }

    private RunStatus finish(String cycleId, RunKind kind, Instant startedAt, RunOutcome outcome, long records,
            String message) {
        return new RunStatus(cycleId, kind, startedAt, clock.instant(), outcome, records, 0, 0, 0, message);
    }

    private RunStatus record(RunStatus status) {
        meterRegistry.counter("sentinel.runs", "kind", status.kind().name().toLowerCase(Locale.ROOT),
                "outcome", status.outcome().name().toLowerCase(Locale.ROOT)).increment();
        history.record(status);
        return status;
    }
}
