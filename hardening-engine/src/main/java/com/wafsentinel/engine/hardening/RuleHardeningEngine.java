package com.wafsentinel.engine.hardening;

import com.wafsentinel.engine.trend.RuleStat;
import com.wafsentinel.engine.trend.TrendReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Promotion state machine over rule statistics.
 *
 * <p>
 * Per cycle, for every managed rule:
 * </p>
 * <ul>
 * <li><b>INACTIVE</b> becomes CANDIDATE when it qualifies.</li>
 * <li><b>CANDIDATE</b> becomes ACTIVE once it has qualified on
 * {@code confirmationCycles} consecutive cycles, and falls back to INACTIVE
 * on the first cycle it does not.</li>
 * <li><b>ACTIVE</b> becomes DEMOTED when its precision drops below the
 * demotion threshold.</li>
 * <li><b>DEMOTED</b> becomes CANDIDATE again after {@code confirmationCycles}
 * consecutive qualifying cycles; a non-qualifying cycle resets the count.</li>
 * </ul>
 *
 * <p>
 * A rule without evidence (null precision or too few triggers) neither
 * qualifies nor demotes. At most {@code maxActivationsPerCycle} candidates
 * are activated per cycle, most triggered first; the others stay candidates
 * and are reconsidered on the next cycle.
 * </p>
 *
 * <p>
 * Evaluation is pure: it reads the state and the report and returns a plan.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class RuleHardeningEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleHardeningEngine.class);

    private final Predicate<String> managedRule;

    /** Manage every rule at or above the policy's paranoia level. */
    public RuleHardeningEngine() {
        this(ruleId -> true);
    }

    /**
     * @param managedRule restricts the rules that may enter the rule set, e.g. to
     *                    the ones the CRS catalog can render
     */
    public RuleHardeningEngine(Predicate<String> managedRule) {
        this.managedRule = managedRule;
    }

    public HardeningPlan evaluate(RuleSetState state, TrendReport report, HardeningPolicy policy) {
        Instant now = report.generatedAt();

        TreeSet<String> ruleIds = new TreeSet<>(state.rules().keySet());
        for (RuleStat stat : report.ruleStats()) {
            if (stat.paranoiaLevel() >= policy.minParanoiaLevel() && managedRule.test(stat.ruleId())) {
                ruleIds.add(stat.ruleId());
            }
        }

        Map<String, RuleEntry> next = new LinkedHashMap<>(state.rules());
        List<RuleTransition> transitions = new ArrayList<>();
        List<Promotion> promotions = new ArrayList<>();

        for (String ruleId : ruleIds) {
            Optional<RuleStat> reported = report.stat(ruleId);
            RuleEntry current = state.entry(ruleId)
                    .orElseGet(() -> RuleEntry.inactive(ruleId, reported.map(RuleStat::paranoiaLevel).orElse(0)));
            RuleStat stat = reported.orElseGet(() -> RuleStat.empty(ruleId, current.paranoiaLevel()));
            boolean qualifies = policy.qualifies(stat);

            RuleEntry updated = switch (current.state()) {
                case INACTIVE -> qualifies ? current.moveTo(RuleState.CANDIDATE, 1, now) : current;
                case CANDIDATE -> {
                    if (!qualifies) {
                        yield current.moveTo(RuleState.INACTIVE, 0, now);
                    }
                    if (current.confirmations() + 1 >= policy.confirmationCycles()) {
                        promotions.add(new Promotion(current, stat));
                        yield current;
                    }
                    yield current.withConfirmations(current.confirmations() + 1);
                }
                case ACTIVE -> policy.demotes(stat) ? current.moveTo(RuleState.DEMOTED, 0, now) : current;
                case DEMOTED -> {
                    if (!qualifies) {
                        yield current.withConfirmations(0);
                    }
                    if (current.confirmations() + 1 >= policy.confirmationCycles()) {
                        yield current.moveTo(RuleState.CANDIDATE, 1, now);
                    }
                    yield current.withConfirmations(current.confirmations() + 1);
                }
            };

            if (!updated.equals(current)) {
                next.put(ruleId, updated);
            }
            if (updated.state() != current.state()) {
                transitions.add(new RuleTransition(ruleId, current.state(), updated.state(), stat));
            }
        }

        promotions.sort(Comparator.comparingLong((Promotion p) -> p.stat().triggerCount()).reversed()
                .thenComparing(p -> p.entry().ruleId()));
        for (int i = 0; i < promotions.size(); i++) {
            Promotion promotion = promotions.get(i);
            RuleEntry entry = promotion.entry();
            if (i < policy.maxActivationsPerCycle()) {
                next.put(entry.ruleId(), entry.moveTo(RuleState.ACTIVE, 0, now));
                transitions.add(new RuleTransition(entry.ruleId(), RuleState.CANDIDATE, RuleState.ACTIVE,
                        promotion.stat()));
            } else {
                next.put(entry.ruleId(), entry.withConfirmations(entry.confirmations() + 1));
                log.info("Activation of rule {} deferred, cycle cap of {} reached",
                        entry.ruleId(), policy.maxActivationsPerCycle());
            }
        }
        transitions.sort(Comparator.comparing(RuleTransition::ruleId));

        RuleSetState proposed = next.equals(state.rules()) ? state : state.successor(next, now);
        for (RuleTransition t : transitions) {
            log.info("Rule {} {} -> {} (triggers={}, precision={})",
                    t.ruleId(), t.from(), t.to(), t.stat().triggerCount(), t.stat().precision());
        }
        return new HardeningPlan(state, transitions, proposed);
    }

    private record Promotion(RuleEntry entry, RuleStat stat) {
    }
}
