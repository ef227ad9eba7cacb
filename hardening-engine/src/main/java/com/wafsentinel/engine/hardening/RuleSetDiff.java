package com.wafsentinel.engine.hardening;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Journal entry of one committed rule set change.
 *
 * <p>
 * {@code previous} holds the entries of the changed rules as they were at
 * {@code baseVersion}; a rule that had no entry is recorded as inactive.
 * Applying {@code previous} on top of {@code resultingVersion} reverts the change.
 * </p>
 *
 * @param cycleId          id of the hardening cycle or rollback that made the change
 * @param baseVersion      version the change was computed against
 * @param resultingVersion version the change produced
 * @param createdAt        commit time
 * @param transitions      state changes with their supporting statistics
 * @param previous         prior entries of every rule whose entry changed
 * @param signature        HMAC of the other fields, {@code null} until signed
 *
 * @author WAF Sentinel Team
 */
public record RuleSetDiff(
        String cycleId,
        long baseVersion,
        long resultingVersion,
        Instant createdAt,
        List<RuleTransition> transitions,
        List<RuleEntry> previous,
        String signature) {

    public RuleSetDiff {
        transitions = List.copyOf(transitions);
        previous = List.copyOf(previous);
    }

    /** Unsigned diff between the plan's base and proposed states. */
    public static RuleSetDiff of(String cycleId, HardeningPlan plan, Instant createdAt) {
        return between(cycleId, plan.base(), plan.proposed(), plan.transitions(), createdAt);
    }

    public static RuleSetDiff between(String cycleId, RuleSetState base, RuleSetState proposed,
            List<RuleTransition> transitions, Instant createdAt) {
        List<RuleEntry> previous = new ArrayList<>();
        for (RuleEntry entry : proposed.rules().values()) {
            RuleEntry before = base.rules().get(entry.ruleId());
            if (!entry.equals(before)) {
                previous.add(before != null ? before : RuleEntry.inactive(entry.ruleId(), entry.paranoiaLevel()));
            }
        }
        return new RuleSetDiff(cycleId, base.version(), proposed.version(), createdAt, transitions, previous, null);
    }

    public RuleSetDiff withSignature(String signature) {
        return new RuleSetDiff(cycleId, baseVersion, resultingVersion, createdAt, transitions, previous, signature);
    }
}
