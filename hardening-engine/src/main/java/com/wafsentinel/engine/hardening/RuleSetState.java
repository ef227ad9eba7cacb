package com.wafsentinel.engine.hardening;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Versioned rule set. Every committed change increments {@code version} by one;
 * the repository only accepts a new state whose base version is the stored one.
 *
 * @param version   monotonically increasing version, 0 for the initial empty set
 * @param updatedAt when this version was produced
 * @param rules     entries by rule id
 *
 * @author WAF Sentinel Team
 */
public record RuleSetState(long version, Instant updatedAt, Map<String, RuleEntry> rules) {

    public RuleSetState {
        rules = Collections.unmodifiableSortedMap(new TreeMap<>(rules == null ? Map.of() : rules));
    }

    public static RuleSetState initial() {
        return new RuleSetState(0, null, Map.of());
    }

    public Optional<RuleEntry> entry(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    /** Ids of the enforced rules, sorted. */
    public SortedSet<String> activeRuleIds() {
        SortedSet<String> active = new TreeSet<>();
        rules.values().stream().filter(e -> e.state().enforced()).forEach(e -> active.add(e.ruleId()));
        return active;
    }

    /** The successor version holding {@code nextRules}. */
    public RuleSetState successor(Map<String, RuleEntry> nextRules, Instant at) {
        return new RuleSetState(version + 1, at, nextRules);
    }
}
