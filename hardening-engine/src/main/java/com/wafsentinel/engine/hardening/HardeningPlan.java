package com.wafsentinel.engine.hardening;

import java.util.List;

/**
 * Result of evaluating one cycle: the state transitions and the rule set to
 * commit. {@code proposed} also carries confirmation counter updates that are
 * not transitions.
 *
 * @author WAF Sentinel Team
 */
public record HardeningPlan(RuleSetState base, List<RuleTransition> transitions, RuleSetState proposed) {

    public HardeningPlan {
        transitions = List.copyOf(transitions);
    }

    public boolean hasChanges() {
        return !base.rules().equals(proposed.rules());
    }

    /** Whether the set of enforced rules differs between base and proposed state. */
    public boolean changesEnforcement() {
        return transitions.stream().anyMatch(RuleTransition::changesEnforcement);
    }
}
