package com.wafsentinel.engine.hardening;

/**
 * Lifecycle of a high-paranoia rule. Only {@link #ACTIVE} rules are enforced.
 *
 * @author WAF Sentinel Team
 */
public enum RuleState {
    INACTIVE,
    CANDIDATE,
    ACTIVE,
    DEMOTED;

    public boolean enforced() {
        return this == ACTIVE;
    }
}
