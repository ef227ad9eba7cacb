package com.wafsentinel.engine.hardening;

/**
 * Durable storage of the rule set consumed by the firewall.
 *
 * @author WAF Sentinel Team
 */
public interface RuleSetRepository {

    /**
     * Current state; {@link RuleSetState#initial()} when nothing was ever committed.
     *
     * @throws RuleSetPersistenceException if the stored state cannot be read
     */
    RuleSetState load();

    /**
     * Replace the stored state if it is still at {@code expectedVersion}.
     * Either the whole proposed state is stored or nothing is.
     *
     * @throws RuleConflictException       if the stored version differs
     * @throws RuleSetPersistenceException if the write fails
     */
    RuleSetState compareAndWrite(long expectedVersion, RuleSetState proposed);
}
