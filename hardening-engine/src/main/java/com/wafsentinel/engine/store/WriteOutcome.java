package com.wafsentinel.engine.store;

/**
 * Result of a create-if-absent write.
 *
 * @author WAF Sentinel Team
 */
public enum WriteOutcome {
    CREATED,
    ALREADY_PRESENT
}
