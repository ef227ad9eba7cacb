package com.wafsentinel.engine.hardening;

import com.wafsentinel.engine.SentinelException;

/**
 * The stored rule set is not at the version a change was computed against.
 *
 * @author WAF Sentinel Team
 */
public class RuleConflictException extends SentinelException {

    private final long expectedVersion;
    private final long actualVersion;

    public RuleConflictException(long expectedVersion, long actualVersion) {
        super("Rule set is at version " + actualVersion + ", expected " + expectedVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
