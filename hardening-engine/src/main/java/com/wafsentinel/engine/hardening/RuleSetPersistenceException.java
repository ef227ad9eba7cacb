package com.wafsentinel.engine.hardening;

import com.wafsentinel.engine.SentinelException;

/**
 * The rule set could not be read or written. A failed write leaves the
 * previous version in place.
 *
 * @author WAF Sentinel Team
 */
public class RuleSetPersistenceException extends SentinelException {

    public RuleSetPersistenceException(String message) {
        super(message);
    }

    public RuleSetPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
