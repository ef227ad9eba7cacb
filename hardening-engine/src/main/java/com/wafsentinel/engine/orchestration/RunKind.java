package com.wafsentinel.engine.orchestration;

/**
 * What a recorded run did.
 *
 * @author WAF Sentinel Team
 */
public enum RunKind {
    CLASSIFICATION,
    HARDENING,
    ROLLBACK
}
