package com.wafsentinel.engine;

/**
 * Base type for failures raised by the classification and hardening pipeline.
 *
 * @author WAF Sentinel Team
 */
public class SentinelException extends RuntimeException {

    public SentinelException(String message) {
        super(message);
    }

    public SentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}
