package com.wafsentinel.engine.store;

import com.wafsentinel.engine.SentinelException;

/**
 * The store, or the network path to it, is temporarily unavailable. Callers
 * retry with backoff; processing resumes from the persisted cursor.
 *
 * @author WAF Sentinel Team
 */
public class TransientIOException extends SentinelException {

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
