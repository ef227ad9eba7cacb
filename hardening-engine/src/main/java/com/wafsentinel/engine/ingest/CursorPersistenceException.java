package com.wafsentinel.engine.ingest;

import com.wafsentinel.engine.SentinelException;

/**
 * The cursor file could not be read or replaced.
 *
 * @author WAF Sentinel Team
 */
public class CursorPersistenceException extends SentinelException {

    public CursorPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
