package com.wafsentinel.engine.store;

import com.wafsentinel.engine.SentinelException;

/**
 * The store rejected a request as invalid (HTTP 4xx other than conflict).
 * Retrying the same request will not help.
 *
 * @author WAF Sentinel Team
 */
public class StoreRequestException extends SentinelException {

    private final int status;

    public StoreRequestException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
