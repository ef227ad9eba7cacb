package com.wafsentinel.engine.alert;

import com.wafsentinel.engine.SentinelException;

/**
 * A channel could not deliver a notification. Never propagated past the
 * {@link Notifier}.
 *
 * @author WAF Sentinel Team
 */
public class NotificationException extends SentinelException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
