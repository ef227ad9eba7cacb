package com.wafsentinel.engine.alert;

/**
 * Pluggable notification transport.
 *
 * @author WAF Sentinel Team
 */
public interface NotificationChannel {

    String name();

    /**
     * Deliver one event.
     *
     * @throws NotificationException if delivery fails
     */
    void send(NotificationEvent event);
}
