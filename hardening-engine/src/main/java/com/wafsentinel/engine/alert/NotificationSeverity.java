package com.wafsentinel.engine.alert;

/**
 * Urgency attached to a notification.
 *
 * @author WAF Sentinel Team
 */
public enum NotificationSeverity {
    INFO,
    WARNING,
    CRITICAL
}
