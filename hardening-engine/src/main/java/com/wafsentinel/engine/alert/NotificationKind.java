package com.wafsentinel.engine.alert;

/**
 * Kinds of operator notifications.
 *
 * @author WAF Sentinel Team
 */
public enum NotificationKind {
    CLASSIFIER_ERROR("ClassifierError", NotificationSeverity.CRITICAL),
    RULE_SET_CHANGED("RuleSetChanged", NotificationSeverity.WARNING),
    SEVERITY_THRESHOLD_EXCEEDED("SeverityThresholdExceeded", NotificationSeverity.CRITICAL),
    HARDENING_FAILED("HardeningFailed", NotificationSeverity.CRITICAL);

    private final String displayName;
    private final NotificationSeverity defaultSeverity;

    NotificationKind(String displayName, NotificationSeverity defaultSeverity) {
        this.displayName = displayName;
        this.defaultSeverity = defaultSeverity;
    }

    public String getDisplayName() {
        return displayName;
    }

    public NotificationSeverity getDefaultSeverity() {
        return defaultSeverity;
    }
}
