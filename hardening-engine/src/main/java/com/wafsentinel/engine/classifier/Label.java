package com.wafsentinel.engine.classifier;

/**
 * Predicted traffic class. {@link #target()} is the 0/1 encoding stored in the
 * classified indices.
 *
 * @author WAF Sentinel Team
 */
public enum Label {

    BENIGN(0),
    MALICIOUS(1);

    private final int target;

    Label(int target) {
        this.target = target;
    }

    public int target() {
        return target;
    }

    public static Label fromTarget(int target) {
        return target == 1 ? MALICIOUS : BENIGN;
    }
}
