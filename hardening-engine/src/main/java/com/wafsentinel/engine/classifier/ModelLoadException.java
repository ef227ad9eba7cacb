package com.wafsentinel.engine.classifier;

import com.wafsentinel.engine.SentinelException;

/**
 * The model artifact is missing, corrupt, or declares an unsupported feature
 * schema.
 *
 * @author WAF Sentinel Team
 */
public class ModelLoadException extends SentinelException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
