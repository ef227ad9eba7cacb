package com.wafsentinel.engine.classifier;

import com.wafsentinel.engine.SentinelException;

/**
 * A feature vector was produced by an extractor schema the loaded model was not
 * trained on. Fatal to the run.
 *
 * @author WAF Sentinel Team
 */
public class SchemaMismatchException extends SentinelException {

    private final String expectedVersion;
    private final String actualVersion;

    public SchemaMismatchException(String expectedVersion, String actualVersion) {
        super("Feature schema mismatch: model expects " + expectedVersion + " but vector is " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getExpectedVersion() {
        return expectedVersion;
    }

    public String getActualVersion() {
        return actualVersion;
    }
}
