package com.wafsentinel.engine.classifier;

import com.wafsentinel.engine.feature.FeatureVector;

/**
 * A loaded, versioned model bundle.
 *
 * @author WAF Sentinel Team
 */
public interface ModelArtifact {

    String modelVersion();

    /** Feature schema the model was trained against. */
    String featureSchemaVersion();

    /**
     * Probability that the vector describes malicious traffic.
     *
     * @param vector a vector of {@link #featureSchemaVersion()}
     * @return probability in [0, 1]
     */
    double predict(FeatureVector vector);
}
