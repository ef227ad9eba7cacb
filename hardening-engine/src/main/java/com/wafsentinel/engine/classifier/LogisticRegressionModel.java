package com.wafsentinel.engine.classifier;

import com.wafsentinel.engine.feature.FeatureVector;

/**
 * Linear model with a sigmoid link. Weights are resolved to slots at load time.
 *
 * @author WAF Sentinel Team
 */
record LogisticRegressionModel(
        String modelVersion,
        String featureSchemaVersion,
        double[] weights,
        double bias) implements ModelArtifact {

    @Override
    public double predict(FeatureVector vector) {
        double z = bias;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] != 0.0) {
                z += weights[i] * vector.get(i);
            }
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
