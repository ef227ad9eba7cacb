package com.wafsentinel.engine.classifier;

import com.wafsentinel.engine.feature.FeatureVector;

import java.util.List;

/**
 * Ensemble of binary decision trees exported from a random forest. Each tree
 * votes with the malicious-class probability of the leaf it reaches; the
 * prediction is the mean vote.
 *
 * @author WAF Sentinel Team
 */
record RandomForestModel(
        String modelVersion,
        String featureSchemaVersion,
        List<Tree> trees) implements ModelArtifact {

    @Override
    public double predict(FeatureVector vector) {
        double sum = 0.0;
        for (Tree tree : trees) {
            sum += tree.predict(vector);
        }
        return trees.isEmpty() ? 0.0 : sum / trees.size();
    }

    /**
     * Flattened tree. Node {@code i} is a leaf when {@code slot[i] < 0}; otherwise
     * the walk goes left when {@code value <= threshold[i]}. Child indices are
     * strictly greater than their parent's, which the loader enforces.
     */
    record Tree(int[] slot, double[] threshold, int[] left, int[] right, double[] probability) {

        double predict(FeatureVector vector) {
            int node = 0;
            while (slot[node] >= 0) {
                node = vector.get(slot[node]) <= threshold[node] ? left[node] : right[node];
            }
            return probability[node];
        }
    }
}
