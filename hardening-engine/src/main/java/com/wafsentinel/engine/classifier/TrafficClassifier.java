package com.wafsentinel.engine.classifier;

import com.wafsentinel.engine.feature.FeatureVector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Thread-safe wrapper around a loaded {@link ModelArtifact}.
 *
 * <p>
 * The artifact is read-only after load, so one instance is shared by every
 * classification worker. Confidence is the model's malicious-class probability
 * and the label is {@code MALICIOUS} when it reaches the configured threshold.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class TrafficClassifier {

    private final ModelArtifact model;
    private final double threshold;
    private final MeterRegistry meterRegistry;

    private final Counter maliciousCount;
    private final Counter benignCount;
    private final Timer latency;

    public TrafficClassifier(ModelArtifact model, double threshold, MeterRegistry meterRegistry) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Decision threshold must be in [0, 1]: " + threshold);
        }
        this.model = model;
        this.threshold = threshold;
        this.meterRegistry = meterRegistry;
        this.maliciousCount = Counter.builder("sentinel.classifier.predictions")
                .tag("label", "malicious")
                .tag("model", model.modelVersion())
                .description("Records classified malicious")
                .register(meterRegistry);
        this.benignCount = Counter.builder("sentinel.classifier.predictions")
                .tag("label", "benign")
                .tag("model", model.modelVersion())
                .description("Records classified benign")
                .register(meterRegistry);
        this.latency = Timer.builder("sentinel.classifier.latency")
                .description("Time to score one feature vector")
                .register(meterRegistry);
    }

    /**
     * Score a vector.
     *
     * @throws SchemaMismatchException if the vector's schema differs from the model's
     */
    public Classification classify(FeatureVector vector) {
        if (!model.featureSchemaVersion().equals(vector.schemaVersion())) {
            throw new SchemaMismatchException(model.featureSchemaVersion(), vector.schemaVersion());
        }
        double probability;
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            probability = model.predict(vector);
        } finally {
            sample.stop(latency);
        }
        if (Double.isNaN(probability)) {
            throw new IllegalStateException("Model " + model.modelVersion() + " produced NaN");
        }
        double confidence = Math.min(1.0, Math.max(0.0, probability));
        Label label = confidence >= threshold ? Label.MALICIOUS : Label.BENIGN;
        (label == Label.MALICIOUS ? maliciousCount : benignCount).increment();
        return new Classification(label, confidence);
    }

    public String modelVersion() {
        return model.modelVersion();
    }

    public String featureSchemaVersion() {
        return model.featureSchemaVersion();
    }

    public double threshold() {
        return threshold;
    }
}
