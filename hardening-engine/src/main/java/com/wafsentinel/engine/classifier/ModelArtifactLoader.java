package com.wafsentinel.engine.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wafsentinel.engine.feature.FeatureSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Reads JSON model artifacts.
 *
 * <p>
 * Supported layouts:
 * </p>
 *
 * <pre>
 * { "type": "logistic", "modelVersion": "...", "featureSchemaVersion": "waf-features/1",
 *   "bias": -2.1, "weights": { "uri_special_char_ratio": 3.4, ... } }
 *
 * { "type": "random-forest", "modelVersion": "...", "featureSchemaVersion": "waf-features/1",
 *   "trees": [ { "nodes": [ { "feature": "rules_pl3", "threshold": 0.5, "left": 1, "right": 2 },
 *                           { "probability": 0.04 }, { "probability": 0.97 } ] } ] }
 * </pre>
 *
 * @author WAF Sentinel Team
 */
public class ModelArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactLoader.class);

    private final ObjectMapper objectMapper;

    public ModelArtifactLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load an artifact from disk.
     *
     * @throws ModelLoadException if the file is missing, unreadable or invalid
     */
    public ModelArtifact load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            ModelArtifact artifact = load(in);
            log.info("Loaded model {} ({}) from {}", artifact.modelVersion(), artifact.featureSchemaVersion(), path);
            return artifact;
        } catch (NoSuchFileException e) {
            throw new ModelLoadException("Model artifact not found: " + path, e);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read model artifact " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load an artifact from a stream.
     *
     * @throws ModelLoadException if the content is not a valid artifact
     */
    public ModelArtifact load(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new ModelLoadException("Corrupt model artifact: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ModelLoadException("Corrupt model artifact: expected a JSON object");
        }

        String modelVersion = requiredText(root, "modelVersion");
        String schemaVersion = requiredText(root, "featureSchemaVersion");
        FeatureSchema schema;
        try {
            schema = FeatureSchema.forVersion(schemaVersion);
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException("Model " + modelVersion + " declares unsupported feature schema " + schemaVersion, e);
        }

        String type = requiredText(root, "type");
        return switch (type) {
            case "logistic" -> logistic(root, modelVersion, schema);
            case "random-forest" -> randomForest(root, modelVersion, schema);
            default -> throw new ModelLoadException("Unknown model type '" + type + "' in " + modelVersion);
        };
    }

    private LogisticRegressionModel logistic(JsonNode root, String modelVersion, FeatureSchema schema) {
        JsonNode weightsNode = root.path("weights");
        if (!weightsNode.isObject()) {
            throw new ModelLoadException("Logistic model " + modelVersion + " has no weights object");
        }
        double[] weights = new double[schema.size()];
        Iterator<Map.Entry<String, JsonNode>> fields = weightsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            weights[slot(schema, field.getKey(), modelVersion)] = number(field.getValue(), "weight " + field.getKey());
        }
        return new LogisticRegressionModel(modelVersion, schema.version(), weights, number(root.path("bias"), "bias"));
    }

    private RandomForestModel randomForest(JsonNode root, String modelVersion, FeatureSchema schema) {
        JsonNode treesNode = root.path("trees");
        if (!treesNode.isArray() || treesNode.isEmpty()) {
            throw new ModelLoadException("Random forest " + modelVersion + " has no trees");
        }
        List<RandomForestModel.Tree> trees = new ArrayList<>();
        for (JsonNode treeNode : treesNode) {
            trees.add(tree(treeNode.path("nodes"), modelVersion, schema, trees.size()));
        }
        return new RandomForestModel(modelVersion, schema.version(), List.copyOf(trees));
    }

    private RandomForestModel.Tree tree(JsonNode nodes, String modelVersion, FeatureSchema schema, int treeIndex) {
        if (!nodes.isArray() || nodes.isEmpty()) {
            throw new ModelLoadException("Tree " + treeIndex + " of " + modelVersion + " has no nodes");
        }
        int n = nodes.size();
        int[] slot = new int[n];
        double[] threshold = new double[n];
        int[] left = new int[n];
        int[] right = new int[n];
        double[] probability = new double[n];

        for (int i = 0; i < n; i++) {
            JsonNode node = nodes.get(i);
            if (node.has("probability")) {
                slot[i] = -1;
                probability[i] = number(node.path("probability"), "leaf probability");
                if (probability[i] < 0.0 || probability[i] > 1.0) {
                    throw new ModelLoadException("Leaf probability out of range in tree " + treeIndex + " node " + i);
                }
                continue;
            }
            slot[i] = slot(schema, requiredText(node, "feature"), modelVersion);
            threshold[i] = number(node.path("threshold"), "threshold");
            left[i] = child(node.path("left"), i, n, treeIndex);
            right[i] = child(node.path("right"), i, n, treeIndex);
        }
        return new RandomForestModel.Tree(slot, threshold, left, right, probability);
    }

    private static int child(JsonNode node, int parent, int size, int treeIndex) {
        if (!node.canConvertToInt()) {
            throw new ModelLoadException("Missing child index in tree " + treeIndex + " node " + parent);
        }
        int child = node.asInt();
        if (child <= parent || child >= size) {
            throw new ModelLoadException("Invalid child index " + child + " in tree " + treeIndex + " node " + parent);
        }
        return child;
    }

    private static int slot(FeatureSchema schema, String feature, String modelVersion) {
        OptionalInt slot = schema.slotOf(feature);
        if (slot.isEmpty()) {
            throw new ModelLoadException("Model " + modelVersion + " references unknown feature '" + feature + "'");
        }
        return slot.getAsInt();
    }

    private static double number(JsonNode node, String what) {
        if (!node.isNumber()) {
            throw new ModelLoadException("Expected numeric " + what);
        }
        return node.asDouble();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ModelLoadException("Model artifact is missing '" + field + "'");
        }
        return value.asText();
    }
}
