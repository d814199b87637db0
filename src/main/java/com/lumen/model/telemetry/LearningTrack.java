package com.lumen.model.telemetry;

import java.util.List;

/**
 * Independent learning tracks maintained by the model registry.
 */
public enum LearningTrack {
    PERFORMANCE_REGRESSION("Performance Prediction Model", ModelType.REGRESSION,
            List.of("duration", "resourceUsage", "operationType")),
    ANOMALY_DETECTION("Anomaly Detection Model", ModelType.ANOMALY_DETECTION,
            List.of("duration", "errorRate", "resourceUsage")),
    USAGE_CLUSTERING("Usage Pattern Model", ModelType.CLUSTERING,
            List.of("operationType", "timeOfDay", "source")),
    ERROR_CLASSIFICATION("Error Prediction Model", ModelType.CLASSIFICATION,
            List.of("operationType", "resourceUsage", "previousErrors"));

    private final String displayName;
    private final ModelType modelType;
    private final List<String> features;

    LearningTrack(String displayName, ModelType modelType, List<String> features) {
        this.displayName = displayName;
        this.modelType = modelType;
        this.features = features;
    }

    public String getDisplayName() {
        return displayName;
    }

    public ModelType getModelType() {
        return modelType;
    }

    public List<String> getFeatures() {
        return features;
    }
}
