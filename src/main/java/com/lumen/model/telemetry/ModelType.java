package com.lumen.model.telemetry;

public enum ModelType {
    CLASSIFICATION,
    REGRESSION,
    CLUSTERING,
    ANOMALY_DETECTION
}
