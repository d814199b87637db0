package com.lumen.model.telemetry;

/**
 * Lifecycle of a learning model version.
 * TRAINING -> ACTIVE -> (INACTIVE | DEPRECATED); a new TRAINING version only comes from a retrain.
 */
public enum ModelStatus {
    TRAINING,
    ACTIVE,
    INACTIVE,
    DEPRECATED;

    public boolean canTransitionTo(ModelStatus target) {
        switch (this) {
            case TRAINING:
                return target == ACTIVE;
            case ACTIVE:
                return target == INACTIVE || target == DEPRECATED;
            case INACTIVE:
                return target == DEPRECATED;
            default:
                return false;
        }
    }
}
