package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One version of a learning model in the registry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LearningModel {

    private String id;
    private String name;
    private LearningTrack track;
    private ModelType type;
    private String version;
    private ModelStatus status;
    private ModelPerformance performance;
    private List<String> features;
    private Map<String, Object> hyperparameters;
    private TrainingData trainingData;
    private Instant lastTrained;
    private Instant nextRetrain;

    /**
     * Move to {@code target}, rejecting transitions the lifecycle does not allow.
     */
    public void transitionTo(ModelStatus target) {
        if (status != null && !status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Model " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }
}
