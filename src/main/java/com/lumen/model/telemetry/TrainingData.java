package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Description of the telemetry a model version was trained on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingData {

    private long samples;
    private int features;
    private double errorRate;
    private double meanDurationMs;
    private List<String> sources;
}
