package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

/**
 * Result of the per-event analysis pass, attached to the event once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DerivedAnalysis {

    private double confidence;

    @Singular
    private List<String> insights;

    @Singular
    private List<String> recommendations;

    @Singular
    private List<Anomaly> anomalies;

    @Singular
    private List<Prediction> predictions;
}
