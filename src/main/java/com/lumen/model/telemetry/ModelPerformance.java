package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelPerformance {

    private double accuracy;
    private double precision;
    private double recall;
    private double f1Score;

    /**
     * Number of feedback records folded into {@link #feedbackAccuracy}.
     */
    private long feedbackSamples;

    private double feedbackAccuracy;

    private Instant lastUpdated;
}
