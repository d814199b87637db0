package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trend {

    private String id;
    private String metric;
    private TrendDirection direction;

    /**
     * Least-squares slope of the metric per event, in the metric's own unit.
     */
    private double slope;

    private double confidence;
    private String timeframe;

    /**
     * Value projected one step past the window.
     */
    private double prediction;
}
