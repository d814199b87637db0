package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Aggregate figures for one analysis window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetrySummary {

    private long totalEvents;

    private Map<TelemetryEventType, Long> eventTypes;

    private double averageConfidence;

    /**
     * Fraction of events carrying an error (0.0-1.0).
     */
    private double errorRate;

    /**
     * One minus the fraction of slow operations (0.0-1.0).
     */
    private double performanceScore;

    /**
     * Mean accuracy of feedback received so far; 0 when there is none.
     */
    private double feedbackAccuracy;
}
