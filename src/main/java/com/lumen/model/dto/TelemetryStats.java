package com.lumen.model.dto;

import com.lumen.model.telemetry.TelemetryEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Counters exposed by {@code GET /v1/telemetry/stats}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryStats {
    private String status;
    private long totalEvents;
    private long totalFeedback;
    private long totalModels;
    private long totalInsights;
    private int queueLength;
    private long droppedEvents;
    private boolean processing;
    private long processedEvents;
    private long analysisFailures;
    private Map<TelemetryEventType, Long> eventTypes;
    private double feedbackAccuracy;
}
