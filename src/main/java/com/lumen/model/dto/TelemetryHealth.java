package com.lumen.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Telemetry engine health and sizes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryHealth {

    private String status;
    private int events;
    private int feedback;
    private int models;
    private int insights;
    private int patterns;
    private int anomalies;
    private int queueLength;
    private long droppedEvents;
    private boolean processing;
    private long processedEvents;
    private long analysisFailures;
}
