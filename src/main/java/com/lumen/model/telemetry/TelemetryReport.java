package com.lumen.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryReport {

    private String id;
    private Instant timestamp;

    /**
     * Timeframe the report covers, e.g. "24h".
     */
    private String period;

    private TelemetrySummary summary;
    private List<TelemetryInsight> insights;
    private List<Pattern> patterns;
    private List<Anomaly> anomalies;
    private List<Trend> trends;
    private List<Prediction> predictions;
    private List<String> recommendations;
    private List<String> actions;
}
