package com.lumen.service.telemetry;

import com.lumen.config.LumenProperties;
import com.lumen.model.telemetry.AnalysisKind;
import com.lumen.model.telemetry.Anomaly;
import com.lumen.model.telemetry.DerivedAnalysis;
import com.lumen.model.telemetry.Prediction;
import com.lumen.model.telemetry.Severity;
import com.lumen.model.telemetry.TelemetryEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Per-event analysis pass run by the telemetry drain.
 * Applies fixed thresholds to one event; no history is consulted.
 */
@Component
public class EventAnalyzer {

    static final double ANALYSIS_CONFIDENCE = 0.85;
    static final double PREDICTION_GROWTH = 1.1;

    private final LumenProperties.TelemetryConfig config;

    public EventAnalyzer(LumenProperties properties) {
        this.config = properties.getTelemetry();
    }

    public DerivedAnalysis analyze(TelemetryEvent event) {
        DerivedAnalysis.DerivedAnalysisBuilder analysis = DerivedAnalysis.builder()
                .confidence(ANALYSIS_CONFIDENCE);

        long duration = event.durationMs();
        if (duration > config.getSlowOperationThresholdMs()) {
            analysis.insight("Operation took longer than expected")
                    .recommendation("Consider optimizing the operation");
        }

        if (duration > config.getAnomalyDurationThresholdMs()) {
            analysis.anomaly(Anomaly.builder()
                    .id(UUID.randomUUID().toString())
                    .type(AnalysisKind.PERFORMANCE)
                    .severity(Severity.HIGH)
                    .description("Unusually long operation duration")
                    .eventId(event.getId())
                    .threshold(config.getAnomalyDurationThresholdMs())
                    .actualValue(duration)
                    .confidence(0.9)
                    .recommendations(List.of("Investigate performance issue", "Consider optimization"))
                    .build());
        }

        if (event.getData() != null && event.getData().getResourceUsage() != null
                && event.getData().getResourceUsage().getCpu() > config.getHighCpuThreshold()) {
            analysis.insight("High CPU usage detected")
                    .recommendation("Monitor system resources");
        }

        if (event.hasError()) {
            analysis.insight("Error occurred during operation")
                    .recommendation("Review error handling");
        }

        analysis.prediction(Prediction.builder()
                .id(UUID.randomUUID().toString())
                .type(AnalysisKind.PERFORMANCE)
                .metric("operation_duration")
                .value(duration * PREDICTION_GROWTH)
                .confidence(0.8)
                .timeframe("1h")
                .factors(List.of("current_load", "resource_usage"))
                .build());

        return analysis.build();
    }
}
